package io.fitwatch.spi;

import java.util.Iterator;
import java.util.Map;

/**
 * Decoded view of one FIT file.
 *
 * <p>Each call to {@link #records(String)} starts a fresh decode pass; callers must not
 * assume an iterator can be rewound. Decode failures discovered while iterating surface
 * as {@link FitDecodeException.Unchecked} from {@link Iterator#next()} or
 * {@link Iterator#hasNext()}.
 */
public interface FitDecoder {

    /** Message kind holding the per-sample activity data. */
    String RECORD = "record";

    /**
     * Iterates the flat key/value mappings of every message of the given kind.
     *
     * @param kind the message kind name, e.g. {@link #RECORD}
     * @return a fresh iterator; each mapping is unmodifiable
     */
    Iterator<Map<String, Object>> records(String kind);
}
