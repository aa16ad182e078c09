package io.fitwatch.fit;

import io.fitwatch.spi.FitDecoder;

import java.util.Iterator;
import java.util.Map;

/**
 * {@link FitDecoder} over a validated in-memory FIT file.
 */
final class BinaryFitDecoder implements FitDecoder {
    private final byte[] bytes;
    private final int dataStart;
    private final int dataEnd;

    BinaryFitDecoder(byte[] bytes, int dataStart, int dataEnd) {
        this.bytes = bytes;
        this.dataStart = dataStart;
        this.dataEnd = dataEnd;
    }

    @Override
    public Iterator<Map<String, Object>> records(String kind) {
        Integer globalNumber = FitProfile.messageNumber(kind);
        if (globalNumber == null) {
            throw new IllegalArgumentException("Unknown FIT message kind: " + kind);
        }
        return new FitMessageReader(bytes, dataStart, dataEnd, globalNumber);
    }
}
