package io.fitwatch.fit;

import io.fitwatch.spi.FitDecodeException;
import io.fitwatch.spi.FitDecodeException.Reason;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Single forward pass over the data section of a FIT file, yielding the data messages
 * of one global message number as field-name to value maps.
 *
 * <p>Invalid field values are omitted from the map. Developer fields are skipped.
 * Compressed-timestamp headers contribute a {@code timestamp} entry.
 */
final class FitMessageReader implements Iterator<Map<String, Object>> {
    private static final int COMPRESSED_HEADER = 0x80;
    private static final int DEFINITION_FLAG = 0x40;
    private static final int DEVELOPER_FLAG = 0x20;
    private static final int LOCAL_TYPE_MASK = 0x0F;
    private static final int TIME_OFFSET_MASK = 0x1F;

    private final byte[] bytes;
    private final int end;
    private final int target;
    private final Definition[] definitions = new Definition[16];

    private int pos;
    private long lastTimestamp = -1;
    private Map<String, Object> next;

    FitMessageReader(byte[] bytes, int start, int end, int target) {
        this.bytes = bytes;
        this.pos = start;
        this.end = end;
        this.target = target;
    }

    @Override
    public boolean hasNext() {
        if (next == null) {
            try {
                next = advance();
            } catch (FitDecodeException e) {
                pos = end;
                throw new FitDecodeException.Unchecked(e);
            }
        }
        return next != null;
    }

    @Override
    public Map<String, Object> next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Map<String, Object> result = next;
        next = null;
        return result;
    }

    private Map<String, Object> advance() throws FitDecodeException {
        while (pos < end) {
            int header = u8();
            if ((header & COMPRESSED_HEADER) != 0) {
                int localType = (header >> 5) & 0x03;
                int offset = header & TIME_OFFSET_MASK;
                Long timestamp = null;
                if (lastTimestamp >= 0) {
                    long base = lastTimestamp & ~TIME_OFFSET_MASK;
                    if (offset < (lastTimestamp & TIME_OFFSET_MASK)) {
                        base += 0x20;
                    }
                    lastTimestamp = base + offset;
                    timestamp = lastTimestamp;
                }
                Map<String, Object> values = readData(definition(localType), timestamp);
                if (values != null) {
                    return values;
                }
            } else if ((header & DEFINITION_FLAG) != 0) {
                definitions[header & LOCAL_TYPE_MASK] = readDefinition((header & DEVELOPER_FLAG) != 0);
            } else {
                Map<String, Object> values = readData(definition(header & LOCAL_TYPE_MASK), null);
                if (values != null) {
                    return values;
                }
            }
        }
        return null;
    }

    private Definition definition(int localType) throws FitDecodeException {
        Definition definition = definitions[localType];
        if (definition == null) {
            throw new FitDecodeException(Reason.DECODE,
                    "Data message at offset " + (pos - 1) + " uses undefined local type " + localType);
        }
        return definition;
    }

    private Definition readDefinition(boolean hasDeveloperFields) throws FitDecodeException {
        require(5);
        pos++; // reserved
        boolean bigEndian = u8() == 1;
        int global = (int) raw(pos, 2, bigEndian);
        pos += 2;
        int fieldCount = u8();
        require(fieldCount * 3);
        FieldDef[] fields = new FieldDef[fieldCount];
        for (int i = 0; i < fieldCount; i++) {
            int number = u8();
            int size = u8();
            int baseType = u8();
            fields[i] = new FieldDef(number, size, FitBaseType.of(baseType));
        }
        int developerSize = 0;
        if (hasDeveloperFields) {
            require(1);
            int devCount = u8();
            require(devCount * 3);
            for (int i = 0; i < devCount; i++) {
                pos++;
                developerSize += u8();
                pos++;
            }
        }
        return new Definition(global, bigEndian, fields, developerSize);
    }

    /**
     * Reads one data message. Returns {@code null} when the message is not of the target kind.
     */
    private Map<String, Object> readData(Definition definition, Long compressedTimestamp) throws FitDecodeException {
        require(definition.dataSize());
        boolean wanted = definition.global() == target;
        Map<String, Object> values = wanted ? new LinkedHashMap<>() : null;
        for (FieldDef field : definition.fields()) {
            if (field.number() == FitProfile.TIMESTAMP_FIELD && field.size() == 4) {
                long raw = raw(pos, 4, definition.bigEndian());
                if (raw != 0xFFFFFFFFL) {
                    lastTimestamp = raw;
                }
            }
            if (wanted) {
                Object value = decodeField(field, definition.bigEndian());
                if (value != null) {
                    values.put(FitProfile.fieldName(target, field.number()),
                            FitProfile.apply(target, field.number(), value));
                }
            }
            pos += field.size();
        }
        pos += definition.developerSize();
        if (!wanted) {
            return null;
        }
        if (compressedTimestamp != null) {
            values.putIfAbsent("timestamp", FitProfile.toDateTime(compressedTimestamp));
        }
        return Collections.unmodifiableMap(values);
    }

    private Object decodeField(FieldDef field, boolean bigEndian) {
        FitBaseType type = field.type();
        int size = field.size();
        if (type == null || size == 0) {
            return null;
        }
        if (type == FitBaseType.STRING) {
            int length = 0;
            while (length < size && bytes[pos + length] != 0) {
                length++;
            }
            return length == 0 ? null : new String(bytes, pos, length, StandardCharsets.UTF_8);
        }
        if (size % type.size() != 0) {
            return Arrays.copyOfRange(bytes, pos, pos + size);
        }
        int count = size / type.size();
        if (count == 1) {
            long raw = raw(pos, size, bigEndian);
            return type.isInvalid(raw) ? null : type.toValue(raw);
        }
        Object[] elements = new Object[count];
        boolean any = false;
        for (int i = 0; i < count; i++) {
            long raw = raw(pos + i * type.size(), type.size(), bigEndian);
            if (!type.isInvalid(raw)) {
                elements[i] = type.toValue(raw);
                any = true;
            }
        }
        return any ? elements : null;
    }

    private long raw(int offset, int size, boolean bigEndian) {
        long value = 0;
        for (int i = 0; i < size; i++) {
            int b = bytes[offset + i] & 0xFF;
            if (bigEndian) {
                value = (value << 8) | b;
            } else {
                value |= (long) b << (8 * i);
            }
        }
        return value;
    }

    private int u8() {
        return bytes[pos++] & 0xFF;
    }

    private void require(int count) throws FitDecodeException {
        if (pos + count > end) {
            throw new FitDecodeException(Reason.TRUNCATED,
                    "Message at offset " + pos + " needs " + count + " bytes, only " + (end - pos) + " remain");
        }
    }

    private record FieldDef(int number, int size, FitBaseType type) {
    }

    private record Definition(int global, boolean bigEndian, FieldDef[] fields, int developerSize) {
        int dataSize() {
            int total = developerSize;
            for (FieldDef field : fields) {
                total += field.size();
            }
            return total;
        }
    }
}
