package io.fitwatch.fit;

/**
 * FIT base types: on-wire size and the raw bit pattern that marks a value as invalid.
 */
enum FitBaseType {
    ENUM(0x00, 1, 0xFFL),
    SINT8(0x01, 1, 0x7FL),
    UINT8(0x02, 1, 0xFFL),
    SINT16(0x83, 2, 0x7FFFL),
    UINT16(0x84, 2, 0xFFFFL),
    SINT32(0x85, 4, 0x7FFFFFFFL),
    UINT32(0x86, 4, 0xFFFFFFFFL),
    STRING(0x07, 1, 0x00L),
    FLOAT32(0x88, 4, 0xFFFFFFFFL),
    FLOAT64(0x89, 8, 0xFFFFFFFFFFFFFFFFL),
    UINT8Z(0x0A, 1, 0x00L),
    UINT16Z(0x8B, 2, 0x00L),
    UINT32Z(0x8C, 4, 0x00L),
    BYTE(0x0D, 1, 0xFFL),
    SINT64(0x8E, 8, 0x7FFFFFFFFFFFFFFFL),
    UINT64(0x8F, 8, 0xFFFFFFFFFFFFFFFFL),
    UINT64Z(0x90, 8, 0x00L);

    private static final FitBaseType[] BY_NUMBER = new FitBaseType[32];

    static {
        for (FitBaseType type : values()) {
            BY_NUMBER[type.code & 0x1F] = type;
        }
    }

    private final int code;
    private final int size;
    private final long invalid;

    FitBaseType(int code, int size, long invalid) {
        this.code = code;
        this.size = size;
        this.invalid = invalid;
    }

    /**
     * Resolves a base type byte from a field definition.
     *
     * @return the type, or {@code null} if the number is not defined
     */
    static FitBaseType of(int rawType) {
        return BY_NUMBER[rawType & 0x1F];
    }

    int code() {
        return code;
    }

    int size() {
        return size;
    }

    boolean isInvalid(long raw) {
        return raw == invalid;
    }

    /**
     * Converts raw bits (already assembled from {@link #size()} bytes) into a Java value.
     */
    Object toValue(long raw) {
        return switch (this) {
            case SINT8 -> (long) (byte) raw;
            case SINT16 -> (long) (short) raw;
            case SINT32 -> (long) (int) raw;
            case FLOAT32 -> (double) Float.intBitsToFloat((int) raw);
            case FLOAT64 -> Double.longBitsToDouble(raw);
            default -> raw;
        };
    }
}
