package io.fitwatch.fit;

/**
 * CRC-16 used by the FIT protocol for the file header and the whole-file trailer.
 */
final class FitCrc {
    private static final int[] TABLE = {
        0x0000, 0xCC01, 0xD801, 0x1400, 0xF001, 0x3C00, 0x2800, 0xE401,
        0xA001, 0x6C00, 0x7800, 0xB401, 0x5000, 0x9C01, 0x8801, 0x4400
    };

    private FitCrc() {
    }

    static int update(int crc, int b) {
        int tmp = TABLE[crc & 0xF];
        crc = (crc >> 4) & 0x0FFF;
        crc = crc ^ tmp ^ TABLE[b & 0xF];
        tmp = TABLE[crc & 0xF];
        crc = (crc >> 4) & 0x0FFF;
        return crc ^ tmp ^ TABLE[(b >> 4) & 0xF];
    }

    static int compute(byte[] data, int offset, int length) {
        int crc = 0;
        for (int i = offset; i < offset + length; i++) {
            crc = update(crc, data[i] & 0xFF);
        }
        return crc;
    }
}
