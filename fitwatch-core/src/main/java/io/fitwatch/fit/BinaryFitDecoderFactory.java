package io.fitwatch.fit;

import io.fitwatch.spi.FitDecodeException;
import io.fitwatch.spi.FitDecodeException.Reason;
import io.fitwatch.spi.FitDecoder;
import io.fitwatch.spi.FitDecoderFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Built-in {@link FitDecoderFactory} that reads FIT files straight from disk.
 *
 * <p>{@link #open(Path)} loads the file, validates the header and both CRCs, and returns a
 * decoder that parses the message stream lazily on every {@link FitDecoder#records} call.
 * Only the first FIT file of a chained file is read.
 */
public final class BinaryFitDecoderFactory implements FitDecoderFactory {
    static final int MIN_HEADER_SIZE = 12;
    private static final int CRC_SIZE = 2;
    private static final int MAX_PROTOCOL_MAJOR = 2;
    private static final byte[] SIGNATURE = ".FIT".getBytes(StandardCharsets.US_ASCII);

    @Override
    public FitDecoder open(Path path) throws IOException, FitDecodeException {
        return decode(Files.readAllBytes(path));
    }

    /**
     * Validates an in-memory FIT file.
     *
     * @param bytes the whole file
     * @return a decoder over {@code bytes}
     * @throws FitDecodeException if the header or CRC is invalid
     */
    public FitDecoder decode(byte[] bytes) throws FitDecodeException {
        if (bytes.length < MIN_HEADER_SIZE) {
            throw new FitDecodeException(Reason.TRUNCATED,
                    "File is " + bytes.length + " bytes, smaller than a FIT header");
        }
        int headerSize = bytes[0] & 0xFF;
        if (headerSize < MIN_HEADER_SIZE || headerSize > bytes.length) {
            throw new FitDecodeException(Reason.DECODE, "Invalid header size " + headerSize);
        }
        for (int i = 0; i < SIGNATURE.length; i++) {
            if (bytes[8 + i] != SIGNATURE[i]) {
                throw new FitDecodeException(Reason.DECODE, "Missing .FIT signature");
            }
        }
        int protocolMajor = (bytes[1] & 0xFF) >> 4;
        if (protocolMajor > MAX_PROTOCOL_MAJOR) {
            throw new FitDecodeException(Reason.UNSUPPORTED,
                    "Unsupported protocol version " + protocolMajor + "." + (bytes[1] & 0x0F));
        }
        long dataSize = (bytes[4] & 0xFFL)
                | (bytes[5] & 0xFFL) << 8
                | (bytes[6] & 0xFFL) << 16
                | (bytes[7] & 0xFFL) << 24;
        long dataEnd = headerSize + dataSize;
        if (dataEnd + CRC_SIZE > bytes.length) {
            throw new FitDecodeException(Reason.TRUNCATED,
                    "Header declares " + dataSize + " data bytes but file has " + (bytes.length - headerSize));
        }
        if (headerSize >= 14) {
            int headerCrc = (bytes[12] & 0xFF) | (bytes[13] & 0xFF) << 8;
            if (headerCrc != 0 && headerCrc != FitCrc.compute(bytes, 0, 12)) {
                throw new FitDecodeException(Reason.CRC, "Header CRC mismatch");
            }
        }
        int end = (int) dataEnd;
        int storedCrc = (bytes[end] & 0xFF) | (bytes[end + 1] & 0xFF) << 8;
        int computedCrc = FitCrc.compute(bytes, 0, end);
        if (storedCrc != computedCrc) {
            throw new FitDecodeException(Reason.CRC, String.format(
                    "File CRC mismatch: stored 0x%04X, computed 0x%04X", storedCrc, computedCrc));
        }
        return new BinaryFitDecoder(bytes, headerSize, end);
    }
}
