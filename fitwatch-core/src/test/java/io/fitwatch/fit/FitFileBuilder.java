package io.fitwatch.fit;

import java.io.ByteArrayOutputStream;
import java.util.HashMap;
import java.util.Map;

/**
 * Assembles FIT files byte by byte for decoder and pipeline tests. Header and file CRCs are
 * computed on {@link #build()}.
 */
public final class FitFileBuilder {
  public static final int GLOBAL_FILE_ID = 0;
  public static final int GLOBAL_RECORD = 20;

  public static final int[] TIMESTAMP = {253, 4, 0x86};
  public static final int[] POSITION_LAT = {0, 4, 0x85};
  public static final int[] POSITION_LONG = {1, 4, 0x85};
  public static final int[] HEART_RATE = {3, 1, 0x02};
  public static final int[] CADENCE = {4, 1, 0x02};
  public static final int[] DISTANCE = {5, 4, 0x86};
  public static final int[] SPEED = {6, 2, 0x84};
  public static final int[] ENHANCED_SPEED = {73, 4, 0x86};

  private final ByteArrayOutputStream data = new ByteArrayOutputStream();
  private final Map<Integer, Layout> layouts = new HashMap<>();

  public FitFileBuilder define(int localType, int global, int[]... fields) {
    return define(localType, global, false, fields);
  }

  public FitFileBuilder defineBigEndian(int localType, int global, int[]... fields) {
    return define(localType, global, true, fields);
  }

  private FitFileBuilder define(int localType, int global, boolean bigEndian, int[]... fields) {
    data.write(0x40 | localType);
    data.write(0);
    data.write(bigEndian ? 1 : 0);
    writeValue(global, 2, bigEndian);
    data.write(fields.length);
    int[] sizes = new int[fields.length];
    for (int i = 0; i < fields.length; i++) {
      data.write(fields[i][0]);
      data.write(fields[i][1]);
      data.write(fields[i][2]);
      sizes[i] = fields[i][1];
    }
    layouts.put(localType, new Layout(sizes, bigEndian));
    return this;
  }

  /** Definition with developer fields; the developer data bytes are appended by {@link #data}. */
  public FitFileBuilder defineWithDeveloperField(int localType, int global, int devSize, int[]... fields) {
    data.write(0x40 | 0x20 | localType);
    data.write(0);
    data.write(0);
    writeValue(global, 2, false);
    data.write(fields.length);
    int[] sizes = new int[fields.length + 1];
    for (int i = 0; i < fields.length; i++) {
      data.write(fields[i][0]);
      data.write(fields[i][1]);
      data.write(fields[i][2]);
      sizes[i] = fields[i][1];
    }
    data.write(1);
    data.write(0);
    data.write(devSize);
    data.write(0);
    sizes[fields.length] = devSize;
    layouts.put(localType, new Layout(sizes, false));
    return this;
  }

  /** Data message; one value per defined field, in definition order. */
  public FitFileBuilder data(int localType, long... values) {
    data.write(localType);
    return values(localType, values);
  }

  /** Data message with a compressed-timestamp header. */
  public FitFileBuilder compressed(int localType, int timeOffset, long... values) {
    data.write(0x80 | (localType << 5) | (timeOffset & 0x1F));
    return values(localType, values);
  }

  public FitFileBuilder raw(int... bytes) {
    for (int b : bytes) {
      data.write(b);
    }
    return this;
  }

  private FitFileBuilder values(int localType, long... values) {
    Layout layout = layouts.get(localType);
    if (layout == null || layout.sizes().length != values.length) {
      throw new IllegalArgumentException("values do not match definition of local type " + localType);
    }
    for (int i = 0; i < values.length; i++) {
      writeValue(values[i], layout.sizes()[i], layout.bigEndian());
    }
    return this;
  }

  private void writeValue(long value, int size, boolean bigEndian) {
    for (int i = 0; i < size; i++) {
      int shift = bigEndian ? 8 * (size - 1 - i) : 8 * i;
      data.write((int) (value >>> shift) & 0xFF);
    }
  }

  public byte[] build() {
    byte[] body = data.toByteArray();
    byte[] file = new byte[14 + body.length + 2];
    file[0] = 14;
    file[1] = 0x20;
    file[2] = (byte) 0x54;
    file[3] = (byte) 0x08;
    file[4] = (byte) body.length;
    file[5] = (byte) (body.length >>> 8);
    file[6] = (byte) (body.length >>> 16);
    file[7] = (byte) (body.length >>> 24);
    file[8] = '.';
    file[9] = 'F';
    file[10] = 'I';
    file[11] = 'T';
    int headerCrc = FitCrc.compute(file, 0, 12);
    file[12] = (byte) headerCrc;
    file[13] = (byte) (headerCrc >>> 8);
    System.arraycopy(body, 0, file, 14, body.length);
    int crc = FitCrc.compute(file, 0, 14 + body.length);
    file[14 + body.length] = (byte) crc;
    file[15 + body.length] = (byte) (crc >>> 8);
    return file;
  }

  private record Layout(int[] sizes, boolean bigEndian) {
  }
}
