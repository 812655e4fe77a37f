package com.eeg.codec;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Построение синтетических записей устройства в формате {@link RecordLayout#V1} для тестов.
 */
public final class DeviceRecords {

  public static final int SIZE = 68;

  private final ByteArrayOutputStream out = new ByteArrayOutputStream();

  public static DeviceRecords builder() {
    return new DeviceRecords();
  }

  /**
   * Добавляет запись; IMU заполняется ненулевыми float, чтобы проверить, что они не влияют на каналы.
   */
  public DeviceRecords record(int[] channels, long timestampUs) {
    if (channels.length != 8) {
      throw new IllegalArgumentException("Нужно 8 значений каналов");
    }
    ByteBuffer buf = ByteBuffer.allocate(SIZE).order(ByteOrder.LITTLE_ENDIAN);
    for (int value : channels) {
      buf.putShort((short) value);
    }
    for (int i = 0; i < 12; i++) {
      buf.putFloat(-1.5f * (i + 1));
    }
    buf.putInt((int) timestampUs);
    out.writeBytes(buf.array());
    return this;
  }

  public DeviceRecords trailing(int bytes) {
    out.writeBytes(new byte[bytes]);
    return this;
  }

  public byte[] build() {
    return out.toByteArray();
  }

  private DeviceRecords() {}
}
