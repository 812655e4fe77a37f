package com.eeg.codec;

import java.nio.ByteBuffer;

/**
 * Тип поля двоичной записи устройства. Все типы little-endian.
 */
public enum FieldType {

  /** Беззнаковое 16-битное целое, 0–65535. */
  UINT16_LE(2) {
    @Override
    double read(ByteBuffer buffer, int offset) {
      return buffer.getShort(offset) & 0xFFFF;
    }
  },

  /** Беззнаковое 32-битное целое, 0–4294967295. */
  UINT32_LE(4) {
    @Override
    double read(ByteBuffer buffer, int offset) {
      return buffer.getInt(offset) & 0xFFFFFFFFL;
    }
  },

  /** IEEE 754 single precision. */
  FLOAT32_LE(4) {
    @Override
    double read(ByteBuffer buffer, int offset) {
      return buffer.getFloat(offset);
    }
  };

  private final int width;

  FieldType(int width) {
    this.width = width;
  }

  /**
   * @return Ширина поля в байтах.
   */
  public int width() {
    return width;
  }

  /**
   * Читает значение по абсолютному смещению. Буфер должен быть в порядке LITTLE_ENDIAN.
   * Беззнаковые значения возвращаются без расширения знака; double вмещает uint32 без потерь.
   */
  abstract double read(ByteBuffer buffer, int offset);
}
