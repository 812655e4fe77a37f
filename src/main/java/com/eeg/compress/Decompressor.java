package com.eeg.compress;

import com.eeg.exception.DecompressionException;

/**
 * Распаковка полезной нагрузки, присланной устройством.
 */
public interface Decompressor {

  /**
   * Распаковывает буфер целиком.
   *
   * @param compressed Сжатые байты.
   * @return Исходные байты.
   * @throws DecompressionException если кадр повреждён, обрезан или формат не поддерживается.
   * @throws IllegalStateException если адаптер не инициализирован.
   */
  byte[] decompress(byte[] compressed);
}
