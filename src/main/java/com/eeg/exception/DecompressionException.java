package com.eeg.exception;

/**
 * Полезную нагрузку не удалось декодировать из base64 или распаковать zstd.
 */
public class DecompressionException extends IngestionException {

  public DecompressionException(String message) {
    super(message);
  }

  public DecompressionException(String message, Throwable cause) {
    super(message, cause);
  }
}
