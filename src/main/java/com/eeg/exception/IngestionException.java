package com.eeg.exception;

/**
 * Базовое исключение конвейера приёма EEG-блоков.
 * <p>
 * Любое исключение этой иерархии прерывает обработку запроса.
 */
public class IngestionException extends RuntimeException {

  public IngestionException(String message) {
    super(message);
  }

  public IngestionException(String message, Throwable cause) {
    super(message, cause);
  }
}
