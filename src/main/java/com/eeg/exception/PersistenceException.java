package com.eeg.exception;

/**
 * Пакетная запись отсчётов в БД не выполнена; транзакция откатана.
 */
public class PersistenceException extends IngestionException {

  public PersistenceException(String message, Throwable cause) {
    super(message, cause);
  }
}
