package com.eeg.exception;

import java.util.List;

/**
 * Запрос не содержит обязательных полей или содержит недопустимые значения.
 */
public class ValidationException extends IngestionException {

  private final List<String> fields;

  /**
   * @param fields Имена отсутствующих или некорректных полей.
   */
  public ValidationException(List<String> fields) {
    super("Отсутствуют или некорректны обязательные поля: " + fields);
    this.fields = List.copyOf(fields);
  }

  public List<String> getFields() {
    return fields;
  }
}
