package com.eeg.service;

import java.util.List;

/**
 * Итог обработки запроса: успех с количеством записанных отсчётов или категория ошибки.
 */
public final class IngestResult {

  /**
   * Категория результата.
   */
  public enum Outcome {
    /** Отсчёты записаны, уведомление опубликовано. */
    STORED(true),
    /** Отсчёты записаны, публикация уведомления не удалась. */
    STORED_NOTIFICATION_FAILED(true),
    /** Полных записей нет: в БД ничего не пишется, уведомление не отправляется. */
    EMPTY(true),
    VALIDATION_FAILED(false),
    DECOMPRESSION_FAILED(false),
    PERSISTENCE_FAILED(false);

    private final boolean success;

    Outcome(boolean success) {
      this.success = success;
    }

    public boolean isSuccess() {
      return success;
    }
  }

  private final Outcome outcome;
  private final int insertedRecords;
  private final int droppedBytes;
  private final IngestStage failedStage;
  private final List<String> invalidFields;

  private IngestResult(Outcome outcome, int insertedRecords, int droppedBytes,
                       IngestStage failedStage, List<String> invalidFields) {
    this.outcome = outcome;
    this.insertedRecords = insertedRecords;
    this.droppedBytes = droppedBytes;
    this.failedStage = failedStage;
    this.invalidFields = invalidFields;
  }

  public static IngestResult stored(int insertedRecords, int droppedBytes, boolean notified) {
    return new IngestResult(notified ? Outcome.STORED : Outcome.STORED_NOTIFICATION_FAILED,
        insertedRecords, droppedBytes, null, List.of());
  }

  public static IngestResult empty(int droppedBytes) {
    return new IngestResult(Outcome.EMPTY, 0, droppedBytes, null, List.of());
  }

  public static IngestResult invalid(List<String> invalidFields) {
    return new IngestResult(Outcome.VALIDATION_FAILED, 0, 0, IngestStage.RECEIVED, List.copyOf(invalidFields));
  }

  public static IngestResult failed(Outcome outcome, IngestStage failedStage) {
    if (outcome.isSuccess() || outcome == Outcome.VALIDATION_FAILED) {
      throw new IllegalArgumentException("Не категория ошибки выполнения: " + outcome);
    }
    return new IngestResult(outcome, 0, 0, failedStage, List.of());
  }

  public Outcome getOutcome() {
    return outcome;
  }

  public boolean isSuccess() {
    return outcome.isSuccess();
  }

  /**
   * @return Количество записанных отсчётов (8 на каждую полную запись устройства).
   */
  public int getInsertedRecords() {
    return insertedRecords;
  }

  /**
   * @return Хвостовые байты буфера, не образовавшие полную запись.
   */
  public int getDroppedBytes() {
    return droppedBytes;
  }

  /**
   * @return Этап, на котором произошла ошибка, или null для успешного результата.
   */
  public IngestStage getFailedStage() {
    return failedStage;
  }

  /**
   * @return Конечный этап обработки: DONE для успешного результата, FAILED для ошибки.
   */
  public IngestStage getFinalStage() {
    return outcome.isSuccess() ? IngestStage.DONE : IngestStage.FAILED;
  }

  public List<String> getInvalidFields() {
    return invalidFields;
  }

  @Override
  public String toString() {
    return "IngestResult{" + outcome + ", inserted=" + insertedRecords
        + (failedStage != null ? ", failedStage=" + failedStage : "") + "}";
  }
}
