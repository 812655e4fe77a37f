package com.eeg.mq;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

/**
 * Уведомление для SignalLab о том, что в БД записан новый блок отсчётов.
 * Сериализуется в JSON тела сообщения RabbitMQ.
 */
@JsonPropertyOrder({"type", "session_id", "user_id", "num_records", "received_at"})
public final class IngestNotification {

  /** Тип сообщения о новом сыром EEG-блоке. */
  public static final String NEW_EEG_BLOCK = "NEW_EEG_BLOCK";

  private final String sessionId;
  private final String userId;
  private final int numRecords;
  private final Instant receivedAt;

  /**
   * @param sessionId Сессия записи.
   * @param userId Пользователь.
   * @param numRecords Количество записанных отсчётов.
   * @param receivedAt Момент построения уведомления.
   */
  public IngestNotification(String sessionId, String userId, int numRecords, Instant receivedAt) {
    this.sessionId = sessionId;
    this.userId = userId;
    this.numRecords = numRecords;
    this.receivedAt = receivedAt;
  }

  @JsonProperty("type")
  public String getType() {
    return NEW_EEG_BLOCK;
  }

  @JsonProperty("session_id")
  public String getSessionId() {
    return sessionId;
  }

  @JsonProperty("user_id")
  public String getUserId() {
    return userId;
  }

  @JsonProperty("num_records")
  public int getNumRecords() {
    return numRecords;
  }

  /**
   * @return Время в ISO-8601 (UTC), как его ждут потребители.
   */
  @JsonProperty("received_at")
  public String getReceivedAt() {
    return receivedAt.toString();
  }
}
