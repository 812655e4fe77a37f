package com.eeg.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Метаданные запроса, общие для всех отсчётов одного блока.
 */
public final class SampleContext {

  private final String sessionId;
  private final String userId;
  private final String deviceId;
  private final Instant receivedAt;

  public SampleContext(String sessionId, String userId, String deviceId, Instant receivedAt) {
    this.sessionId = sessionId;
    this.userId = userId;
    this.deviceId = deviceId;
    this.receivedAt = Objects.requireNonNull(receivedAt, "receivedAt");
  }

  public String getSessionId() {
    return sessionId;
  }

  public String getUserId() {
    return userId;
  }

  public String getDeviceId() {
    return deviceId;
  }

  public Instant getReceivedAt() {
    return receivedAt;
  }
}
