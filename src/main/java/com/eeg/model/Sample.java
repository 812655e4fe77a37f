package com.eeg.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Один отсчёт одного EEG-канала, полученный из записи устройства.
 * <p>
 * Единица хранения в таблице bio_signal_raw. Неизменяемый.
 */
public final class Sample {

  private final Instant serverReceivedAt;
  private final String sessionId;
  private final String userId;
  private final String deviceId;
  private final String channelName;
  private final int value;
  private final long deviceTimestampUs;

  public Sample(Instant serverReceivedAt, String sessionId, String userId, String deviceId,
                String channelName, int value, long deviceTimestampUs) {
    this.serverReceivedAt = Objects.requireNonNull(serverReceivedAt, "serverReceivedAt");
    this.sessionId = sessionId;
    this.userId = userId;
    this.deviceId = deviceId;
    this.channelName = Objects.requireNonNull(channelName, "channelName");
    this.value = value;
    this.deviceTimestampUs = deviceTimestampUs;
  }

  /**
   * @return Время приёма блока сервером (назначается при декодировании).
   */
  public Instant getServerReceivedAt() {
    return serverReceivedAt;
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

  /**
   * @return Имя канала: Fp1, Fp2, F7, F8, T7, T8, P7 или P8.
   */
  public String getChannelName() {
    return channelName;
  }

  /**
   * @return Сырое беззнаковое 16-битное значение канала (0–65535).
   */
  public int getValue() {
    return value;
  }

  /**
   * @return Локальная метка времени устройства в микросекундах (беззнаковое 32-битное).
   */
  public long getDeviceTimestampUs() {
    return deviceTimestampUs;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Sample)) {
      return false;
    }
    Sample other = (Sample) o;
    return value == other.value
        && deviceTimestampUs == other.deviceTimestampUs
        && serverReceivedAt.equals(other.serverReceivedAt)
        && Objects.equals(sessionId, other.sessionId)
        && Objects.equals(userId, other.userId)
        && Objects.equals(deviceId, other.deviceId)
        && channelName.equals(other.channelName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(serverReceivedAt, sessionId, userId, deviceId, channelName, value, deviceTimestampUs);
  }

  @Override
  public String toString() {
    return "Sample{" + channelName + "=" + value + ", device_ts_us=" + deviceTimestampUs
        + ", session=" + sessionId + ", received_at=" + serverReceivedAt + "}";
  }
}
