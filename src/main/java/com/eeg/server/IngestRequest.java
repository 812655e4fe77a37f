package com.eeg.server;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Класс для хранения EEG-блока, полученного от устройства.
 * Используется для десериализации JSON-запроса POST /upload/eeg.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IngestRequest {

  private String user_id;
  private String device_id;
  private String session_id;
  private Integer sampling_rate_hz;
  private String payload_zstd;

  /**
   * Конструктор по умолчанию. Обязателен для работы с Jackson.
   */
  public IngestRequest() {}

  public IngestRequest(String user_id, String device_id, String session_id,
                       Integer sampling_rate_hz, String payload_zstd) {
    this.user_id = user_id;
    this.device_id = device_id;
    this.session_id = session_id;
    this.sampling_rate_hz = sampling_rate_hz;
    this.payload_zstd = payload_zstd;
  }

  public String getUser_id() {
    return user_id;
  }

  public void setUser_id(String user_id) {
    this.user_id = user_id;
  }

  public String getDevice_id() {
    return device_id;
  }

  public void setDevice_id(String device_id) {
    this.device_id = device_id;
  }

  public String getSession_id() {
    return session_id;
  }

  public void setSession_id(String session_id) {
    this.session_id = session_id;
  }

  /**
   * Получает частоту дискретизации.
   * @return Частота в Гц или null, если поле не передано.
   */
  public Integer getSampling_rate_hz() {
    return sampling_rate_hz;
  }

  public void setSampling_rate_hz(Integer sampling_rate_hz) {
    this.sampling_rate_hz = sampling_rate_hz;
  }

  /**
   * Получает полезную нагрузку.
   * @return Сжатые zstd байты в base64.
   */
  public String getPayload_zstd() {
    return payload_zstd;
  }

  public void setPayload_zstd(String payload_zstd) {
    this.payload_zstd = payload_zstd;
  }

  /**
   * Проверяет обязательные поля.
   *
   * @return Имена отсутствующих или некорректных полей; пустой список, если запрос валиден.
   */
  public List<String> findInvalidFields() {
    List<String> invalid = new ArrayList<>();
    if (isBlank(user_id)) {
      invalid.add("user_id");
    }
    if (isBlank(device_id)) {
      invalid.add("device_id");
    }
    if (isBlank(session_id)) {
      invalid.add("session_id");
    }
    if (sampling_rate_hz == null || sampling_rate_hz <= 0) {
      invalid.add("sampling_rate_hz");
    }
    if (isBlank(payload_zstd)) {
      invalid.add("payload_zstd");
    }
    return invalid;
  }

  private static boolean isBlank(String value) {
    return value == null || value.trim().isEmpty();
  }
}
