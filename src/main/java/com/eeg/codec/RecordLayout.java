package com.eeg.codec;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Схема двоичной записи устройства: фиксированный размер и таблица полей.
 * <p>
 * Формат записи не содержит версии, поэтому схема задаётся явно. Новые поля
 * (например, декодирование IMU) добавляются в таблицу, а не в код разбора.
 */
public final class RecordLayout {

  /** Имена EEG-каналов в порядке следования в записи. */
  public static final List<String> CHANNEL_NAMES =
      List.of("Fp1", "Fp2", "F7", "F8", "T7", "T8", "P7", "P8");

  /** Количество значений IMU (float) в записи. */
  public static final int MOTION_VALUES = 12;

  /**
   * Текущий формат прошивки, 68 байт:
   * 8 × uint16 EEG (0–15), 12 × float32 IMU (16–63), uint32 метка времени в мкс (64–67).
   */
  public static final RecordLayout V1 = createV1();

  private final int recordSize;
  private final List<FieldSpec> fields;
  private final List<FieldSpec> channels;
  private final FieldSpec timestamp;

  /**
   * Создаёт схему и проверяет её согласованность.
   *
   * @param recordSize Размер записи в байтах.
   * @param fields Поля записи.
   * @throws IllegalArgumentException если поля пересекаются, выходят за границу записи,
   *     отсутствуют каналы или метка времени задана не ровно один раз.
   */
  public RecordLayout(int recordSize, List<FieldSpec> fields) {
    if (recordSize <= 0) {
      throw new IllegalArgumentException("Размер записи должен быть положительным: " + recordSize);
    }
    List<FieldSpec> sorted = new ArrayList<>(fields);
    sorted.sort(Comparator.comparingInt(FieldSpec::getOffset));
    int previousEnd = 0;
    for (FieldSpec field : sorted) {
      if (field.getOffset() < previousEnd) {
        throw new IllegalArgumentException("Поле " + field + " пересекается с предыдущим полем");
      }
      if (field.getEnd() > recordSize) {
        throw new IllegalArgumentException("Поле " + field + " выходит за границу записи (" + recordSize + " байт)");
      }
      previousEnd = field.getEnd();
    }

    List<FieldSpec> channelFields = new ArrayList<>();
    FieldSpec timestampField = null;
    for (FieldSpec field : fields) {
      if (field.getRole() == FieldSpec.Role.CHANNEL) {
        channelFields.add(field);
      } else if (field.getRole() == FieldSpec.Role.TIMESTAMP) {
        if (timestampField != null) {
          throw new IllegalArgumentException("Метка времени задана более одного раза");
        }
        timestampField = field;
      }
    }
    if (channelFields.isEmpty()) {
      throw new IllegalArgumentException("В схеме нет ни одного канала");
    }
    if (timestampField == null) {
      throw new IllegalArgumentException("В схеме нет метки времени");
    }

    this.recordSize = recordSize;
    this.fields = List.copyOf(fields);
    this.channels = List.copyOf(channelFields);
    this.timestamp = timestampField;
  }

  private static RecordLayout createV1() {
    List<FieldSpec> fields = new ArrayList<>();
    int offset = 0;
    for (String channel : CHANNEL_NAMES) {
      fields.add(FieldSpec.channel(channel, offset));
      offset += FieldType.UINT16_LE.width();
    }
    for (int i = 0; i < MOTION_VALUES; i++) {
      fields.add(FieldSpec.motion("imu_" + i, offset));
      offset += FieldType.FLOAT32_LE.width();
    }
    fields.add(FieldSpec.timestamp("device_timestamp_us", offset));
    offset += FieldType.UINT32_LE.width();
    return new RecordLayout(offset, fields);
  }

  public int getRecordSize() {
    return recordSize;
  }

  /**
   * @return Все поля в порядке объявления.
   */
  public List<FieldSpec> getFields() {
    return fields;
  }

  /**
   * @return Поля каналов в порядке объявления; этот порядок сохраняется в отсчётах.
   */
  public List<FieldSpec> getChannels() {
    return channels;
  }

  public FieldSpec getTimestamp() {
    return timestamp;
  }
}
