package com.eeg.codec;

import java.util.Objects;

/**
 * Описание одного поля записи устройства: имя, смещение внутри записи, тип и роль.
 */
public final class FieldSpec {

  /**
   * Роль поля в записи.
   */
  public enum Role {
    /** Значение EEG-канала, превращается в отдельный отсчёт. */
    CHANNEL,
    /** Данные IMU: присутствуют в записи, но не декодируются. */
    MOTION,
    /** Метка времени устройства, общая для всех каналов записи. */
    TIMESTAMP
  }

  private final String name;
  private final int offset;
  private final FieldType type;
  private final Role role;

  public FieldSpec(String name, int offset, FieldType type, Role role) {
    if (offset < 0) {
      throw new IllegalArgumentException("Смещение поля '" + name + "' не может быть отрицательным: " + offset);
    }
    this.name = Objects.requireNonNull(name, "name");
    this.offset = offset;
    this.type = Objects.requireNonNull(type, "type");
    this.role = Objects.requireNonNull(role, "role");
  }

  public static FieldSpec channel(String name, int offset) {
    return new FieldSpec(name, offset, FieldType.UINT16_LE, Role.CHANNEL);
  }

  public static FieldSpec motion(String name, int offset) {
    return new FieldSpec(name, offset, FieldType.FLOAT32_LE, Role.MOTION);
  }

  public static FieldSpec timestamp(String name, int offset) {
    return new FieldSpec(name, offset, FieldType.UINT32_LE, Role.TIMESTAMP);
  }

  public String getName() {
    return name;
  }

  public int getOffset() {
    return offset;
  }

  public int getWidth() {
    return type.width();
  }

  /**
   * @return Смещение первого байта после поля.
   */
  public int getEnd() {
    return offset + type.width();
  }

  public FieldType getType() {
    return type;
  }

  public Role getRole() {
    return role;
  }

  @Override
  public String toString() {
    return name + "@" + offset + ":" + type;
  }
}
