package com.eeg.codec;

import com.eeg.model.Sample;
import com.eeg.model.SampleContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordLayoutTest {

  @Test
  @DisplayName("Формат V1: 68 байт, 8 каналов uint16, 12 float IMU, uint32 метка на смещении 64")
  void v1LayoutShouldMatchFirmwareFormat() {
    RecordLayout layout = RecordLayout.V1;

    assertThat(layout.getRecordSize()).isEqualTo(68);
    assertThat(layout.getChannels())
        .extracting(FieldSpec::getName)
        .containsExactly("Fp1", "Fp2", "F7", "F8", "T7", "T8", "P7", "P8");
    assertThat(layout.getChannels())
        .extracting(FieldSpec::getOffset)
        .containsExactly(0, 2, 4, 6, 8, 10, 12, 14);
    assertThat(layout.getFields())
        .filteredOn(f -> f.getRole() == FieldSpec.Role.MOTION)
        .hasSize(12)
        .allSatisfy(f -> assertThat(f.getType()).isEqualTo(FieldType.FLOAT32_LE));
    assertThat(layout.getTimestamp().getOffset()).isEqualTo(64);
    assertThat(layout.getTimestamp().getType()).isEqualTo(FieldType.UINT32_LE);
  }

  @Test
  @DisplayName("Пересекающиеся поля отклоняются")
  void shouldRejectOverlappingFields() {
    List<FieldSpec> fields = List.of(
        FieldSpec.channel("A", 0),
        FieldSpec.channel("B", 1),
        FieldSpec.timestamp("ts", 4));

    assertThatThrownBy(() -> new RecordLayout(8, fields))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("пересекается");
  }

  @Test
  @DisplayName("Поле за границей записи отклоняется")
  void shouldRejectFieldOutsideRecord() {
    List<FieldSpec> fields = List.of(
        FieldSpec.channel("A", 0),
        FieldSpec.timestamp("ts", 6));

    assertThatThrownBy(() -> new RecordLayout(8, fields))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("границу");
  }

  @Test
  @DisplayName("Схема без метки времени отклоняется")
  void shouldRequireTimestamp() {
    assertThatThrownBy(() -> new RecordLayout(4, List.of(FieldSpec.channel("A", 0))))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("Собственная схема декодируется тем же кодом")
  void customLayoutShouldDriveDecoder() {
    RecordLayout layout = new RecordLayout(6, List.of(
        FieldSpec.timestamp("ts", 0),
        FieldSpec.channel("Cz", 4)));
    byte[] buffer = {0x05, 0x00, 0x00, 0x00, 0x2A, 0x00};

    List<Sample> samples = new PacketDecoder(layout).decodeAll(buffer,
        new SampleContext("s", "u", "d", Instant.EPOCH));

    assertThat(samples).hasSize(1);
    assertThat(samples.get(0).getChannelName()).isEqualTo("Cz");
    assertThat(samples.get(0).getValue()).isEqualTo(42);
    assertThat(samples.get(0).getDeviceTimestampUs()).isEqualTo(5L);
  }
}
