package com.eeg.codec;

import com.eeg.model.Sample;
import com.eeg.model.SampleContext;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Декодер распакованного буфера устройства в последовательность отсчётов.
 * <p>
 * Буфер читается шагами по {@link RecordLayout#getRecordSize()} байт с нулевого смещения.
 * Каждая полная запись даёт по одному отсчёту на канал, все с общей меткой времени устройства.
 * Неполная запись в конце буфера отбрасывается без ошибки.
 * <p>
 * Класс не имеет состояния и потокобезопасен.
 */
public class PacketDecoder {

  private final RecordLayout layout;

  public PacketDecoder() {
    this(RecordLayout.V1);
  }

  public PacketDecoder(RecordLayout layout) {
    this.layout = Objects.requireNonNull(layout, "layout");
  }

  public RecordLayout getLayout() {
    return layout;
  }

  /**
   * Возвращает ленивую последовательность отсчётов.
   * <p>
   * Каждый вызов {@code iterator()} начинает чтение заново и выдаёт ту же последовательность.
   * Буфер не копируется: его нельзя изменять, пока последовательность используется.
   *
   * @param buffer Распакованные байты.
   * @param context Метаданные запроса и время приёма.
   * @return Последовательность из {@code completeRecords(buffer.length) * каналов} отсчётов.
   */
  public Iterable<Sample> decode(byte[] buffer, SampleContext context) {
    Objects.requireNonNull(buffer, "buffer");
    Objects.requireNonNull(context, "context");
    return () -> new SampleIterator(buffer, context);
  }

  /**
   * Декодирует буфер целиком в список.
   */
  public List<Sample> decodeAll(byte[] buffer, SampleContext context) {
    List<Sample> samples = new ArrayList<>(completeRecords(buffer.length) * layout.getChannels().size());
    for (Sample sample : decode(buffer, context)) {
      samples.add(sample);
    }
    return samples;
  }

  /**
   * @return Количество полных записей в буфере указанной длины.
   */
  public int completeRecords(int length) {
    return length / layout.getRecordSize();
  }

  /**
   * @return Количество хвостовых байт, которые не образуют полную запись и будут отброшены.
   */
  public int trailingBytes(int length) {
    return length % layout.getRecordSize();
  }

  private final class SampleIterator implements Iterator<Sample> {

    private final ByteBuffer data;
    private final SampleContext context;
    private final List<FieldSpec> channels = layout.getChannels();
    private final int records;

    private int record;
    private int channel;
    private long recordTimestamp;

    SampleIterator(byte[] buffer, SampleContext context) {
      this.data = ByteBuffer.wrap(buffer).order(ByteOrder.LITTLE_ENDIAN);
      this.context = context;
      this.records = completeRecords(buffer.length);
    }

    @Override
    public boolean hasNext() {
      return record < records;
    }

    @Override
    public Sample next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      int base = record * layout.getRecordSize();
      if (channel == 0) {
        FieldSpec ts = layout.getTimestamp();
        recordTimestamp = (long) ts.getType().read(data, base + ts.getOffset());
      }
      FieldSpec field = channels.get(channel);
      int value = (int) field.getType().read(data, base + field.getOffset());
      Sample sample = new Sample(
          context.getReceivedAt(),
          context.getSessionId(),
          context.getUserId(),
          context.getDeviceId(),
          field.getName(),
          value,
          recordTimestamp
      );
      if (++channel == channels.size()) {
        channel = 0;
        record++;
      }
      return sample;
    }
  }
}
