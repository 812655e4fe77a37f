package com.eeg.service;

import com.eeg.codec.PacketDecoder;
import com.eeg.compress.Decompressor;
import com.eeg.db.SampleDao;
import com.eeg.exception.DecompressionException;
import com.eeg.exception.PersistenceException;
import com.eeg.exception.ValidationException;
import com.eeg.model.Sample;
import com.eeg.model.SampleContext;
import com.eeg.mq.IngestNotification;
import com.eeg.mq.NotificationPublisher;
import com.eeg.mq.PublishOutcome;
import com.eeg.server.IngestRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Base64;
import java.util.List;

/**
 * Реализация сервиса приёма EEG-блоков.
 * <p>
 * Этапы выполняются последовательно в потоке запроса. Общего изменяемого состояния
 * между запросами нет, поэтому один экземпляр обслуживает все запросы.
 */
public class IngestionServiceImpl implements IngestionService {

  private static final Logger logger = LoggerFactory.getLogger(IngestionServiceImpl.class);

  private final Decompressor decompressor;
  private final PacketDecoder decoder;
  private final SampleDao sampleDao;
  private final NotificationPublisher publisher;
  private final Clock clock;

  /**
   * Конструктор сервиса.
   *
   * @param decompressor Инициализированный адаптер zstd.
   * @param decoder Декодер записей устройства.
   * @param sampleDao DAO для работы с БД.
   * @param publisher Публикатор уведомлений в шину сообщений.
   * @param clock Источник серверного времени.
   */
  public IngestionServiceImpl(Decompressor decompressor, PacketDecoder decoder, SampleDao sampleDao,
                              NotificationPublisher publisher, Clock clock) {
    this.decompressor = decompressor;
    this.decoder = decoder;
    this.sampleDao = sampleDao;
    this.publisher = publisher;
    this.clock = clock;
  }

  @Override
  public IngestResult ingest(IngestRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("Ingest request cannot be null");
    }

    IngestStage stage = IngestStage.RECEIVED;
    try {
      validate(request);

      stage = advance(stage, IngestStage.DECOMPRESSING, request);
      byte[] raw = decompressor.decompress(decodeBase64(request.getPayload_zstd()));

      stage = advance(stage, IngestStage.DECODING, request);
      SampleContext context = new SampleContext(
          request.getSession_id(), request.getUser_id(), request.getDevice_id(), clock.instant());
      List<Sample> samples = decoder.decodeAll(raw, context);
      int droppedBytes = decoder.trailingBytes(raw.length);
      if (droppedBytes > 0) {
        logger.warn("Отброшено {} хвостовых байт неполной записи (session: {}, буфер: {} байт)",
            droppedBytes, request.getSession_id(), raw.length);
      }

      if (samples.isEmpty()) {
        stage = advance(stage, IngestStage.EMPTY, request);
        advance(stage, IngestStage.DONE, request);
        return IngestResult.empty(droppedBytes);
      }

      stage = advance(stage, IngestStage.PERSISTING, request);
      int inserted = sampleDao.saveSamples(samples);
      logger.info("✅ {} отсчётов сохранено в БД (session: {}, device: {})",
          inserted, request.getSession_id(), request.getDevice_id());

      stage = advance(stage, IngestStage.NOTIFYING, request);
      boolean notified = notifyStored(request, inserted);
      advance(stage, IngestStage.DONE, request);
      return IngestResult.stored(inserted, droppedBytes, notified);

    } catch (ValidationException e) {
      logger.info("Запрос отклонён: {}", e.getMessage());
      advance(stage, IngestStage.FAILED, request);
      return IngestResult.invalid(e.getFields());
    } catch (DecompressionException e) {
      logger.error("❌ Не удалось распаковать блок (session: {}, device: {})",
          request.getSession_id(), request.getDevice_id(), e);
      advance(stage, IngestStage.FAILED, request);
      return IngestResult.failed(IngestResult.Outcome.DECOMPRESSION_FAILED, stage);
    } catch (PersistenceException e) {
      logger.error("❌ Не удалось сохранить блок в БД (session: {}, device: {})",
          request.getSession_id(), request.getDevice_id(), e);
      advance(stage, IngestStage.FAILED, request);
      return IngestResult.failed(IngestResult.Outcome.PERSISTENCE_FAILED, stage);
    }
  }

  /**
   * Публикует уведомление о записанном блоке. Ошибки публикации, включая исключения
   * публикатора, логируются и не меняют результат записи.
   *
   * @return true, если уведомление опубликовано.
   */
  private boolean notifyStored(IngestRequest request, int inserted) {
    boolean notified;
    try {
      IngestNotification notification = new IngestNotification(
          request.getSession_id(), request.getUser_id(), inserted, clock.instant());
      notified = publisher.publish(notification) == PublishOutcome.PUBLISHED;
    } catch (RuntimeException e) {
      logger.warn("❌ Публикатор уведомлений завершился с исключением (session: {})",
          request.getSession_id(), e);
      notified = false;
    }
    if (!notified) {
      logger.warn("Блок сохранён, но уведомление не отправлено (session: {}, num_records: {})",
          request.getSession_id(), inserted);
    }
    return notified;
  }

  private IngestStage advance(IngestStage from, IngestStage to, IngestRequest request) {
    logger.debug("{} → {} (session: {})", from, to, request.getSession_id());
    return to;
  }

  private void validate(IngestRequest request) {
    List<String> invalid = request.findInvalidFields();
    if (!invalid.isEmpty()) {
      throw new ValidationException(invalid);
    }
  }

  private byte[] decodeBase64(String payload) {
    try {
      return Base64.getMimeDecoder().decode(payload);
    } catch (IllegalArgumentException e) {
      throw new DecompressionException("payload_zstd не является корректным base64", e);
    }
  }
}
