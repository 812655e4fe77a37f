package com.eeg.service;

import com.eeg.server.IngestRequest;

/**
 * Сервис приёма EEG-блоков от носимого устройства.
 * <p>
 * Отвечает за распаковку, декодирование, запись отсчётов в БД и уведомление SignalLab.
 */
public interface IngestionService {

  /**
   * Обрабатывает входящий блок: распаковывает, декодирует, сохраняет в БД и публикует уведомление.
   * <p>
   * Ошибки валидации, распаковки и записи возвращаются как категория результата;
   * ошибка публикации уведомления не влияет на успех записи.
   *
   * @param request Запрос от устройства.
   * @return Итог обработки; никогда не null.
   */
  IngestResult ingest(IngestRequest request);
}
