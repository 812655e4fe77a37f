package com.eeg.mq;

/**
 * Публикация уведомлений о новых блоках во внешнюю шину сообщений.
 * <p>
 * Best effort: одна попытка, без повторов и без очереди. Реализации не бросают исключений,
 * ошибка публикации возвращается как {@link PublishOutcome#FAILED}.
 */
public interface NotificationPublisher {

  /**
   * @param notification Уведомление о записанном блоке.
   * @return Результат попытки публикации.
   */
  PublishOutcome publish(IngestNotification notification);
}
