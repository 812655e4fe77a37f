package com.eeg.mq;

/**
 * Результат единственной попытки публикации уведомления.
 */
public enum PublishOutcome {
  PUBLISHED,
  FAILED
}
