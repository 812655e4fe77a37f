package com.eeg.service;

/**
 * Этапы обработки одного запроса.
 * <pre>
 * RECEIVED → DECOMPRESSING → DECODING → (EMPTY → DONE) | PERSISTING → NOTIFYING → DONE
 * </pre>
 * FAILED достижим из RECEIVED, DECOMPRESSING и PERSISTING. NOTIFYING всегда завершается в DONE,
 * даже если публикация не удалась.
 */
public enum IngestStage {
  RECEIVED,
  DECOMPRESSING,
  DECODING,
  EMPTY,
  PERSISTING,
  NOTIFYING,
  DONE,
  FAILED
}
