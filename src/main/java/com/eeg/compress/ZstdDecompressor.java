package com.eeg.compress;

import com.eeg.exception.DecompressionException;
import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.util.Native;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Распаковка zstd через zstd-jni.
 * <p>
 * Перед первым вызовом {@link #decompress(byte[])} нужно один раз вызвать {@link #initialize()}:
 * он загружает нативную библиотеку. {@code HttpServer} делает это до открытия порта.
 */
public class ZstdDecompressor implements Decompressor {

  private static final Logger logger = LoggerFactory.getLogger(ZstdDecompressor.class);

  private static final int BUFFER_SIZE = 64 * 1024;

  private final long maxDecompressedBytes;
  private volatile boolean initialized;

  /**
   * @param maxDecompressedBytes Верхняя граница размера распакованных данных.
   */
  public ZstdDecompressor(long maxDecompressedBytes) {
    if (maxDecompressedBytes <= 0) {
      throw new IllegalArgumentException("maxDecompressedBytes должен быть положительным: " + maxDecompressedBytes);
    }
    this.maxDecompressedBytes = maxDecompressedBytes;
  }

  /**
   * Загружает нативную библиотеку zstd. Повторный вызов ничего не делает.
   *
   * @throws IllegalStateException если библиотеку не удалось загрузить.
   */
  public synchronized void initialize() {
    if (initialized) {
      return;
    }
    try {
      Native.load();
    } catch (UnsatisfiedLinkError e) {
      throw new IllegalStateException("Не удалось загрузить нативную библиотеку zstd", e);
    }
    initialized = true;
    logger.info("✅ zstd инициализирован (лимит распаковки {} байт)", maxDecompressedBytes);
  }

  public boolean isInitialized() {
    return initialized;
  }

  @Override
  public byte[] decompress(byte[] compressed) {
    if (!initialized) {
      throw new IllegalStateException("ZstdDecompressor не инициализирован: вызовите initialize() при старте");
    }
    if (compressed == null || compressed.length == 0) {
      throw new DecompressionException("Пустая полезная нагрузка: нет zstd-кадра");
    }
    try (InputStream in = new ZstdInputStream(new ByteArrayInputStream(compressed));
         ByteArrayOutputStream out = new ByteArrayOutputStream(compressed.length * 4)) {
      byte[] chunk = new byte[BUFFER_SIZE];
      long total = 0;
      int read;
      while ((read = in.read(chunk)) != -1) {
        total += read;
        if (total > maxDecompressedBytes) {
          throw new DecompressionException("Распакованные данные превышают лимит " + maxDecompressedBytes + " байт");
        }
        out.write(chunk, 0, read);
      }
      return out.toByteArray();
    } catch (IOException e) {
      throw new DecompressionException("Не удалось распаковать zstd: " + e.getMessage(), e);
    }
  }
}
