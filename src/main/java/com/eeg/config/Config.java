package com.eeg.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

/**
 * Утилитарный класс для загрузки конфигурации из application.properties.
 * <p>
 * Порядок поиска значения: системное свойство JVM ({@code db.host}),
 * переменная окружения ({@code DB_HOST}), затем classpath-файл
 * "application.properties". Значения по умолчанию в файле годятся только
 * для локальной разработки.
 */
public final class Config {

  private static final Properties PROPS = new Properties();

  static {
    try (InputStream input = Config.class.getClassLoader()
        .getResourceAsStream("application.properties")) {
      if (input == null) {
        throw new IllegalStateException("Файл application.properties не найден в classpath.");
      }
      PROPS.load(input);
    } catch (IOException e) {
      throw new IllegalStateException("Не удалось загрузить application.properties", e);
    }
  }

  /**
   * Возвращает значение обязательного параметра по ключу.
   * <p>
   * Если параметр отсутствует или пуст — бросает исключение.
   *
   * @param key Ключ параметра (например, "db.host").
   * @return Непустое строковое значение.
   * @throws IllegalStateException если параметр не задан или пуст.
   */
  public static String getRequiredProperty(String key) {
    String value = lookup(key);
    if (value == null) {
      throw new IllegalStateException("Обязательный параметр '" + key
          + "' не задан ни в системных свойствах, ни в окружении (" + toEnvName(key)
          + "), ни в application.properties");
    }
    return value;
  }

  /**
   * Возвращает значение параметра или значение по умолчанию, если параметр не задан.
   *
   * @param key Ключ параметра.
   * @param defaultValue Значение по умолчанию.
   * @return Значение параметра.
   */
  public static String getProperty(String key, String defaultValue) {
    String value = lookup(key);
    return value != null ? value : defaultValue;
  }

  /**
   * Возвращает целочисленный параметр.
   *
   * @param key Ключ параметра.
   * @param defaultValue Значение, если параметр не задан.
   * @return Значение параметра.
   * @throws IllegalStateException если значение не является целым числом.
   */
  public static int getIntProperty(String key, int defaultValue) {
    String value = lookup(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalStateException("Параметр '" + key + "' должен быть целым числом: " + value, e);
    }
  }

  /**
   * Возвращает логический параметр ("true"/"false").
   *
   * @param key Ключ параметра.
   * @param defaultValue Значение, если параметр не задан.
   * @return Значение параметра.
   */
  public static boolean getBooleanProperty(String key, boolean defaultValue) {
    String value = lookup(key);
    return value != null ? Boolean.parseBoolean(value) : defaultValue;
  }

  /**
   * Имя переменной окружения для ключа: {@code mq.routing.key} → {@code MQ_ROUTING_KEY}.
   */
  static String toEnvName(String key) {
    return key.replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
  }

  private static String lookup(String key) {
    // Сначала пробуем системное свойство
    String sysValue = System.getProperty(key);
    if (sysValue != null && !sysValue.trim().isEmpty()) {
      return sysValue.trim();
    }
    String envValue = System.getenv(toEnvName(key));
    if (envValue != null && !envValue.trim().isEmpty()) {
      return envValue.trim();
    }
    // Иначе — из application.properties
    String propValue = PROPS.getProperty(key);
    if (propValue == null || propValue.trim().isEmpty()) {
      return null;
    }
    return propValue.trim();
  }

  // Запрещаем создание экземпляров
  private Config() {
    throw new UnsupportedOperationException("Utility class");
  }
}
