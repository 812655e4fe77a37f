package com.eeg.db;

import com.eeg.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Пул соединений с PostgreSQL (HikariCP) и инициализация таблицы сырых отсчётов.
 * <p>
 * Создаётся один раз при старте и передаётся в DAO; закрывается при остановке процесса.
 */
public class DatabaseConnection implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(DatabaseConnection.class);

  private static final String CREATE_RAW_TABLE_SQL = """
      CREATE TABLE IF NOT EXISTS bio_signal_raw (
          time TIMESTAMPTZ NOT NULL,
          session_id TEXT NOT NULL,
          user_id TEXT NOT NULL,
          device_id TEXT NOT NULL,
          channel_name TEXT NOT NULL,
          value REAL NOT NULL,
          device_timestamp_us BIGINT
      )
      """;

  private static final String CREATE_SESSION_INDEX_SQL =
      "CREATE INDEX IF NOT EXISTS bio_signal_raw_user_session_time_idx "
          + "ON bio_signal_raw (user_id, session_id, time DESC)";

  private static final String CREATE_CHANNEL_INDEX_SQL =
      "CREATE INDEX IF NOT EXISTS bio_signal_raw_channel_time_idx "
          + "ON bio_signal_raw (channel_name, time DESC)";

  private static final String CREATE_HYPERTABLE_SQL =
      "SELECT create_hypertable('bio_signal_raw', 'time', if_not_exists => TRUE)";

  private final DataSource dataSource;

  /**
   * @param dataSource Источник соединений (обычно {@link HikariDataSource}).
   */
  public DatabaseConnection(DataSource dataSource) {
    this.dataSource = dataSource;
  }

  /**
   * Создаёт пул по параметрам db.* из {@link Config}.
   *
   * @return Готовый к работе пул.
   * @throws RuntimeException если пул не удалось запустить.
   */
  public static DatabaseConnection fromConfig() {
    String host = Config.getRequiredProperty("db.host");
    int port = Config.getIntProperty("db.port", 5432);
    String name = Config.getRequiredProperty("db.name");
    String url = Config.getProperty("db.url", "jdbc:postgresql://" + host + ":" + port + "/" + name
        + "?reWriteBatchedInserts=true");

    HikariConfig hikariConfig = new HikariConfig();
    hikariConfig.setJdbcUrl(url);
    hikariConfig.setUsername(Config.getRequiredProperty("db.user"));
    hikariConfig.setPassword(Config.getProperty("db.password", ""));
    hikariConfig.setMaximumPoolSize(Config.getIntProperty("db.pool.max.size", 10));
    hikariConfig.setMinimumIdle(Config.getIntProperty("db.pool.min.idle", 2));
    hikariConfig.setConnectionTimeout(Config.getIntProperty("db.connection.timeout.ms", 10_000));
    hikariConfig.setPoolName("eeg-collector-db");

    try {
      HikariDataSource ds = new HikariDataSource(hikariConfig);
      logger.info("✅ Пул соединений с БД запущен: {} (max={}, minIdle={})",
          url, hikariConfig.getMaximumPoolSize(), hikariConfig.getMinimumIdle());
      return new DatabaseConnection(ds);
    } catch (RuntimeException e) {
      throw new RuntimeException(
          "Не удалось подключиться к базе данных по адресу: " + url
              + ". Проверьте, что PostgreSQL запущен и параметры подключения верны.",
          e
      );
    }
  }

  /**
   * Берёт соединение из пула. Вызывающий обязан закрыть его (вернуть в пул).
   *
   * @return Соединение с PostgreSQL.
   * @throws SQLException если соединение не получено за connectionTimeout.
   */
  public Connection getConnection() throws SQLException {
    return dataSource.getConnection();
  }

  /**
   * Инициализирует базу данных: создаёт таблицу bio_signal_raw и индексы, если их нет.
   * Вызывается при старте приложения.
   *
   * @param timescale Превратить таблицу в гипертаблицу TimescaleDB (нужно расширение timescaledb).
   * @throws RuntimeException если не удалось создать таблицу.
   */
  public void initializeDatabase(boolean timescale) {
    try (Connection conn = getConnection();
         Statement stmt = conn.createStatement()) {
      stmt.execute(CREATE_RAW_TABLE_SQL);
      if (timescale) {
        stmt.execute(CREATE_HYPERTABLE_SQL);
      }
      stmt.execute(CREATE_SESSION_INDEX_SQL);
      stmt.execute(CREATE_CHANNEL_INDEX_SQL);
      logger.info("✅ Таблица 'bio_signal_raw' создана или уже существует (timescale={})", timescale);
    } catch (SQLException e) {
      throw new RuntimeException(
          "Не удалось инициализировать базу данных. Ошибка при создании таблицы 'bio_signal_raw'.",
          e
      );
    }
  }

  @Override
  public void close() {
    if (dataSource instanceof HikariDataSource) {
      HikariDataSource hikari = (HikariDataSource) dataSource;
      if (!hikari.isClosed()) {
        hikari.close();
        logger.info("Пул соединений с БД закрыт");
      }
    }
  }
}
