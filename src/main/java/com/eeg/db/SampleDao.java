package com.eeg.db;

import com.eeg.exception.PersistenceException;
import com.eeg.model.Sample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.List;

/**
 * DAO-класс для таблицы bio_signal_raw.
 * Записывает отсчёты блока одной транзакцией: либо все, либо ни одного.
 */
public class SampleDao {

  private static final Logger logger = LoggerFactory.getLogger(SampleDao.class);

  static final String INSERT_SQL = "INSERT INTO bio_signal_raw "
      + "(time, session_id, user_id, device_id, channel_name, value, device_timestamp_us) "
      + "VALUES (?, ?, ?, ?, ?, ?, ?)";

  private final DatabaseConnection database;

  /**
   * @param database Пул соединений.
   */
  public SampleDao(DatabaseConnection database) {
    this.database = database;
  }

  /**
   * Сохраняет отсчёты пакетной вставкой в одной транзакции.
   * <p>
   * Пустой список не пишется: соединение из пула не берётся, возвращается 0.
   *
   * @param samples Отсчёты блока.
   * @return Количество записанных строк; 0 только для пустого списка.
   * @throws PersistenceException если запись не удалась; транзакция откатывается.
   */
  public int saveSamples(List<Sample> samples) {
    if (samples.isEmpty()) {
      return 0;
    }
    try (Connection conn = database.getConnection()) {
      // HikariCP восстанавливает autoCommit при возврате соединения в пул
      conn.setAutoCommit(false);
      try (PreparedStatement pstmt = conn.prepareStatement(INSERT_SQL)) {
        for (Sample sample : samples) {
          pstmt.setTimestamp(1, Timestamp.from(sample.getServerReceivedAt()));
          pstmt.setString(2, sample.getSessionId());
          pstmt.setString(3, sample.getUserId());
          pstmt.setString(4, sample.getDeviceId());
          pstmt.setString(5, sample.getChannelName());
          pstmt.setFloat(6, sample.getValue());
          pstmt.setLong(7, sample.getDeviceTimestampUs());
          pstmt.addBatch();
        }
        pstmt.executeBatch();
        conn.commit();
      } catch (SQLException | RuntimeException e) {
        rollbackQuietly(conn, e);
        throw saveFailed(samples, e);
      }
      logger.debug("Записано {} отсчётов (session: {})", samples.size(), samples.get(0).getSessionId());
      return samples.size();
    } catch (SQLException e) {
      throw saveFailed(samples, e);
    }
  }

  private static PersistenceException saveFailed(List<Sample> samples, Exception cause) {
    return new PersistenceException("Не удалось сохранить " + samples.size()
        + " отсчётов в базу данных. Сессия: " + samples.get(0).getSessionId(), cause);
  }

  private void rollbackQuietly(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException rollbackError) {
      cause.addSuppressed(rollbackError);
    }
  }
}
