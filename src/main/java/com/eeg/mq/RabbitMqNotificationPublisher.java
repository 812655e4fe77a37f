package com.eeg.mq;

import com.eeg.config.Config;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.MessageProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Публикация уведомлений в topic-exchange RabbitMQ.
 * <p>
 * На каждый вызов открываются новые соединение и канал; оба закрываются после попытки
 * независимо от результата.
 */
public class RabbitMqNotificationPublisher implements NotificationPublisher {

  private static final Logger logger = LoggerFactory.getLogger(RabbitMqNotificationPublisher.class);

  private static final AMQP.BasicProperties PERSISTENT_JSON = MessageProperties.PERSISTENT_BASIC.builder()
      .contentType("application/json")
      .contentEncoding("UTF-8")
      .build();

  private final ConnectionFactory connectionFactory;
  private final String exchange;
  private final String routingKey;
  private final ObjectMapper objectMapper;

  /**
   * @param connectionFactory Фабрика соединений, общая для процесса.
   * @param exchange Имя durable topic-exchange.
   * @param routingKey Ключ маршрутизации.
   */
  public RabbitMqNotificationPublisher(ConnectionFactory connectionFactory, String exchange, String routingKey) {
    this.connectionFactory = connectionFactory;
    this.exchange = exchange;
    this.routingKey = routingKey;
    this.objectMapper = new ObjectMapper();
  }

  /**
   * Создаёт публикатор по параметрам mq.* из {@link Config}.
   */
  public static RabbitMqNotificationPublisher fromConfig() {
    ConnectionFactory factory = new ConnectionFactory();
    factory.setHost(Config.getRequiredProperty("mq.host"));
    factory.setPort(Config.getIntProperty("mq.port", 5672));
    factory.setUsername(Config.getRequiredProperty("mq.user"));
    factory.setPassword(Config.getProperty("mq.password", ""));
    factory.setConnectionTimeout(Config.getIntProperty("mq.connection.timeout.ms", 5_000));
    // Публикация одноразовая: автоматическое восстановление соединения не нужно
    factory.setAutomaticRecoveryEnabled(false);
    return new RabbitMqNotificationPublisher(
        factory,
        Config.getProperty("mq.exchange", "eeg_events"),
        Config.getProperty("mq.routing.key", "eeg.raw.new"));
  }

  @Override
  public PublishOutcome publish(IngestNotification notification) {
    Connection connection = null;
    Channel channel = null;
    try {
      connection = connectionFactory.newConnection("eeg-collector");
      channel = connection.createChannel();
      channel.exchangeDeclare(exchange, BuiltinExchangeType.TOPIC, true);
      byte[] body = objectMapper.writeValueAsBytes(notification);
      channel.basicPublish(exchange, routingKey, PERSISTENT_JSON, body);
      logger.info("📨 Уведомление опубликовано в {}/{}: session={}, num_records={}",
          exchange, routingKey, notification.getSessionId(), notification.getNumRecords());
      return PublishOutcome.PUBLISHED;
    } catch (Exception e) {
      logger.warn("❌ Не удалось опубликовать уведомление (session: {}, num_records: {})",
          notification.getSessionId(), notification.getNumRecords(), e);
      return PublishOutcome.FAILED;
    } finally {
      // Ошибка закрытия не меняет результат: сообщение уже принято или уже потеряно
      closeQuietly(channel, "канал", notification);
      closeQuietly(connection, "соединение", notification);
    }
  }

  private void closeQuietly(AutoCloseable resource, String name, IngestNotification notification) {
    if (resource == null) {
      return;
    }
    try {
      resource.close();
    } catch (Exception e) {
      logger.warn("Не удалось закрыть {} RabbitMQ (session: {})", name, notification.getSessionId(), e);
    }
  }
}
