package com.eeg.mq;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Instant;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RabbitMqNotificationPublisherTest {

  @Mock
  private ConnectionFactory connectionFactory;

  @Mock
  private Connection connection;

  @Mock
  private Channel channel;

  private RabbitMqNotificationPublisher publisher;

  private final IngestNotification notification =
      new IngestNotification("ses-1", "user-1", 16, Instant.parse("2025-03-01T10:00:00Z"));

  @BeforeEach
  void setUp() {
    publisher = new RabbitMqNotificationPublisher(connectionFactory, "eeg_events", "eeg.raw.new");
  }

  @Test
  @DisplayName("Публикация: durable topic-exchange, persistent JSON, соединение и канал закрыты")
  void shouldPublishPersistentJsonAndClose() throws Exception {
    when(connectionFactory.newConnection(anyString())).thenReturn(connection);
    when(connection.createChannel()).thenReturn(channel);

    PublishOutcome outcome = publisher.publish(notification);

    assertThat(outcome).isEqualTo(PublishOutcome.PUBLISHED);
    verify(channel).exchangeDeclare("eeg_events", BuiltinExchangeType.TOPIC, true);

    ArgumentCaptor<AMQP.BasicProperties> props = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
    ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
    verify(channel).basicPublish(eq("eeg_events"), eq("eeg.raw.new"), props.capture(), body.capture());
    assertThat(props.getValue().getDeliveryMode()).isEqualTo(2);
    assertThat(props.getValue().getContentType()).isEqualTo("application/json");

    JsonNode json = new ObjectMapper().readTree(body.getValue());
    assertThat(json.get("type").asText()).isEqualTo("NEW_EEG_BLOCK");
    assertThat(json.get("session_id").asText()).isEqualTo("ses-1");
    assertThat(json.get("user_id").asText()).isEqualTo("user-1");
    assertThat(json.get("num_records").asInt()).isEqualTo(16);
    assertThat(json.get("received_at").asText()).isEqualTo("2025-03-01T10:00:00Z");

    verify(channel).close();
    verify(connection).close();
  }

  @Test
  @DisplayName("Брокер недоступен → FAILED без исключения")
  void shouldReturnFailedWhenBrokerUnreachable() throws Exception {
    when(connectionFactory.newConnection(anyString())).thenThrow(new ConnectException("Connection refused"));

    assertThat(publisher.publish(notification)).isEqualTo(PublishOutcome.FAILED);
  }

  @Test
  @DisplayName("Ошибка публикации → FAILED, соединение и канал всё равно закрыты")
  void shouldCloseResourcesWhenPublishFails() throws Exception {
    when(connectionFactory.newConnection(anyString())).thenReturn(connection);
    when(connection.createChannel()).thenReturn(channel);
    doThrow(new IOException("channel closed"))
        .when(channel).basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(byte[].class));

    assertThat(publisher.publish(notification)).isEqualTo(PublishOutcome.FAILED);

    verify(channel).close();
    verify(connection).close();
  }

  @Test
  @DisplayName("Ошибка закрытия соединения после публикации → результат остаётся PUBLISHED")
  void closeFailureAfterPublishShouldKeepPublished() throws Exception {
    when(connectionFactory.newConnection(anyString())).thenReturn(connection);
    when(connection.createChannel()).thenReturn(channel);
    doThrow(new IOException("connection reset")).when(connection).close();

    PublishOutcome outcome = publisher.publish(notification);

    assertThat(outcome).isEqualTo(PublishOutcome.PUBLISHED);
    verify(channel).basicPublish(eq("eeg_events"), eq("eeg.raw.new"), any(AMQP.BasicProperties.class), any(byte[].class));
    verify(channel).close();
    verify(connection).close();
  }

  @Test
  @DisplayName("Ошибка закрытия канала → соединение всё равно закрывается, результат PUBLISHED")
  void channelCloseFailureShouldStillCloseConnection() throws Exception {
    when(connectionFactory.newConnection(anyString())).thenReturn(connection);
    when(connection.createChannel()).thenReturn(channel);
    doThrow(new TimeoutException("close timed out")).when(channel).close();

    assertThat(publisher.publish(notification)).isEqualTo(PublishOutcome.PUBLISHED);

    verify(connection).close();
  }

  @Test
  @DisplayName("Ошибка объявления exchange → публикации нет")
  void shouldNotPublishWhenExchangeDeclarationFails() throws Exception {
    when(connectionFactory.newConnection(anyString())).thenReturn(connection);
    when(connection.createChannel()).thenReturn(channel);
    when(channel.exchangeDeclare("eeg_events", BuiltinExchangeType.TOPIC, true))
        .thenThrow(new IOException("PRECONDITION_FAILED"));

    assertThat(publisher.publish(notification)).isEqualTo(PublishOutcome.FAILED);

    verify(channel, never()).basicPublish(anyString(), anyString(), any(AMQP.BasicProperties.class), any(byte[].class));
    verify(connection).close();
  }
}
