package com.acme.inventory.kafka;

import com.acme.inventory.core.PermanentException;
import com.acme.inventory.core.TransientException;
import com.acme.inventory.publish.FindingPublisher;
import com.acme.inventory.spi.MessagePublisher;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.errors.RetriableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes findings to a Kafka topic and waits for the broker acknowledgement, so each message
 * gets a definite outcome. The record key is the resource id (keeping updates of one resource in
 * one partition) and message attributes travel as headers.
 *
 * <p>Retriable broker errors and send timeouts surface as {@link TransientException}, other send
 * failures as {@link PermanentException}.
 */
public class KafkaMessagePublisher implements MessagePublisher, AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(KafkaMessagePublisher.class);
  public static final Duration DEFAULT_SEND_TIMEOUT = Duration.ofSeconds(30);

  private final Producer<String, String> producer;
  private final Duration sendTimeout;

  public KafkaMessagePublisher(Producer<String, String> producer) {
    this(producer, DEFAULT_SEND_TIMEOUT);
  }

  public KafkaMessagePublisher(Producer<String, String> producer, Duration sendTimeout) {
    this.producer = producer;
    this.sendTimeout = sendTimeout;
  }

  @Override
  public String publish(String topic, String message, Map<String, String> attributes) {
    String key = attributes.get(FindingPublisher.ATTR_RESOURCE_ID);
    ProducerRecord<String, String> record = new ProducerRecord<>(topic, key, message);
    attributes.forEach(
        (name, value) -> {
          if (value != null) {
            record.headers().add(name, value.getBytes(StandardCharsets.UTF_8));
          }
        });

    try {
      RecordMetadata metadata =
          producer.send(record).get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
      String messageId = metadata.topic() + "-" + metadata.partition() + "@" + metadata.offset();
      LOG.debug("Sent record key={} to {}", key, messageId);
      return messageId;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      String code = cause.getClass().getSimpleName();
      if (cause instanceof RetriableException) {
        throw new TransientException(code, "Send to " + topic + " failed: " + cause.getMessage(), cause);
      }
      throw new PermanentException(code, "Send to " + topic + " failed: " + cause.getMessage(), cause);
    } catch (TimeoutException e) {
      throw new TransientException(
          "Timeout", "No acknowledgement from " + topic + " within " + sendTimeout, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted while sending to " + topic, e);
    }
  }

  @Override
  public void close() {
    producer.close(Duration.ofSeconds(10));
  }
}
