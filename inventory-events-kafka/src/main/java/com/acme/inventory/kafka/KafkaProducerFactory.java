package com.acme.inventory.kafka;

import java.util.Properties;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.StringSerializer;

/** Builds string/string producers tuned for durable, ordered delivery of findings. */
public class KafkaProducerFactory {
  public static final String DEFAULT_BOOTSTRAP_SERVERS = "localhost:9092";

  private final String bootstrapServers;
  private final String clientId;

  public KafkaProducerFactory() {
    this(DEFAULT_BOOTSTRAP_SERVERS, "inventory-publisher");
  }

  public KafkaProducerFactory(String bootstrapServers, String clientId) {
    if (bootstrapServers == null || bootstrapServers.isBlank()) {
      throw new IllegalArgumentException("bootstrapServers cannot be blank");
    }
    this.bootstrapServers = bootstrapServers;
    this.clientId = clientId;
  }

  public Properties producerProperties() {
    Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    props.put(ProducerConfig.CLIENT_ID_CONFIG, clientId);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
    props.put(ProducerConfig.ACKS_CONFIG, "all");
    props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
    props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 5);
    props.put(ProducerConfig.LINGER_MS_CONFIG, 5);
    props.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, "lz4");
    props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, 30000);
    props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, 10000);
    return props;
  }

  public KafkaProducer<String, String> kafkaProducer() {
    return new KafkaProducer<>(producerProperties());
  }
}
