package com.acme.inventory.spi;

import java.util.Map;

/** Sends one message to a topic and returns the broker-assigned message id. */
public interface MessagePublisher {
  String publish(String topic, String message, Map<String, String> attributes);
}
