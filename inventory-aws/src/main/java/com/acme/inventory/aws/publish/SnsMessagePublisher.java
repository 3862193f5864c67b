package com.acme.inventory.aws.publish;

import com.acme.inventory.spi.MessagePublisher;
import java.util.LinkedHashMap;
import java.util.Map;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.MessageAttributeValue;
import software.amazon.awssdk.services.sns.model.PublishRequest;

/** Publishes to an SNS topic; {@code topic} is the topic ARN. */
public class SnsMessagePublisher implements MessagePublisher {
  private static final String STRING = "String";

  private final SnsClient sns;

  public SnsMessagePublisher(SnsClient sns) {
    this.sns = sns;
  }

  @Override
  public String publish(String topic, String message, Map<String, String> attributes) {
    Map<String, MessageAttributeValue> messageAttributes = new LinkedHashMap<>();
    attributes.forEach(
        (name, value) -> {
          // SNS rejects empty attribute values
          if (value != null && !value.isEmpty()) {
            messageAttributes.put(
                name, MessageAttributeValue.builder().dataType(STRING).stringValue(value).build());
          }
        });
    return sns.publish(
            PublishRequest.builder()
                .topicArn(topic)
                .message(message)
                .messageAttributes(messageAttributes)
                .build())
        .messageId();
  }
}
