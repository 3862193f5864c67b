package com.acme.inventory.publish;

import com.acme.inventory.config.CollectorConfig;
import com.acme.inventory.core.ErrorClassifier;
import com.acme.inventory.core.Jsons;
import com.acme.inventory.model.CollectionResult;
import com.acme.inventory.resilience.CircuitBreakerRegistry;
import com.acme.inventory.resilience.GuardedCall;
import com.acme.inventory.spi.MessagePublisher;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes findings as JSON messages, one message per resource, each through the {@code publish}
 * breaker. A batch never stops on a failed message; every message gets its own outcome.
 */
public class FindingPublisher {
  private static final Logger LOG = LoggerFactory.getLogger(FindingPublisher.class);

  public static final String ATTR_SERVICE = "service";
  public static final String ATTR_EXECUTION_ID = "execution_id";
  public static final String ATTR_ACCOUNT_ID = "account_id";
  public static final String ATTR_RESOURCE_ID = "resource_id";

  private final MessagePublisher publisher;
  private final CircuitBreakerRegistry breakers;
  private final ErrorClassifier classifier;

  public FindingPublisher(MessagePublisher publisher, CircuitBreakerRegistry breakers) {
    this.publisher = publisher;
    this.breakers = breakers;
    this.classifier = breakers.classifier();
  }

  /** Publishes one finding and returns the message id; failures propagate unchanged. */
  public String publish(String topic, Finding finding, Map<String, String> attributes) {
    String body = Jsons.toJson(finding);
    try {
      return GuardedCall.of(
              breakers.get(CollectorConfig.PUBLISH),
              () -> publisher.publish(topic, body, attributes))
          .execute();
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new IllegalStateException("Publishing to " + topic + " failed", e);
    }
  }

  public BatchPublishResult publishBatch(
      String topic, List<Finding> findings, Map<String, String> commonAttributes) {
    if (findings.isEmpty()) {
      LOG.warn("No findings to publish to {}", topic);
      return BatchPublishResult.EMPTY;
    }
    LOG.info("Publishing {} findings to {}", findings.size(), topic);

    List<PublishOutcome> outcomes = new ArrayList<>(findings.size());
    for (int i = 0; i < findings.size(); i++) {
      Finding finding = findings.get(i);
      Map<String, String> attributes = new HashMap<>(commonAttributes);
      attributes.put(ATTR_ACCOUNT_ID, finding.accountId());
      attributes.put(ATTR_RESOURCE_ID, finding.resourceId());
      try {
        String messageId = publish(topic, finding, attributes);
        outcomes.add(PublishOutcome.published(i, messageId));
        LOG.debug("Published finding {} ({}) as {}", i, finding.resourceId(), messageId);
      } catch (RuntimeException e) {
        String code = classifier.errorCode(e);
        outcomes.add(PublishOutcome.failed(i, code, e.getMessage()));
        LOG.error("Failed to publish finding {} ({}) to {}: {} {}", i, finding.resourceId(), topic, code, e.getMessage());
      }
    }

    BatchPublishResult result = BatchPublishResult.of(outcomes);
    LOG.info(
        "Published {}/{} findings to {} ({} failed)",
        result.successful(),
        result.total(),
        topic,
        result.failed());
    return result;
  }

  /** Publishes every record of the successful accounts of {@code result}. */
  public BatchPublishResult publishResult(String topic, CollectionResult result) {
    Map<String, String> common = new HashMap<>();
    common.put(ATTR_SERVICE, result.service());
    common.put(ATTR_EXECUTION_ID, result.executionId());
    return publishBatch(topic, Finding.fromResult(result), common);
  }
}
