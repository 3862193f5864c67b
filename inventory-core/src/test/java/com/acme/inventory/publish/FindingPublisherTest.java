package com.acme.inventory.publish;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.acme.inventory.config.CollectorConfig;
import com.acme.inventory.core.ErrorClassifier;
import com.acme.inventory.core.ErrorKind;
import com.acme.inventory.core.Jsons;
import com.acme.inventory.core.PermanentException;
import com.acme.inventory.core.TransientException;
import com.acme.inventory.model.AccountResult;
import com.acme.inventory.model.CollectionResult;
import com.acme.inventory.model.CollectionSummary;
import com.acme.inventory.model.FailureDetail;
import com.acme.inventory.model.ResourceRecord;
import com.acme.inventory.resilience.CircuitBreakerRegistry;
import com.acme.inventory.spi.MessagePublisher;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FindingPublisherTest {

  private static final String TOPIC = "arn:aws:sns:us-east-1:111111111111:inventory";

  @Mock private MessagePublisher messagePublisher;

  private CircuitBreakerRegistry breakers;
  private FindingPublisher publisher;

  @BeforeEach
  void setUp() {
    breakers = new CircuitBreakerRegistry(new CollectorConfig()::breakerSettings, ErrorClassifier.defaults());
    publisher = new FindingPublisher(messagePublisher, breakers);
  }

  private static Finding finding(String accountId, String resourceId) {
    return new Finding(
        "iam", accountId, "exec-1", resourceId, "policy", "AWS::IAM::Policy", Map.of("env", "dev"), Map.of());
  }

  @Test
  @DisplayName("each finding is published as JSON with per-message account and resource attributes")
  void publishesBatch() {
    when(messagePublisher.publish(eq(TOPIC), anyString(), anyMap())).thenReturn("m-1", "m-2");

    BatchPublishResult result =
        publisher.publishBatch(
            TOPIC,
            List.of(finding("111", "arn:1"), finding("222", "arn:2")),
            Map.of("service", "iam", "execution_id", "exec-1"));

    assertThat(result.total()).isEqualTo(2);
    assertThat(result.successful()).isEqualTo(2);
    assertThat(result.allPublished()).isTrue();
    assertThat(result.outcomes()).extracting(PublishOutcome::messageId).containsExactly("m-1", "m-2");

    @SuppressWarnings("unchecked")
    ArgumentCaptor<Map<String, String>> attrs = ArgumentCaptor.forClass(Map.class);
    ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
    verify(messagePublisher, times(2)).publish(eq(TOPIC), body.capture(), attrs.capture());
    assertThat(attrs.getAllValues().get(1))
        .containsEntry("service", "iam")
        .containsEntry("execution_id", "exec-1")
        .containsEntry("account_id", "222")
        .containsEntry("resource_id", "arn:2");
    Finding sent = Jsons.fromJson(body.getAllValues().get(0), Finding.class);
    assertThat(sent.resourceId()).isEqualTo("arn:1");
    assertThat(sent.tags()).containsEntry("env", "dev");
  }

  @Test
  @DisplayName("a failed message is reported and does not stop the batch")
  void partialFailure() {
    when(messagePublisher.publish(eq(TOPIC), anyString(), anyMap()))
        .thenReturn("m-1")
        .thenThrow(new PermanentException("AuthorizationError", "not allowed", null))
        .thenReturn("m-3");

    BatchPublishResult result =
        publisher.publishBatch(
            TOPIC, List.of(finding("1", "a"), finding("1", "b"), finding("1", "c")), Map.of());

    assertThat(result.successful()).isEqualTo(2);
    assertThat(result.failed()).isEqualTo(1);
    PublishOutcome failed = result.outcomes().get(1);
    assertThat(failed.index()).isEqualTo(1);
    assertThat(failed.success()).isFalse();
    assertThat(failed.errorCode()).isEqualTo("AuthorizationError");
    assertThat(failed.error()).isEqualTo("not allowed");
  }

  @Test
  @DisplayName("an open publish circuit fails the remaining messages fast")
  void openCircuit() {
    for (int i = 0; i < 5; i++) {
      breakers.get("publish").recordFailure(new TransientException("Throttling", "slow", null));
    }

    BatchPublishResult result = publisher.publishBatch(TOPIC, List.of(finding("1", "a")), Map.of());

    assertThat(result.failed()).isEqualTo(1);
    assertThat(result.outcomes().get(0).errorCode()).isEqualTo("CircuitOpen");
    verify(messagePublisher, never()).publish(any(), any(), any());
  }

  @Test
  @DisplayName("an empty batch publishes nothing")
  void emptyBatch() {
    assertThat(publisher.publishBatch(TOPIC, List.of(), Map.of())).isEqualTo(BatchPublishResult.EMPTY);
    verify(messagePublisher, never()).publish(any(), any(), any());
  }

  @Test
  @DisplayName("findings come only from successful accounts")
  void findingsFromResult() {
    ResourceRecord record =
        new ResourceRecord("111", "kms", "AWS::KMS::Key", "key-1", "alias/app", Map.of(), Map.of("a", "b"));
    Map<String, AccountResult> results = new LinkedHashMap<>();
    results.put("111", AccountResult.success("111", List.of(record), 0));
    results.put(
        "222",
        AccountResult.failed(
            "222", new FailureDetail("assume-role", ErrorKind.PERMANENT, "AccessDenied", "x")));
    CollectionResult result =
        new CollectionResult(
            "exec-9", "kms", results, CollectionSummary.of(results.values(), Duration.ofSeconds(1)), Map.of());

    List<Finding> findings = Finding.fromResult(result);

    assertThat(findings).hasSize(1);
    assertThat(findings.get(0).executionId()).isEqualTo("exec-9");
    assertThat(findings.get(0).resourceName()).isEqualTo("alias/app");
  }
}
