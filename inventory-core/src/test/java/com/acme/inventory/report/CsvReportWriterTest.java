package com.acme.inventory.report;

import static org.assertj.core.api.Assertions.*;

import com.acme.inventory.config.LockConfig;
import com.acme.inventory.lock.ObjectStoreLock;
import com.acme.inventory.model.AccountResult;
import com.acme.inventory.model.CollectionResult;
import com.acme.inventory.model.CollectionSummary;
import com.acme.inventory.model.ResourceRecord;
import com.acme.inventory.support.InMemoryObjectStore;
import com.acme.inventory.support.MutableClock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CsvReportWriterTest {

  private static final String KEY = "cidb/2024/june/iam-june-01-20240601.csv";

  private InMemoryObjectStore store;
  private MutableClock clock;
  private LockConfig lockConfig;
  private CsvReportWriter writer;

  @BeforeEach
  void setUp() {
    store = new InMemoryObjectStore();
    clock = MutableClock.at("2024-06-01T08:30:00Z");
    lockConfig = new LockConfig();
    lockConfig.setMaxAttempts(2);
    lockConfig.setJitterFactor(0.0);
    ObjectStoreLock lock = new ObjectStoreLock(store, lockConfig, clock, d -> {});
    writer = new CsvReportWriter(store, lock, "cidb", clock);
  }

  private static ReportRow row(String arn, String name) {
    return new ReportRow("AWS::IAM::Policy", "111111111111", arn, name, "{}", "2024-06-01T08:30:00Z");
  }

  @Test
  @DisplayName("first write creates the report with a header row")
  void createsReport() {
    ReportWriteResult result = writer.append("iam", List.of(row("arn:1", "one")), "req-1");

    assertThat(result.status()).isEqualTo(ReportWriteResult.Status.WRITTEN);
    assertThat(result.key()).isEqualTo(KEY);
    assertThat(result.rowsWritten()).isEqualTo(1);
    String csv = store.getString(KEY);
    assertThat(csv.lines().findFirst()).contains("Type,AccountId,Arn,Name,Tags,CollectedAt");
    assertThat(store.contains(KEY + ".lock")).isFalse();
  }

  @Test
  @DisplayName("later writes merge by type and ARN, new rows replacing old ones")
  void mergesRows() {
    writer.append("iam", List.of(row("arn:1", "one"), row("arn:2", "two")), "req-1");

    ReportWriteResult result =
        writer.append("iam", List.of(row("arn:2", "two-renamed"), row("arn:3", "three")), "req-2");

    assertThat(result.rowsWritten()).isEqualTo(3);
    assertThat(writer.read(KEY))
        .extracting(ReportRow::getArn, ReportRow::getName)
        .containsExactly(
            tuple("arn:1", "one"), tuple("arn:2", "two-renamed"), tuple("arn:3", "three"));
  }

  @Test
  @DisplayName("tags survive the CSV round trip as a JSON column")
  void tagsColumn() {
    ResourceRecord record =
        new ResourceRecord(
            "111111111111", "iam", "AWS::IAM::Policy", "arn:1", "one", Map.of(), Map.of("env", "prod", "team", "x"));

    writer.append("iam", List.of(ReportRow.from(record, clock.instant())), "req-1");

    ReportRow stored = writer.read(KEY).get(0);
    assertThat(stored.tagMap()).containsEntry("env", "prod").containsEntry("team", "x");
    assertThat(stored.getCollectedAt()).isEqualTo("2024-06-01T08:30:00Z");
  }

  @Test
  @DisplayName("empty input returns a warning without touching the store")
  void emptyInput() {
    ReportWriteResult result = writer.append("iam", List.of(), "req-1");

    assertThat(result.status()).isEqualTo(ReportWriteResult.Status.WARNING);
    assertThat(store.putCount()).isZero();
  }

  @Test
  @DisplayName("a held lock yields LOCK_FAILED and leaves the report alone")
  void lockHeld() {
    store.putString(KEY, "Type,AccountId,Arn,Name,Tags,CollectedAt\n");
    new ObjectStoreLock(store, lockConfig, clock, d -> {}).acquire(KEY, "other");

    ReportWriteResult result = writer.append("iam", List.of(row("arn:1", "one")), "req-1");

    assertThat(result.status()).isEqualTo(ReportWriteResult.Status.LOCK_FAILED);
    assertThat(result.message()).contains("after 2 attempts");
    assertThat(writer.read(KEY)).isEmpty();
  }

  @Test
  @DisplayName("appendResult writes the records of successful accounts")
  void appendResult() {
    ResourceRecord record =
        new ResourceRecord("111111111111", "iam", "AWS::IAM::Policy", "arn:9", "nine", Map.of(), Map.of());
    Map<String, AccountResult> results = new LinkedHashMap<>();
    results.put("111111111111", AccountResult.success("111111111111", List.of(record), 0));
    CollectionResult collected =
        new CollectionResult(
            "exec-1", "iam", results, CollectionSummary.of(results.values(), Duration.ZERO), Map.of());

    ReportWriteResult result = writer.appendResult(collected, "req-1");

    assertThat(result.isWritten()).isTrue();
    assertThat(writer.read(KEY)).extracting(ReportRow::getArn).containsExactly("arn:9");
  }
}
