package com.acme.inventory.report;

import com.acme.inventory.lock.LockedWriteResult;
import com.acme.inventory.lock.ObjectStoreLock;
import com.acme.inventory.model.CollectionResult;
import com.acme.inventory.model.ResourceRecord;
import com.acme.inventory.spi.ObjectStore;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges rows into the day's CSV report for a service. The read-merge-write cycle runs under an
 * {@link ObjectStoreLock} so concurrent writers appending to the same report do not lose each
 * other's rows.
 */
public class CsvReportWriter {
  private static final Logger LOG = LoggerFactory.getLogger(CsvReportWriter.class);
  private static final String CONTENT_TYPE = "text/csv";

  private final ObjectStore store;
  private final ObjectStoreLock lock;
  private final String prefix;
  private final Clock clock;
  private final CsvMapper csv;
  private final CsvSchema schema;

  public CsvReportWriter(ObjectStore store, ObjectStoreLock lock, String prefix) {
    this(store, lock, prefix, Clock.systemUTC());
  }

  public CsvReportWriter(ObjectStore store, ObjectStoreLock lock, String prefix, Clock clock) {
    this.store = store;
    this.lock = lock;
    this.prefix = prefix;
    this.clock = clock;
    this.csv = new CsvMapper();
    this.csv.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    this.schema = csv.schemaFor(ReportRow.class).withHeader().withColumnReordering(true);
  }

  public String currentKey(String service) {
    return ReportKeys.dailyKey(prefix, service, LocalDate.now(clock.withZone(ZoneOffset.UTC)));
  }

  /** Appends every record of the successful accounts of {@code result} to today's report. */
  public ReportWriteResult appendResult(CollectionResult result, String requestId) {
    Instant collectedAt = clock.instant();
    List<ReportRow> rows = new ArrayList<>();
    for (ResourceRecord record : result.allRecords()) {
      rows.add(ReportRow.from(record, collectedAt));
    }
    return append(result.service(), rows, requestId);
  }

  public ReportWriteResult append(String service, List<ReportRow> rows, String requestId) {
    String key = currentKey(service);
    if (rows.isEmpty()) {
      LOG.warn("No rows to write for {} (requestId={})", key, requestId);
      return new ReportWriteResult(ReportWriteResult.Status.WARNING, key, 0, "No rows to write");
    }

    LockedWriteResult<Integer> written =
        lock.writeWithLock(key, lockId -> mergeAndWrite(key, rows, lockId), requestId);
    if (!written.acquired()) {
      return new ReportWriteResult(ReportWriteResult.Status.LOCK_FAILED, key, 0, written.message());
    }
    return new ReportWriteResult(
        ReportWriteResult.Status.WRITTEN,
        key,
        written.value(),
        "Wrote " + written.value() + " rows (" + rows.size() + " new or updated)");
  }

  private int mergeAndWrite(String key, List<ReportRow> rows, String lockId) {
    Map<String, ReportRow> merged = new LinkedHashMap<>();
    for (ReportRow existing : read(key)) {
      merged.put(existing.mergeKey(), existing);
    }
    int previous = merged.size();
    for (ReportRow row : rows) {
      merged.put(row.mergeKey(), row);
    }
    try {
      byte[] content = csv.writer(schema).writeValueAsBytes(new ArrayList<>(merged.values()));
      store.put(key, content, CONTENT_TYPE);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot write CSV report " + key, e);
    }
    LOG.info(
        "Wrote {} rows to {} ({} existing, {} submitted, lockId={})",
        merged.size(),
        key,
        previous,
        rows.size(),
        lockId);
    return merged.size();
  }

  /** Rows of an existing report, empty when the report does not exist yet. */
  public List<ReportRow> read(String key) {
    Optional<byte[]> content = store.get(key);
    if (content.isEmpty() || content.get().length == 0) {
      LOG.debug("Report {} does not exist yet", key);
      return List.of();
    }
    try (MappingIterator<ReportRow> it =
        csv.readerFor(ReportRow.class).with(schema).readValues(content.get())) {
      return it.readAll();
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot parse CSV report " + key, e);
    }
  }
}
