package com.acme.inventory.publish;

import com.acme.inventory.model.AccountResult;
import com.acme.inventory.model.CollectionResult;
import com.acme.inventory.model.ResourceRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** One collected resource as published to the message bus. Serialized with Jackson. */
public record Finding(
    String service,
    String accountId,
    String executionId,
    String resourceId,
    String resourceName,
    String resourceType,
    Map<String, String> tags,
    Map<String, String> attributes) {

  public Finding {
    tags = tags == null ? Map.of() : Map.copyOf(tags);
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }

  public static Finding of(String executionId, ResourceRecord record) {
    return new Finding(
        record.service(),
        record.accountId(),
        executionId,
        record.resourceId(),
        record.name(),
        record.resourceType(),
        record.tags(),
        record.attributes());
  }

  /** Findings for every record of every successful account, in result order. */
  public static List<Finding> fromResult(CollectionResult result) {
    List<Finding> findings = new ArrayList<>();
    for (AccountResult account : result.results().values()) {
      if (!account.isSuccess()) {
        continue;
      }
      for (ResourceRecord record : account.items()) {
        findings.add(of(result.executionId(), record));
      }
    }
    return findings;
  }
}
