package com.acme.inventory.report;

import com.acme.inventory.core.Jsons;
import com.acme.inventory.model.ResourceRecord;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/** One line of a CSV inventory report. Tags are kept as a JSON object string. */
@JsonPropertyOrder({"Type", "AccountId", "Arn", "Name", "Tags", "CollectedAt"})
public class ReportRow {

  @JsonProperty("Type")
  private String type;

  @JsonProperty("AccountId")
  private String accountId;

  @JsonProperty("Arn")
  private String arn;

  @JsonProperty("Name")
  private String name;

  @JsonProperty("Tags")
  private String tags;

  @JsonProperty("CollectedAt")
  private String collectedAt;

  public ReportRow() {}

  public ReportRow(
      String type, String accountId, String arn, String name, String tags, String collectedAt) {
    this.type = type;
    this.accountId = accountId;
    this.arn = arn;
    this.name = name;
    this.tags = tags;
    this.collectedAt = collectedAt;
  }

  public static ReportRow from(ResourceRecord record, Instant collectedAt) {
    return new ReportRow(
        record.resourceType(),
        record.accountId(),
        record.resourceId(),
        record.name(),
        Jsons.toJson(new TreeMap<>(record.tags())),
        collectedAt.toString());
  }

  /** Identity used when merging into an existing report. */
  @JsonIgnore
  public String mergeKey() {
    return type + "|" + arn;
  }

  @JsonIgnore
  public Map<String, String> tagMap() {
    return Jsons.toStringMap(tags);
  }

  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  public String getAccountId() {
    return accountId;
  }

  public void setAccountId(String accountId) {
    this.accountId = accountId;
  }

  public String getArn() {
    return arn;
  }

  public void setArn(String arn) {
    this.arn = arn;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getTags() {
    return tags;
  }

  public void setTags(String tags) {
    this.tags = tags;
  }

  public String getCollectedAt() {
    return collectedAt;
  }

  public void setCollectedAt(String collectedAt) {
    this.collectedAt = collectedAt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ReportRow)) return false;
    ReportRow other = (ReportRow) o;
    return Objects.equals(type, other.type)
        && Objects.equals(accountId, other.accountId)
        && Objects.equals(arn, other.arn)
        && Objects.equals(name, other.name)
        && Objects.equals(tags, other.tags)
        && Objects.equals(collectedAt, other.collectedAt);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, accountId, arn, name, tags, collectedAt);
  }

  @Override
  public String toString() {
    return "ReportRow{type=" + type + ", accountId=" + accountId + ", arn=" + arn + "}";
  }
}
