package com.acme.inventory.lock;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** Content of a {@code <key>.lock} object. */
public record LockRecord(
    @JsonProperty("lock_id") String lockId,
    @JsonProperty("timestamp") Instant createdAt,
    @JsonProperty("expires") Instant expiresAt,
    @JsonProperty("request_id") String ownerRequestId) {

  public boolean isExpired(Instant now) {
    return now.isAfter(expiresAt);
  }
}
