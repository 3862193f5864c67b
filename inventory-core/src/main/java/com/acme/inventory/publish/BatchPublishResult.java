package com.acme.inventory.publish;

import java.util.List;

public record BatchPublishResult(int total, int successful, int failed, List<PublishOutcome> outcomes) {

  public static final BatchPublishResult EMPTY = new BatchPublishResult(0, 0, 0, List.of());

  public BatchPublishResult {
    outcomes = List.copyOf(outcomes);
  }

  public static BatchPublishResult of(List<PublishOutcome> outcomes) {
    int successful = (int) outcomes.stream().filter(PublishOutcome::success).count();
    return new BatchPublishResult(outcomes.size(), successful, outcomes.size() - successful, outcomes);
  }

  public boolean allPublished() {
    return failed == 0;
  }
}
