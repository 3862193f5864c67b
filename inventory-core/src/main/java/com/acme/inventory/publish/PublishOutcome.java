package com.acme.inventory.publish;

/** Result of publishing one message of a batch. */
public record PublishOutcome(int index, boolean success, String messageId, String errorCode, String error) {

  public static PublishOutcome published(int index, String messageId) {
    return new PublishOutcome(index, true, messageId, null, null);
  }

  public static PublishOutcome failed(int index, String errorCode, String error) {
    return new PublishOutcome(index, false, null, errorCode, error);
  }
}
