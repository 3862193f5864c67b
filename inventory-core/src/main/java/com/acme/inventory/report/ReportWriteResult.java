package com.acme.inventory.report;

public record ReportWriteResult(Status status, String key, int rowsWritten, String message) {

  public enum Status {
    WRITTEN,
    /** Nothing to write; the store was not touched. */
    WARNING,
    LOCK_FAILED
  }

  public boolean isWritten() {
    return status == Status.WRITTEN;
  }
}
