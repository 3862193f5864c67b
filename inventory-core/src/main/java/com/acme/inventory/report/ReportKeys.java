package com.acme.inventory.report;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.Locale;

/** Object keys of daily per-service reports. */
public final class ReportKeys {
  private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd");

  private ReportKeys() {}

  /**
   * {@code <prefix>/<yyyy>/<month>/<service>-<month>-<dd>-<yyyyMMdd>.csv}, month as a lower-case
   * English name. Colons in the service name become dashes.
   */
  public static String dailyKey(String prefix, String service, LocalDate date) {
    String month = date.getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT);
    String day = String.format(Locale.ROOT, "%02d", date.getDayOfMonth());
    String file =
        service.replace(':', '-') + "-" + month + "-" + day + "-" + STAMP.format(date) + ".csv";
    String path = date.getYear() + "/" + month + "/" + file;
    if (prefix == null || prefix.isBlank()) {
      return path;
    }
    return stripSlashes(prefix) + "/" + path;
  }

  private static String stripSlashes(String prefix) {
    int start = 0;
    int end = prefix.length();
    while (start < end && prefix.charAt(start) == '/') {
      start++;
    }
    while (end > start && prefix.charAt(end - 1) == '/') {
      end--;
    }
    return prefix.substring(start, end);
  }
}
