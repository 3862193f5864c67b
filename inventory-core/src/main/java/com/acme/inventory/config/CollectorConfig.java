package com.acme.inventory.config;

import com.acme.inventory.resilience.CircuitBreakerSettings;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Concurrency and breaker settings for a collection run. Pure POJO - no framework dependencies.
 *
 * <p>Breaker settings are looked up by operation name: an exact entry wins, then the entry for the
 * operation suffix ({@code -list}, {@code -detail}), then the built-in defaults.
 */
public class CollectorConfig {

  public static final String ASSUME_ROLE = "assume-role";
  public static final String PUBLISH = "publish";
  public static final String LIST_SUFFIX = "-list";
  public static final String DETAIL_SUFFIX = "-detail";

  private int maxAccountConcurrency = 3;
  private int maxResourceConcurrency = 5;
  private String roleName = "InventoryRole";
  private String region = "us-east-1";
  private final Map<String, CircuitBreakerSettings> breakers = new HashMap<>();

  public CollectorConfig() {
    breakers.put(ASSUME_ROLE, CircuitBreakerSettings.of(3, Duration.ofSeconds(60)));
    breakers.put(LIST_SUFFIX, CircuitBreakerSettings.of(3, Duration.ofSeconds(30)));
    breakers.put(DETAIL_SUFFIX, CircuitBreakerSettings.of(5, Duration.ofSeconds(15)));
    breakers.put(PUBLISH, CircuitBreakerSettings.of(5, Duration.ofSeconds(30)));
  }

  public int getMaxAccountConcurrency() {
    return maxAccountConcurrency;
  }

  public void setMaxAccountConcurrency(int maxAccountConcurrency) {
    if (maxAccountConcurrency <= 0) {
      throw new IllegalArgumentException(
          "maxAccountConcurrency must be positive (current: " + maxAccountConcurrency + ")");
    }
    this.maxAccountConcurrency = maxAccountConcurrency;
  }

  public int getMaxResourceConcurrency() {
    return maxResourceConcurrency;
  }

  public void setMaxResourceConcurrency(int maxResourceConcurrency) {
    if (maxResourceConcurrency <= 0) {
      throw new IllegalArgumentException(
          "maxResourceConcurrency must be positive (current: " + maxResourceConcurrency + ")");
    }
    this.maxResourceConcurrency = maxResourceConcurrency;
  }

  public String getRoleName() {
    return roleName;
  }

  public void setRoleName(String roleName) {
    this.roleName = roleName;
  }

  public String getRegion() {
    return region;
  }

  public void setRegion(String region) {
    this.region = region;
  }

  /** Overrides settings for one operation name, or for every operation ending in a suffix. */
  public void setBreakerSettings(String nameOrSuffix, CircuitBreakerSettings settings) {
    breakers.put(nameOrSuffix, settings);
  }

  public CircuitBreakerSettings breakerSettings(String operationName) {
    CircuitBreakerSettings exact = breakers.get(operationName);
    if (exact != null) {
      return exact;
    }
    if (operationName.endsWith(LIST_SUFFIX)) {
      return breakers.get(LIST_SUFFIX);
    }
    if (operationName.endsWith(DETAIL_SUFFIX)) {
      return breakers.get(DETAIL_SUFFIX);
    }
    return new CircuitBreakerSettings();
  }

  public static String listOperation(String service) {
    return service + LIST_SUFFIX;
  }

  public static String detailOperation(String service) {
    return service + DETAIL_SUFFIX;
  }
}
