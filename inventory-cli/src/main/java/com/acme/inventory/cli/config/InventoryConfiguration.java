package com.acme.inventory.cli.config;

import com.acme.inventory.config.CollectorConfig;
import com.acme.inventory.config.LockConfig;
import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Settings read from the environment, with an optional {@code .env} file in the working directory
 * filling in what the environment leaves unset. Command-line options override these values.
 */
public class InventoryConfiguration {
    private static final Logger logger = LoggerFactory.getLogger(InventoryConfiguration.class);
    private static InventoryConfiguration instance;
    private final Dotenv dotenv;

    public InventoryConfiguration(Dotenv dotenv) {
        this.dotenv = dotenv;
    }

    public static synchronized InventoryConfiguration getInstance() {
        if (instance == null) {
            instance = new InventoryConfiguration(Dotenv.configure().ignoreIfMissing().load());
            logger.debug("Configuration loaded");
        }
        return instance;
    }

    private String get(String key, String defaultValue) {
        String value = dotenv.get(key);
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    private int getInt(String key, int defaultValue) {
        String value = dotenv.get(key);
        if (value != null) {
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid integer value for {}: {}, using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private double getDouble(String key, double defaultValue) {
        String value = dotenv.get(key);
        if (value != null) {
            try {
                return Double.parseDouble(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid number for {}: {}, using default: {}", key, value, defaultValue);
            }
        }
        return defaultValue;
    }

    private boolean getBoolean(String key, boolean defaultValue) {
        String value = dotenv.get(key);
        return value != null ? Boolean.parseBoolean(value.trim()) : defaultValue;
    }

    // Collection
    public String getRoleName() {
        return get("INVENTORY_ROLE_NAME", "InventoryRole");
    }

    public String getRegion() {
        return get("AWS_REGION", "us-east-1");
    }

    public int getMaxAccountConcurrency() {
        return getInt("MAX_ACCOUNT_CONCURRENCY", 3);
    }

    public int getMaxResourceConcurrency() {
        return getInt("MAX_RESOURCE_CONCURRENCY", 5);
    }

    // Publishing
    public PublisherType getPublisher() {
        return PublisherType.parse(get("PUBLISHER", "none"));
    }

    public String getSnsTopicArn() {
        return get("SNS_TOPIC_ARN", null);
    }

    public String getKafkaBootstrapServers() {
        return get("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092");
    }

    public String getKafkaTopic() {
        return get("KAFKA_TOPIC", "inventory-findings");
    }

    /** Destination for the configured publisher: the SNS topic ARN or the Kafka topic name. */
    public String getPublishTopic() {
        return getPublisher() == PublisherType.KAFKA ? getKafkaTopic() : getSnsTopicArn();
    }

    // Reports
    public String getReportBucket() {
        return get("REPORT_BUCKET", null);
    }

    public String getReportPrefix() {
        return get("REPORT_PREFIX", "inventory");
    }

    public String getReportDir() {
        return get("REPORT_DIR", null);
    }

    // Locking
    public int getLockTimeoutSeconds() {
        return getInt("LOCK_TIMEOUT_SECONDS", 60);
    }

    public int getLockMaxAttempts() {
        return getInt("LOCK_MAX_ATTEMPTS", 5);
    }

    public double getLockBaseBackoffSeconds() {
        return getDouble("LOCK_BASE_BACKOFF_SECONDS", 2.0);
    }

    public double getLockJitterFactor() {
        return getDouble("LOCK_JITTER_FACTOR", 1.0);
    }

    public boolean isLockRequireConditionalWrite() {
        return getBoolean("LOCK_REQUIRE_CONDITIONAL_WRITE", false);
    }

    public CollectorConfig collectorConfig() {
        CollectorConfig config = new CollectorConfig();
        config.setRoleName(getRoleName());
        config.setRegion(getRegion());
        config.setMaxAccountConcurrency(getMaxAccountConcurrency());
        config.setMaxResourceConcurrency(getMaxResourceConcurrency());
        return config;
    }

    public LockConfig lockConfig() {
        LockConfig config = new LockConfig();
        config.setTimeout(Duration.ofSeconds(getLockTimeoutSeconds()));
        config.setMaxAttempts(getLockMaxAttempts());
        config.setBaseBackoffSeconds(getLockBaseBackoffSeconds());
        config.setJitterFactor(getLockJitterFactor());
        config.setRequireConditionalWrite(isLockRequireConditionalWrite());
        return config;
    }
}
