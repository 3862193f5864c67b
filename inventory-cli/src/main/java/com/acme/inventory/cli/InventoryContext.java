package com.acme.inventory.cli;

import com.acme.inventory.aws.AwsClientFactory;
import com.acme.inventory.aws.AwsErrorCodes;
import com.acme.inventory.aws.collector.AwsCollectors;
import com.acme.inventory.aws.org.MemberAccount;
import com.acme.inventory.aws.org.OrganizationAccountSource;
import com.acme.inventory.aws.publish.SnsMessagePublisher;
import com.acme.inventory.aws.store.S3ObjectStore;
import com.acme.inventory.aws.sts.StsRoleAssumer;
import com.acme.inventory.cli.config.InventoryConfiguration;
import com.acme.inventory.collector.CollectionOrchestrator;
import com.acme.inventory.config.CollectorConfig;
import com.acme.inventory.config.LockConfig;
import com.acme.inventory.core.ErrorClassifier;
import com.acme.inventory.kafka.KafkaMessagePublisher;
import com.acme.inventory.kafka.KafkaProducerFactory;
import com.acme.inventory.resilience.CircuitBreakerRegistry;
import com.acme.inventory.spi.MessagePublisher;
import com.acme.inventory.spi.ObjectStore;
import com.acme.inventory.spi.ResourceCollector;
import com.acme.inventory.spi.RoleAssumer;
import com.acme.inventory.store.FileSystemObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.organizations.OrganizationsClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sts.StsClient;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Everything one command invocation needs, wired from {@link InventoryConfiguration}. Clients for
 * publishing, reports and Organizations are only created when a command asks for them, and are
 * closed with the context.
 */
public class InventoryContext implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(InventoryContext.class);

    private final InventoryConfiguration configuration;
    private final CollectorConfig collectorConfig;
    private final LockConfig lockConfig;
    private final CircuitBreakerRegistry breakers;
    private final RoleAssumer roleAssumer;
    private final Function<String, ResourceCollector> collectors;
    private final Function<String, List<MemberAccount>> accountSource;
    private final Supplier<MessagePublisher> publisher;
    private final Supplier<ObjectStore> reportStore;
    private final List<AutoCloseable> resources;

    private InventoryContext(Builder b) {
        this.configuration = b.configuration;
        this.collectorConfig = b.configuration.collectorConfig();
        this.lockConfig = b.configuration.lockConfig();
        this.breakers = new CircuitBreakerRegistry(collectorConfig::breakerSettings, b.classifier);
        this.roleAssumer = b.roleAssumer;
        this.collectors = b.collectors;
        this.accountSource = b.accountSource;
        this.publisher = b.publisher;
        this.reportStore = b.reportStore;
        this.resources = b.resources;
    }

    public static Builder builder(InventoryConfiguration configuration) {
        return new Builder(configuration);
    }

    /** Wires the AWS adapters and the configured publisher and report store. */
    public static InventoryContext fromConfiguration(InventoryConfiguration configuration) {
        Builder b = builder(configuration);
        Region region = Region.of(configuration.getRegion());

        StsClient sts = StsClient.builder().region(region).build();
        b.resources.add(sts);
        AwsClientFactory clients = new AwsClientFactory();

        b.classifier(AwsErrorCodes.classifier())
                .roleAssumer(new StsRoleAssumer(sts))
                .collectors(service -> AwsCollectors.forService(service, clients))
                .accountSource(ou -> {
                    OrganizationsClient organizations = b.register(
                            OrganizationsClient.builder().region(Region.AWS_GLOBAL).build());
                    return new OrganizationAccountSource(organizations).activeAccounts(ou);
                })
                .publisher(() -> createPublisher(configuration, region, b))
                .reportStore(() -> createReportStore(configuration, region, b));
        return b.build();
    }

    private static MessagePublisher createPublisher(InventoryConfiguration configuration, Region region, Builder b) {
        switch (configuration.getPublisher()) {
            case SNS:
                if (configuration.getSnsTopicArn() == null) {
                    throw new IllegalStateException("PUBLISHER=sns requires SNS_TOPIC_ARN");
                }
                return new SnsMessagePublisher(b.register(SnsClient.builder().region(region).build()));
            case KAFKA:
                KafkaProducerFactory factory =
                        new KafkaProducerFactory(configuration.getKafkaBootstrapServers(), "inventory-cli");
                return b.register(new KafkaMessagePublisher(factory.kafkaProducer()));
            default:
                throw new IllegalStateException("No publisher configured; set PUBLISHER to sns or kafka");
        }
    }

    private static ObjectStore createReportStore(InventoryConfiguration configuration, Region region, Builder b) {
        if (configuration.getReportBucket() != null) {
            S3Client s3 = b.register(S3Client.builder().region(region).crossRegionAccessEnabled(true).build());
            return new S3ObjectStore(s3, configuration.getReportBucket());
        }
        if (configuration.getReportDir() != null) {
            return new FileSystemObjectStore(Path.of(configuration.getReportDir()));
        }
        throw new IllegalStateException("No report destination configured; set REPORT_BUCKET or REPORT_DIR");
    }

    public InventoryConfiguration configuration() {
        return configuration;
    }

    public CollectorConfig collectorConfig() {
        return collectorConfig;
    }

    public LockConfig lockConfig() {
        return lockConfig;
    }

    public CircuitBreakerRegistry breakers() {
        return breakers;
    }

    public CollectionOrchestrator orchestrator() {
        return new CollectionOrchestrator(roleAssumer, breakers, collectorConfig);
    }

    public ResourceCollector collector(String service) {
        return collectors.apply(service);
    }

    public List<MemberAccount> accountsUnder(String organizationalUnit) {
        return accountSource.apply(organizationalUnit);
    }

    public MessagePublisher publisher() {
        return publisher.get();
    }

    public ObjectStore reportStore() {
        return reportStore.get();
    }

    @Override
    public void close() {
        for (AutoCloseable resource : resources) {
            try {
                resource.close();
            } catch (Exception e) {
                logger.warn("Failed to close {}: {}", resource.getClass().getSimpleName(), e.getMessage());
            }
        }
        resources.clear();
    }

    public static class Builder {
        private final InventoryConfiguration configuration;
        private final List<AutoCloseable> resources = new ArrayList<>();
        private ErrorClassifier classifier = ErrorClassifier.defaults();
        private RoleAssumer roleAssumer;
        private Function<String, ResourceCollector> collectors;
        private Function<String, List<MemberAccount>> accountSource = ou -> {
            throw new IllegalStateException("No account source configured");
        };
        private Supplier<MessagePublisher> publisher = () -> {
            throw new IllegalStateException("No publisher configured");
        };
        private Supplier<ObjectStore> reportStore = () -> {
            throw new IllegalStateException("No report destination configured");
        };

        private Builder(InventoryConfiguration configuration) {
            this.configuration = configuration;
        }

        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder roleAssumer(RoleAssumer roleAssumer) {
            this.roleAssumer = roleAssumer;
            return this;
        }

        public Builder collectors(Function<String, ResourceCollector> collectors) {
            this.collectors = collectors;
            return this;
        }

        public Builder accountSource(Function<String, List<MemberAccount>> accountSource) {
            this.accountSource = accountSource;
            return this;
        }

        public Builder publisher(Supplier<MessagePublisher> publisher) {
            this.publisher = publisher;
            return this;
        }

        public Builder reportStore(Supplier<ObjectStore> reportStore) {
            this.reportStore = reportStore;
            return this;
        }

        <T extends AutoCloseable> T register(T resource) {
            resources.add(resource);
            return resource;
        }

        public InventoryContext build() {
            if (roleAssumer == null || collectors == null) {
                throw new IllegalStateException("roleAssumer and collectors are required");
            }
            return new InventoryContext(this);
        }
    }
}
