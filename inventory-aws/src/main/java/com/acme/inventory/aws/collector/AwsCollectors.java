package com.acme.inventory.aws.collector;

import com.acme.inventory.aws.AwsClientFactory;
import com.acme.inventory.spi.ResourceCollector;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/** Collectors known by service name. */
public final class AwsCollectors {
  private static final Map<String, Function<AwsClientFactory, ResourceCollector>> FACTORIES =
      new LinkedHashMap<>();

  static {
    FACTORIES.put(IamPolicyCollector.SERVICE, IamPolicyCollector::new);
    FACTORIES.put(KmsKeyCollector.SERVICE, KmsKeyCollector::new);
    FACTORIES.put(Ec2InstanceCollector.SERVICE, Ec2InstanceCollector::new);
    FACTORIES.put(S3BucketCollector.SERVICE, S3BucketCollector::new);
    FACTORIES.put(AmiCollector.SERVICE, AmiCollector::new);
  }

  private AwsCollectors() {}

  public static Set<String> services() {
    return FACTORIES.keySet();
  }

  /**
   * @throws IllegalArgumentException for a service without a collector
   */
  public static ResourceCollector forService(String service, AwsClientFactory clients) {
    Function<AwsClientFactory, ResourceCollector> factory = FACTORIES.get(service);
    if (factory == null) {
      throw new IllegalArgumentException(
          "Unsupported service '" + service + "', expected one of " + FACTORIES.keySet());
    }
    return factory.apply(clients);
  }
}
