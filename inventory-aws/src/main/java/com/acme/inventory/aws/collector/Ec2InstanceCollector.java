package com.acme.inventory.aws.collector;

import com.acme.inventory.aws.AwsClientFactory;
import com.acme.inventory.model.AccountSession;
import com.acme.inventory.model.ResourceDetail;
import com.acme.inventory.model.ResourceItem;
import com.acme.inventory.model.ResourcePage;
import com.acme.inventory.spi.ResourceCollector;
import com.acme.inventory.spi.ResourceScanner;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesResponse;
import software.amazon.awssdk.services.ec2.model.Instance;
import software.amazon.awssdk.services.ec2.model.Reservation;
import software.amazon.awssdk.services.ec2.model.Tag;

/**
 * EC2 instances of the session's region. DescribeInstances already returns tags, so they travel
 * on the listed item (prefixed {@code tag:}) and the detail step needs no further call.
 */
public class Ec2InstanceCollector implements ResourceCollector {

  public static final String SERVICE = "ec2";
  public static final String RESOURCE_TYPE = "AWS::EC2::Instance";
  static final String TAG_PREFIX = "tag:";

  private final Function<AccountSession, Ec2Client> clients;

  public Ec2InstanceCollector(AwsClientFactory factory) {
    this(factory::ec2);
  }

  public Ec2InstanceCollector(Function<AccountSession, Ec2Client> clients) {
    this.clients = clients;
  }

  @Override
  public String service() {
    return SERVICE;
  }

  @Override
  public ResourceScanner open(AccountSession session) {
    return new Scanner(clients.apply(session));
  }

  private static final class Scanner implements ResourceScanner {
    private final Ec2Client ec2;

    Scanner(Ec2Client ec2) {
      this.ec2 = ec2;
    }

    @Override
    public ResourcePage listPage(String cursor) {
      DescribeInstancesResponse response =
          ec2.describeInstances(DescribeInstancesRequest.builder().nextToken(cursor).build());
      List<ResourceItem> items = new ArrayList<>();
      for (Reservation reservation : response.reservations()) {
        for (Instance instance : reservation.instances()) {
          Map<String, String> attributes = new LinkedHashMap<>();
          Attributes.putIfPresent(attributes, "InstanceType", instance.instanceTypeAsString());
          Attributes.putIfPresent(
              attributes, "State", instance.state() == null ? null : instance.state().nameAsString());
          Attributes.putIfPresent(attributes, "ImageId", instance.imageId());
          Attributes.putIfPresent(attributes, "LaunchTime", instance.launchTime());
          Attributes.putIfPresent(attributes, "PrivateIpAddress", instance.privateIpAddress());
          for (Tag tag : instance.tags()) {
            attributes.put(TAG_PREFIX + tag.key(), tag.value());
          }
          items.add(new ResourceItem(instance.instanceId(), RESOURCE_TYPE, attributes));
        }
      }
      return new ResourcePage(items, response.nextToken());
    }

    @Override
    public ResourceDetail getDetail(ResourceItem item) {
      Map<String, String> attributes = new LinkedHashMap<>();
      Map<String, String> tags = new HashMap<>();
      item.attributes()
          .forEach(
              (key, value) -> {
                if (key.startsWith(TAG_PREFIX)) {
                  tags.put(key.substring(TAG_PREFIX.length()), value);
                } else {
                  attributes.put(key, value);
                }
              });
      String name = tags.getOrDefault("Name", item.resourceId());
      return new ResourceDetail(name, attributes, tags);
    }

    @Override
    public void close() {
      ec2.close();
    }
  }
}
