package com.acme.inventory.aws.collector;

import com.acme.inventory.aws.AwsClientFactory;
import com.acme.inventory.core.PermanentException;
import com.acme.inventory.model.AccountSession;
import com.acme.inventory.model.ResourceDetail;
import com.acme.inventory.model.ResourceItem;
import com.acme.inventory.model.ResourcePage;
import com.acme.inventory.spi.ResourceCollector;
import com.acme.inventory.spi.ResourceScanner;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeImagesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeImagesResponse;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesResponse;
import software.amazon.awssdk.services.ec2.model.Image;
import software.amazon.awssdk.services.ec2.model.Instance;
import software.amazon.awssdk.services.ec2.model.InstanceStateName;
import software.amazon.awssdk.services.ec2.model.Reservation;
import software.amazon.awssdk.services.ec2.model.Tag;

/**
 * AMIs in use: the images behind running or stopped instances of the session's region, each listed
 * once per account.
 */
public class AmiCollector implements ResourceCollector {

  public static final String SERVICE = "ami";
  public static final String RESOURCE_TYPE = "AWS::EC2::Image";
  private static final Set<InstanceStateName> IN_USE =
      Set.of(InstanceStateName.RUNNING, InstanceStateName.STOPPED);

  private final Function<AccountSession, Ec2Client> clients;

  public AmiCollector(AwsClientFactory factory) {
    this(factory::ec2);
  }

  public AmiCollector(Function<AccountSession, Ec2Client> clients) {
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
    // listPage runs on the account thread only
    private final Set<String> seen = new HashSet<>();

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
          if (instance.state() == null || !IN_USE.contains(instance.state().name())) {
            continue;
          }
          String imageId = instance.imageId();
          if (imageId != null && seen.add(imageId)) {
            items.add(ResourceItem.of(imageId, RESOURCE_TYPE));
          }
        }
      }
      return new ResourcePage(items, response.nextToken());
    }

    @Override
    public ResourceDetail getDetail(ResourceItem item) {
      DescribeImagesResponse response =
          ec2.describeImages(DescribeImagesRequest.builder().imageIds(item.resourceId()).build());
      if (response.images().isEmpty()) {
        throw new PermanentException(
            "InvalidAMIID.NotFound", "AMI " + item.resourceId() + " is not visible to the account", null);
      }
      Image image = response.images().get(0);

      Map<String, String> attributes = new LinkedHashMap<>();
      Attributes.putIfPresent(attributes, "OwnerId", image.ownerId());
      Attributes.putIfPresent(attributes, "Public", image.publicLaunchPermissions());
      Attributes.putIfPresent(attributes, "CreationDate", image.creationDate());
      Attributes.putIfPresent(attributes, "PlatformDetails", image.platformDetails());
      Attributes.putIfPresent(attributes, "State", image.stateAsString());

      Map<String, String> tags = new HashMap<>();
      for (Tag tag : image.tags()) {
        tags.put(tag.key(), tag.value());
      }
      String name = image.name() == null ? item.resourceId() : image.name();
      return new ResourceDetail(name, attributes, tags);
    }

    @Override
    public void close() {
      ec2.close();
    }
  }
}
