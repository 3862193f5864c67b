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
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.kms.model.DescribeKeyRequest;
import software.amazon.awssdk.services.kms.model.KeyListEntry;
import software.amazon.awssdk.services.kms.model.KeyMetadata;
import software.amazon.awssdk.services.kms.model.ListKeysRequest;
import software.amazon.awssdk.services.kms.model.ListKeysResponse;
import software.amazon.awssdk.services.kms.model.ListResourceTagsRequest;
import software.amazon.awssdk.services.kms.model.ListResourceTagsResponse;
import software.amazon.awssdk.services.kms.model.Tag;

/** KMS keys of the session's region, with key metadata and resource tags. */
public class KmsKeyCollector implements ResourceCollector {

  public static final String SERVICE = "kms";
  public static final String RESOURCE_TYPE = "AWS::KMS::Key";

  private final Function<AccountSession, KmsClient> clients;

  public KmsKeyCollector(AwsClientFactory factory) {
    this(factory::kms);
  }

  public KmsKeyCollector(Function<AccountSession, KmsClient> clients) {
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
    private final KmsClient kms;

    Scanner(KmsClient kms) {
      this.kms = kms;
    }

    @Override
    public ResourcePage listPage(String cursor) {
      ListKeysResponse response = kms.listKeys(ListKeysRequest.builder().marker(cursor).build());
      List<ResourceItem> items = new ArrayList<>();
      for (KeyListEntry key : response.keys()) {
        items.add(new ResourceItem(key.keyArn(), RESOURCE_TYPE, Map.of("KeyId", key.keyId())));
      }
      String next = Boolean.TRUE.equals(response.truncated()) ? response.nextMarker() : null;
      return new ResourcePage(items, next);
    }

    @Override
    public ResourceDetail getDetail(ResourceItem item) {
      String keyId = item.attributes().get("KeyId");
      KeyMetadata metadata =
          kms.describeKey(DescribeKeyRequest.builder().keyId(keyId).build()).keyMetadata();

      Map<String, String> attributes = new LinkedHashMap<>(item.attributes());
      Attributes.putIfPresent(attributes, "KeyState", metadata.keyStateAsString());
      Attributes.putIfPresent(attributes, "KeyManager", metadata.keyManagerAsString());
      Attributes.putIfPresent(attributes, "KeyUsage", metadata.keyUsageAsString());
      Attributes.putIfPresent(attributes, "CreationDate", metadata.creationDate());

      Map<String, String> tags = new HashMap<>();
      String marker = null;
      do {
        ListResourceTagsResponse response =
            kms.listResourceTags(ListResourceTagsRequest.builder().keyId(keyId).marker(marker).build());
        for (Tag tag : response.tags()) {
          tags.put(tag.tagKey(), tag.tagValue());
        }
        marker = Boolean.TRUE.equals(response.truncated()) ? response.nextMarker() : null;
      } while (marker != null);

      String description = metadata.description();
      String name = description == null || description.isBlank() ? keyId : description;
      return new ResourceDetail(name, attributes, tags);
    }

    @Override
    public void close() {
      kms.close();
    }
  }
}
