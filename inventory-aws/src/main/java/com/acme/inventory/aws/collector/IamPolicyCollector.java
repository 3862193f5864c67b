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
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.iam.model.ListPoliciesRequest;
import software.amazon.awssdk.services.iam.model.ListPoliciesResponse;
import software.amazon.awssdk.services.iam.model.ListPolicyTagsRequest;
import software.amazon.awssdk.services.iam.model.ListPolicyTagsResponse;
import software.amazon.awssdk.services.iam.model.Policy;
import software.amazon.awssdk.services.iam.model.PolicyScopeType;
import software.amazon.awssdk.services.iam.model.Tag;

/** Managed IAM policies, customer-managed only unless another scope is configured. */
public class IamPolicyCollector implements ResourceCollector {

  public static final String SERVICE = "iam";
  public static final String RESOURCE_TYPE = "AWS::IAM::Policy";

  private final Function<AccountSession, IamClient> clients;
  private final PolicyScopeType scope;

  public IamPolicyCollector(AwsClientFactory factory) {
    this(factory::iam, PolicyScopeType.LOCAL);
  }

  public IamPolicyCollector(Function<AccountSession, IamClient> clients, PolicyScopeType scope) {
    this.clients = clients;
    this.scope = scope;
  }

  @Override
  public String service() {
    return SERVICE;
  }

  @Override
  public ResourceScanner open(AccountSession session) {
    return new Scanner(clients.apply(session));
  }

  private final class Scanner implements ResourceScanner {
    private final IamClient iam;

    Scanner(IamClient iam) {
      this.iam = iam;
    }

    @Override
    public ResourcePage listPage(String cursor) {
      ListPoliciesResponse response =
          iam.listPolicies(ListPoliciesRequest.builder().scope(scope).marker(cursor).build());
      List<ResourceItem> items = new ArrayList<>();
      for (Policy policy : response.policies()) {
        Map<String, String> attributes = new LinkedHashMap<>();
        Attributes.putIfPresent(attributes, "PolicyName", policy.policyName());
        Attributes.putIfPresent(attributes, "PolicyId", policy.policyId());
        Attributes.putIfPresent(attributes, "DefaultVersionId", policy.defaultVersionId());
        Attributes.putIfPresent(attributes, "AttachmentCount", policy.attachmentCount());
        items.add(new ResourceItem(policy.arn(), RESOURCE_TYPE, attributes));
      }
      String next = Boolean.TRUE.equals(response.isTruncated()) ? response.marker() : null;
      return new ResourcePage(items, next);
    }

    @Override
    public ResourceDetail getDetail(ResourceItem item) {
      Map<String, String> tags = new HashMap<>();
      String marker = null;
      do {
        ListPolicyTagsResponse response =
            iam.listPolicyTags(
                ListPolicyTagsRequest.builder().policyArn(item.resourceId()).marker(marker).build());
        for (Tag tag : response.tags()) {
          tags.put(tag.key(), tag.value());
        }
        marker = Boolean.TRUE.equals(response.isTruncated()) ? response.marker() : null;
      } while (marker != null);
      return new ResourceDetail(item.attributes().get("PolicyName"), item.attributes(), tags);
    }

    @Override
    public void close() {
      iam.close();
    }
  }
}
