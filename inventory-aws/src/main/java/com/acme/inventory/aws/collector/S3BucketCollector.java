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
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.Bucket;
import software.amazon.awssdk.services.s3.model.GetBucketLocationRequest;
import software.amazon.awssdk.services.s3.model.GetBucketTaggingRequest;
import software.amazon.awssdk.services.s3.model.ListBucketsRequest;
import software.amazon.awssdk.services.s3.model.ListBucketsResponse;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.Tag;

/** S3 buckets owned by the account, with their region and bucket tags. */
public class S3BucketCollector implements ResourceCollector {

  public static final String SERVICE = "s3";
  public static final String RESOURCE_TYPE = "AWS::S3::Bucket";
  static final String NO_SUCH_TAG_SET = "NoSuchTagSet";

  private final Function<AccountSession, S3Client> clients;

  public S3BucketCollector(AwsClientFactory factory) {
    this(factory::s3);
  }

  public S3BucketCollector(Function<AccountSession, S3Client> clients) {
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
    private final S3Client s3;

    Scanner(S3Client s3) {
      this.s3 = s3;
    }

    @Override
    public ResourcePage listPage(String cursor) {
      // ListBuckets returns every bucket of the account in one response
      ListBucketsResponse response = s3.listBuckets(ListBucketsRequest.builder().build());
      List<ResourceItem> items = new ArrayList<>();
      for (Bucket bucket : response.buckets()) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("BucketName", bucket.name());
        Attributes.putIfPresent(attributes, "CreationDate", bucket.creationDate());
        items.add(new ResourceItem("arn:aws:s3:::" + bucket.name(), RESOURCE_TYPE, attributes));
      }
      return ResourcePage.last(items);
    }

    @Override
    public ResourceDetail getDetail(ResourceItem item) {
      String bucket = item.attributes().get("BucketName");
      Map<String, String> attributes = new LinkedHashMap<>(item.attributes());

      String location =
          s3.getBucketLocation(GetBucketLocationRequest.builder().bucket(bucket).build())
              .locationConstraintAsString();
      attributes.put("Region", location == null || location.isEmpty() ? "us-east-1" : location);

      Map<String, String> tags = new HashMap<>();
      try {
        for (Tag tag :
            s3.getBucketTagging(GetBucketTaggingRequest.builder().bucket(bucket).build()).tagSet()) {
          tags.put(tag.key(), tag.value());
        }
      } catch (S3Exception e) {
        if (e.awsErrorDetails() == null || !NO_SUCH_TAG_SET.equals(e.awsErrorDetails().errorCode())) {
          throw e;
        }
      }
      return new ResourceDetail(bucket, attributes, tags);
    }

    @Override
    public void close() {
      s3.close();
    }
  }
}
