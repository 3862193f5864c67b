package com.acme.inventory.aws.store;

import com.acme.inventory.spi.ObjectStore;
import com.acme.inventory.spi.ObjectStoreException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

/**
 * {@link ObjectStore} over one S3 bucket. Conditional creates use {@code If-None-Match: *}, which
 * S3 answers with 412 when the key already exists and 409 when a concurrent conditional write
 * is still in flight. Compare-and-delete uses the re-read default.
 */
public class S3ObjectStore implements ObjectStore {
  private static final Logger LOG = LoggerFactory.getLogger(S3ObjectStore.class);
  static final int PRECONDITION_FAILED = 412;
  static final int CONFLICT = 409;

  private final S3Client s3;
  private final String bucket;

  public S3ObjectStore(S3Client s3, String bucket) {
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalArgumentException("bucket cannot be blank");
    }
    this.s3 = s3;
    this.bucket = bucket;
  }

  public String getBucket() {
    return bucket;
  }

  @Override
  public Optional<byte[]> get(String key) {
    try {
      byte[] content =
          s3.getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(key).build())
              .asByteArray();
      return Optional.of(content);
    } catch (NoSuchKeyException e) {
      return Optional.empty();
    } catch (SdkException e) {
      throw new ObjectStoreException(key, "Cannot read s3://" + bucket + "/" + key, e);
    }
  }

  @Override
  public void put(String key, byte[] content, String contentType) {
    try {
      s3.putObject(
          PutObjectRequest.builder().bucket(bucket).key(key).contentType(contentType).build(),
          RequestBody.fromBytes(content));
      LOG.debug("Wrote {} bytes to s3://{}/{}", content.length, bucket, key);
    } catch (SdkException e) {
      throw new ObjectStoreException(key, "Cannot write s3://" + bucket + "/" + key, e);
    }
  }

  @Override
  public void delete(String key) {
    try {
      s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
    } catch (SdkException e) {
      throw new ObjectStoreException(key, "Cannot delete s3://" + bucket + "/" + key, e);
    }
  }

  @Override
  public boolean supportsConditionalWrite() {
    return true;
  }

  @Override
  public boolean putIfAbsent(String key, byte[] content, String contentType) {
    try {
      s3.putObject(
          PutObjectRequest.builder()
              .bucket(bucket)
              .key(key)
              .contentType(contentType)
              .ifNoneMatch("*")
              .build(),
          RequestBody.fromBytes(content));
      return true;
    } catch (S3Exception e) {
      if (e.statusCode() == PRECONDITION_FAILED || e.statusCode() == CONFLICT) {
        LOG.debug("s3://{}/{} already exists ({})", bucket, key, e.statusCode());
        return false;
      }
      throw new ObjectStoreException(key, "Cannot create s3://" + bucket + "/" + key, e);
    } catch (SdkException e) {
      throw new ObjectStoreException(key, "Cannot create s3://" + bucket + "/" + key, e);
    }
  }
}
