package com.acme.inventory.aws;

import com.acme.inventory.core.ErrorClassifier;
import com.acme.inventory.core.ErrorCodeExtractor;
import java.util.Optional;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;

/** Reads AWS service error codes and builds the classifier used for every AWS call. */
public final class AwsErrorCodes {

  /** Error code reported by the service, e.g. {@code ThrottlingException} or {@code AccessDenied}. */
  public static final ErrorCodeExtractor EXTRACTOR = AwsErrorCodes::errorCode;

  private AwsErrorCodes() {}

  public static Optional<String> errorCode(Throwable error) {
    if (!(error instanceof AwsServiceException)) {
      return Optional.empty();
    }
    AwsServiceException ase = (AwsServiceException) error;
    if (ase.awsErrorDetails() != null && ase.awsErrorDetails().errorCode() != null) {
      return Optional.of(ase.awsErrorDetails().errorCode());
    }
    if (ase.isThrottlingException()) {
      return Optional.of("Throttling");
    }
    if (ase.statusCode() == 503) {
      return Optional.of("ServiceUnavailable");
    }
    return Optional.empty();
  }

  /**
   * Default classifier plus the SDK error code extractor. Client-side SDK failures (connection
   * errors, timeouts before a response) are transient.
   */
  public static ErrorClassifier classifier() {
    return ErrorClassifier.builder()
        .codeExtractor(EXTRACTOR)
        .transientType(SdkClientException.class)
        .build();
  }
}
