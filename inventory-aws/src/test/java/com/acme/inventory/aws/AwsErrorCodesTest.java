package com.acme.inventory.aws;

import static org.assertj.core.api.Assertions.*;

import com.acme.inventory.core.ErrorClassifier;
import com.acme.inventory.core.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;

class AwsErrorCodesTest {

  static AwsServiceException serviceError(String code, int status) {
    return AwsServiceException.builder()
        .message(code + " from service")
        .statusCode(status)
        .awsErrorDetails(AwsErrorDetails.builder().errorCode(code).errorMessage(code).build())
        .build();
  }

  @Nested
  class ErrorCode {

    @Test
    void readsServiceErrorCode() {
      assertThat(AwsErrorCodes.errorCode(serviceError("AccessDenied", 403))).contains("AccessDenied");
    }

    @Test
    @DisplayName("a 503 without error details is ServiceUnavailable")
    void serviceUnavailableFallback() {
      AwsServiceException e = AwsServiceException.builder().statusCode(503).build();

      assertThat(AwsErrorCodes.errorCode(e)).contains("ServiceUnavailable");
    }

    @Test
    void nonAwsErrorHasNoCode() {
      assertThat(AwsErrorCodes.errorCode(new IllegalStateException("boom"))).isEmpty();
    }
  }

  @Nested
  class Classification {
    private final ErrorClassifier classifier = AwsErrorCodes.classifier();

    @Test
    void throttlingIsTransient() {
      assertThat(classifier.classify(serviceError("ThrottlingException", 400)))
          .isEqualTo(ErrorKind.TRANSIENT);
    }

    @Test
    void accessDeniedIsPermanent() {
      assertThat(classifier.classify(serviceError("AccessDenied", 403)))
          .isEqualTo(ErrorKind.PERMANENT);
      assertThat(classifier.errorCode(serviceError("AccessDenied", 403))).isEqualTo("AccessDenied");
    }

    @Test
    @DisplayName("client-side SDK failures are transient")
    void clientErrorsAreTransient() {
      SdkClientException e = SdkClientException.create("Unable to execute HTTP request");

      assertThat(classifier.classify(e)).isEqualTo(ErrorKind.TRANSIENT);
    }

    @Test
    @DisplayName("wrapped service errors are classified by their cause")
    void wrappedCause() {
      RuntimeException wrapped = new RuntimeException("listing failed", serviceError("SlowDown", 503));

      assertThat(classifier.classify(wrapped)).isEqualTo(ErrorKind.TRANSIENT);
      assertThat(classifier.errorCode(wrapped)).isEqualTo("SlowDown");
    }

    @Test
    void unrecognisedCodeIsUnknown() {
      assertThat(classifier.classify(serviceError("SomethingOdd", 400))).isEqualTo(ErrorKind.UNKNOWN);
    }
  }
}
