package com.acme.inventory.aws;

import com.acme.inventory.model.AccountSession;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.s3.S3Client;

/** Builds SDK clients bound to the temporary credentials of an assumed role. */
public class AwsClientFactory {

  public IamClient iam(AccountSession session) {
    return IamClient.builder()
        .region(Region.AWS_GLOBAL)
        .credentialsProvider(credentials(session))
        .build();
  }

  public KmsClient kms(AccountSession session) {
    return KmsClient.builder()
        .region(Region.of(session.region()))
        .credentialsProvider(credentials(session))
        .build();
  }

  public Ec2Client ec2(AccountSession session) {
    return Ec2Client.builder()
        .region(Region.of(session.region()))
        .credentialsProvider(credentials(session))
        .build();
  }

  public S3Client s3(AccountSession session) {
    return S3Client.builder()
        .region(Region.of(session.region()))
        .crossRegionAccessEnabled(true)
        .credentialsProvider(credentials(session))
        .build();
  }

  static StaticCredentialsProvider credentials(AccountSession session) {
    return StaticCredentialsProvider.create(
        AwsSessionCredentials.create(
            session.accessKeyId(), session.secretAccessKey(), session.sessionToken()));
  }
}
