package com.acme.inventory.aws.sts;

import com.acme.inventory.model.AccountSession;
import com.acme.inventory.model.AccountTask;
import com.acme.inventory.spi.RoleAssumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;
import software.amazon.awssdk.services.sts.model.AssumeRoleResponse;
import software.amazon.awssdk.services.sts.model.Credentials;

/** Assumes the inventory role in a member account through STS. */
public class StsRoleAssumer implements RoleAssumer {
  private static final Logger LOG = LoggerFactory.getLogger(StsRoleAssumer.class);

  public static final String SESSION_NAME = "AWSAutoInventorySession";
  public static final int SESSION_DURATION_SECONDS = 3600;

  private final StsClient sts;

  public StsRoleAssumer(StsClient sts) {
    this.sts = sts;
  }

  @Override
  public AccountSession assumeRole(String accountId, String roleName, String region) {
    String roleArn = new AccountTask(accountId, roleName, region).roleArn();
    LOG.debug("Assuming role {}", roleArn);

    AssumeRoleResponse response =
        sts.assumeRole(
            AssumeRoleRequest.builder()
                .roleArn(roleArn)
                .roleSessionName(SESSION_NAME)
                .durationSeconds(SESSION_DURATION_SECONDS)
                .build());

    Credentials credentials = response.credentials();
    LOG.info("Assumed role {} (expires {})", roleArn, credentials.expiration());
    return new AccountSession(
        accountId,
        region,
        credentials.accessKeyId(),
        credentials.secretAccessKey(),
        credentials.sessionToken(),
        credentials.expiration());
  }
}
