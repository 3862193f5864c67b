package com.acme.inventory.spi;

import com.acme.inventory.model.AccountSession;

/**
 * One resource type (AMIs, IAM policies, KMS keys, ...) that can be inventoried per account. The
 * collector itself is stateless; everything bound to an account lives in the scanner it opens.
 */
public interface ResourceCollector {

  /** Short service name used in breaker names, findings and report keys, e.g. {@code iam}. */
  String service();

  ResourceScanner open(AccountSession session);
}
