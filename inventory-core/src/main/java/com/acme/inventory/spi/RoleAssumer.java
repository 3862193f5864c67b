package com.acme.inventory.spi;

import com.acme.inventory.model.AccountSession;

/** Obtains temporary credentials for a member account. */
public interface RoleAssumer {
  AccountSession assumeRole(String accountId, String roleName, String region);
}
