package com.acme.inventory.aws.org;

import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.organizations.OrganizationsClient;
import software.amazon.awssdk.services.organizations.model.Account;
import software.amazon.awssdk.services.organizations.model.AccountStatus;
import software.amazon.awssdk.services.organizations.model.ListAccountsForParentRequest;
import software.amazon.awssdk.services.organizations.model.ListAccountsForParentResponse;
import software.amazon.awssdk.services.organizations.model.ListOrganizationalUnitsForParentRequest;
import software.amazon.awssdk.services.organizations.model.ListOrganizationalUnitsForParentResponse;
import software.amazon.awssdk.services.organizations.model.OrganizationalUnit;

/**
 * Resolves the active accounts under an organizational unit, descending into every child unit.
 * Must run with management-account (or delegated administrator) credentials.
 */
public class OrganizationAccountSource {
  private static final Logger LOG = LoggerFactory.getLogger(OrganizationAccountSource.class);

  private final OrganizationsClient organizations;

  public OrganizationAccountSource(OrganizationsClient organizations) {
    this.organizations = organizations;
  }

  /** Active accounts directly under {@code parentId} and under all of its descendant units. */
  public List<MemberAccount> activeAccounts(String parentId) {
    List<MemberAccount> accounts = new ArrayList<>();
    collect(parentId, accounts);
    LOG.info("Found {} active accounts under {}", accounts.size(), parentId);
    return accounts;
  }

  private void collect(String parentId, List<MemberAccount> accounts) {
    String token = null;
    do {
      ListAccountsForParentResponse page =
          organizations.listAccountsForParent(
              ListAccountsForParentRequest.builder().parentId(parentId).nextToken(token).build());
      for (Account account : page.accounts()) {
        if (account.status() == AccountStatus.ACTIVE) {
          accounts.add(new MemberAccount(account.id(), account.name(), account.statusAsString()));
        } else {
          LOG.debug("Skipping account {} ({})", account.id(), account.statusAsString());
        }
      }
      token = page.nextToken();
    } while (token != null);

    for (String child : childUnits(parentId)) {
      collect(child, accounts);
    }
  }

  private List<String> childUnits(String parentId) {
    List<String> units = new ArrayList<>();
    String token = null;
    do {
      ListOrganizationalUnitsForParentResponse page =
          organizations.listOrganizationalUnitsForParent(
              ListOrganizationalUnitsForParentRequest.builder()
                  .parentId(parentId)
                  .nextToken(token)
                  .build());
      for (OrganizationalUnit unit : page.organizationalUnits()) {
        units.add(unit.id());
      }
      token = page.nextToken();
    } while (token != null);
    return units;
  }
}
