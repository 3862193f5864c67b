package com.acme.inventory.model;

/** One account to collect from: which role to assume there, and in which region to scan. */
public record AccountTask(String accountId, String roleName, String region) {
    public AccountTask {
        if (accountId == null || accountId.isBlank()) {
            throw new IllegalArgumentException("accountId cannot be blank");
        }
        if (roleName == null || roleName.isBlank()) {
            throw new IllegalArgumentException("roleName cannot be blank");
        }
    }

    public String roleArn() {
        return "arn:aws:iam::" + accountId + ":role/" + roleName;
    }
}
