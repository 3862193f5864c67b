package com.acme.inventory.aws.org;

/** An account of the organization as reported by AWS Organizations. */
public record MemberAccount(String id, String name, String status) {}
