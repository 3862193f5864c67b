package com.acme.inventory.model;

import java.time.Instant;

/** Temporary credentials obtained by assuming a role in a member account. */
public record AccountSession(
        String accountId,
        String region,
        String accessKeyId,
        String secretAccessKey,
        String sessionToken,
        Instant expiration) {

    @Override
    public String toString() {
        // credentials stay out of logs
        return "AccountSession[accountId=" + accountId + ", region=" + region + ", expiration=" + expiration + "]";
    }
}
