package com.acme.inventory.model;

public enum AccountStatus {
    SUCCESS,
    FAILED,
    CIRCUIT_OPEN
}
