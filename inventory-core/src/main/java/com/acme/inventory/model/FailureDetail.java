package com.acme.inventory.model;

import com.acme.inventory.core.ErrorKind;

/** Structured failure: which operation failed, how it was classified, and the service error code. */
public record FailureDetail(String operation, ErrorKind kind, String code, String message) {}
