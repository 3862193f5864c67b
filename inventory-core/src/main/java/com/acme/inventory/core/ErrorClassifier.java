package com.acme.inventory.core;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Maps an arbitrary error onto an {@link ErrorKind}. This is the single gate that decides whether a
 * failure counts toward circuit breaker state; every guarded call routes its failures through it.
 *
 * <p>Resolution order, walking the cause chain from the outermost error:
 *
 * <ol>
 *   <li>{@link TransientException} / {@link PermanentException} classify as their names say
 *   <li>an error code reported by a registered {@link ErrorCodeExtractor} is looked up in the
 *       transient and permanent code sets
 *   <li>registered transient / permanent exception types ({@link IOException} is always transient)
 * </ol>
 *
 * Anything else is {@link ErrorKind#UNKNOWN}.
 */
public final class ErrorClassifier {

  public static final Set<String> DEFAULT_TRANSIENT_CODES =
      Set.of(
          "ThrottlingException",
          "Throttling",
          "RequestThrottled",
          "TooManyRequestsException",
          "RequestLimitExceeded",
          "SlowDown",
          "ServiceUnavailable",
          "InternalError",
          "InternalFailure",
          "RequestTimeout",
          "ConnectionError",
          "EndpointConnectionError");

  public static final Set<String> DEFAULT_PERMANENT_CODES =
      Set.of(
          "AccessDenied",
          "AccessDeniedException",
          "UnauthorizedOperation",
          "AuthFailure",
          "InvalidClientTokenId",
          "ExpiredToken",
          "ValidationError",
          "ValidationException",
          "MalformedPolicyDocument",
          "NoSuchEntity",
          "ResourceNotFoundException");

  private static final int MAX_CAUSE_DEPTH = 8;

  private final Set<String> transientCodes;
  private final Set<String> permanentCodes;
  private final List<Class<? extends Throwable>> transientTypes;
  private final List<Class<? extends Throwable>> permanentTypes;
  private final List<ErrorCodeExtractor> extractors;

  private ErrorClassifier(Builder b) {
    this.transientCodes = Set.copyOf(b.transientCodes);
    this.permanentCodes = Set.copyOf(b.permanentCodes);
    this.transientTypes = List.copyOf(b.transientTypes);
    this.permanentTypes = List.copyOf(b.permanentTypes);
    this.extractors = List.copyOf(b.extractors);
  }

  public static ErrorClassifier defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public ErrorKind classify(Throwable error) {
    Throwable current = error;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      ErrorKind kind = classifyOne(current);
      if (kind != ErrorKind.UNKNOWN) {
        return kind;
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return ErrorKind.UNKNOWN;
  }

  /** First error code found along the cause chain, or the simple class name of the error. */
  public String errorCode(Throwable error) {
    Throwable current = error;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      Optional<String> code = codeOf(current);
      if (code.isPresent()) {
        return code.get();
      }
      current = current.getCause();
    }
    return error == null ? "Unknown" : error.getClass().getSimpleName();
  }

  private ErrorKind classifyOne(Throwable error) {
    if (error instanceof TransientException) {
      return ErrorKind.TRANSIENT;
    }
    if (error instanceof PermanentException) {
      return ErrorKind.PERMANENT;
    }
    Optional<String> code = codeOf(error);
    if (code.isPresent()) {
      if (transientCodes.contains(code.get())) {
        return ErrorKind.TRANSIENT;
      }
      if (permanentCodes.contains(code.get())) {
        return ErrorKind.PERMANENT;
      }
    }
    if (error instanceof IOException || isInstance(transientTypes, error)) {
      return ErrorKind.TRANSIENT;
    }
    if (isInstance(permanentTypes, error)) {
      return ErrorKind.PERMANENT;
    }
    return ErrorKind.UNKNOWN;
  }

  private Optional<String> codeOf(Throwable error) {
    if (error instanceof TransientException te && te.getErrorCode() != null) {
      return Optional.of(te.getErrorCode());
    }
    if (error instanceof PermanentException pe && pe.getErrorCode() != null) {
      return Optional.of(pe.getErrorCode());
    }
    if (error instanceof CircuitOpenException) {
      return Optional.of(CircuitOpenException.ERROR_CODE);
    }
    for (ErrorCodeExtractor extractor : extractors) {
      Optional<String> code = extractor.extract(error);
      if (code.isPresent() && !code.get().isBlank()) {
        return code;
      }
    }
    return Optional.empty();
  }

  private static boolean isInstance(List<Class<? extends Throwable>> types, Throwable error) {
    for (Class<? extends Throwable> type : types) {
      if (type.isInstance(error)) {
        return true;
      }
    }
    return false;
  }

  public static final class Builder {
    private final Set<String> transientCodes = new HashSet<>(DEFAULT_TRANSIENT_CODES);
    private final Set<String> permanentCodes = new HashSet<>(DEFAULT_PERMANENT_CODES);
    private final List<Class<? extends Throwable>> transientTypes = new ArrayList<>();
    private final List<Class<? extends Throwable>> permanentTypes = new ArrayList<>();
    private final List<ErrorCodeExtractor> extractors = new ArrayList<>();

    private Builder() {}

    public Builder transientCode(String code) {
      permanentCodes.remove(code);
      transientCodes.add(code);
      return this;
    }

    public Builder permanentCode(String code) {
      transientCodes.remove(code);
      permanentCodes.add(code);
      return this;
    }

    public Builder transientType(Class<? extends Throwable> type) {
      transientTypes.add(type);
      return this;
    }

    public Builder permanentType(Class<? extends Throwable> type) {
      permanentTypes.add(type);
      return this;
    }

    public Builder codeExtractor(ErrorCodeExtractor extractor) {
      extractors.add(extractor);
      return this;
    }

    public ErrorClassifier build() {
      return new ErrorClassifier(this);
    }
  }
}
