package com.example.authsession.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * Tagged outcome: either a value or the {@link FailureKind} explaining its absence.
 */
public record Result<T>(T value, FailureKind failure) {

  public Result {
    if ((value == null) == (failure == null)) {
      throw new IllegalArgumentException("Exactly one of value or failure must be set");
    }
  }

  public static <T> Result<T> ok(T value) {
    return new Result<>(Objects.requireNonNull(value, "value"), null);
  }

  public static <T> Result<T> err(FailureKind failure) {
    return new Result<>(null, Objects.requireNonNull(failure, "failure"));
  }

  public boolean isOk() {
    return failure == null;
  }

  public Optional<T> toOptional() {
    return Optional.ofNullable(value);
  }
}
