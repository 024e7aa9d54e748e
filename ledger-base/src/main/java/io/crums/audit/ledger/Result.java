/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.ledger;


import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a caller-facing operation. There are 3 shapes:
 * <ol>
 * <li><em>ok</em>: a value, no error.</li>
 * <li><em>failure</em>: an error, no value. The operation had no effect.</li>
 * <li><em>degraded</em>: both a value and an error. The operation took effect
 * (e.g. an entry was committed in memory), but something ancillary to it
 * (e.g. writing it to disk) failed.</li>
 * </ol>
 *
 * @param <T> the value type
 */
public final class Result<T> {


  public static <T> Result<T> ok(T value) {
    return new Result<>(Objects.requireNonNull(value, "null value"), null, null);
  }


  public static <T> Result<T> failure(ErrorKind error, String message) {
    return new Result<>(null, Objects.requireNonNull(error, "null error"), message);
  }


  public static <T> Result<T> degraded(T value, ErrorKind error, String message) {
    return new Result<>(
        Objects.requireNonNull(value, "null value"),
        Objects.requireNonNull(error, "null error"),
        message);
  }



  private final T value;
  private final ErrorKind error;
  private final String message;


  private Result(T value, ErrorKind error, String message) {
    this.value = value;
    this.error = error;
    this.message = message == null ? "" : message;
  }


  /** Returns {@code true} iff there is no error. */
  public boolean isOk() {
    return error == null;
  }

  /** Returns {@code true} iff the operation took effect (ok or degraded). */
  public boolean hasValue() {
    return value != null;
  }

  /** Returns {@code true} iff there's both a value and an error. */
  public boolean isDegraded() {
    return value != null && error != null;
  }


  /** Returns the value, if any. */
  public Optional<T> value() {
    return Optional.ofNullable(value);
  }


  /**
   * Returns the value.
   *
   * @throws NoSuchElementException if this is a failure
   */
  public T get() throws NoSuchElementException {
    if (value == null)
      throw new NoSuchElementException(error + ": " + message);
    return value;
  }


  /** Returns the error, if any. */
  public Optional<ErrorKind> error() {
    return Optional.ofNullable(error);
  }


  /** Returns the error detail; empty if ok. */
  public String message() {
    return message;
  }


  /**
   * Maps the value (if any), preserving the error state.
   */
  public <U> Result<U> map(Function<? super T, ? extends U> func) {
    U mapped = value == null ?
        null : Objects.requireNonNull(func.apply(value), "mapped value is null");
    return new Result<>(mapped, error, message);
  }


  @Override
  public String toString() {
    if (error == null)
      return "ok[" + value + "]";
    return (value == null ? "failure[" : "degraded[" + value + ", ") + error + ": " + message + "]";
  }

}
