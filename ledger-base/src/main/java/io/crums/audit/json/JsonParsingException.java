/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.json;

/**
 * Unchecked exception for JSON that is malformed, or that doesn't describe
 * the expected entity.
 */
@SuppressWarnings("serial")
public class JsonParsingException extends RuntimeException {

  public JsonParsingException(String message) {
    super(message);
  }

  public JsonParsingException(String message, Throwable cause) {
    super(message, cause);
  }

}
