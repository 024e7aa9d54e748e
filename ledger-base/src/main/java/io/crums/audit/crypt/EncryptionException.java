/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.crypt;


/**
 * Encryption, decryption or key-handling failure.
 *
 * @see io.crums.audit.ledger.ErrorKind#ENCRYPTION
 */
@SuppressWarnings("serial")
public class EncryptionException extends RuntimeException {

  public EncryptionException(String message) {
    super(message);
  }

  public EncryptionException(String message, Throwable cause) {
    super(message, cause);
  }

}
