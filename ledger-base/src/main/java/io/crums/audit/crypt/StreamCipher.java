/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.crypt;

/**
 * At-rest encryption of persisted records. Implementations must be
 * thread-safe, and {@code decrypt(encrypt(b))} must equal {@code b}.
 *
 * @see AesGcmCipher
 */
public interface StreamCipher {

  /**
   * Returns the ciphertext of the given bytes.
   *
   * @throws EncryptionException on failure
   */
  byte[] encrypt(byte[] plaintext) throws EncryptionException;

  /**
   * Returns the plaintext of the given bytes.
   *
   * @throws EncryptionException if the input is not ciphertext produced by
   *         this cipher (and key), or on any other failure
   */
  byte[] decrypt(byte[] ciphertext) throws EncryptionException;

}
