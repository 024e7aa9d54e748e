/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.crypt;


import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Base64;

import javax.crypto.Cipher;
import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * AES-256 in GCM mode. Each ciphertext is laid out as
 * <pre>
 *   IV (12 bytes) | encrypted bytes | tag (16 bytes)
 * </pre>
 * with a fresh random IV per call. Since GCM authenticates, a wrong key
 * or a corrupted ciphertext fails decryption (never returns garbage).
 */
public class AesGcmCipher implements StreamCipher {

  public final static String ALGO = "AES";
  public final static String TRANSFORMATION = "AES/GCM/NoPadding";

  /** Key width in bytes. */
  public final static int KEY_BYTES = 32;
  /** IV width in bytes. */
  public final static int IV_BYTES = 12;
  /** Tag width in bits. */
  public final static int TAG_BITS = 128;


  /**
   * Generates and returns a new random key.
   */
  public static SecretKey generateKey() {
    try {
      KeyGenerator gen = KeyGenerator.getInstance(ALGO);
      gen.init(KEY_BYTES * 8);
      return gen.generateKey();
    } catch (GeneralSecurityException gsx) {
      throw new EncryptionException("failed to generate AES key: " + gsx.getMessage(), gsx);
    }
  }


  /**
   * Loads a Base64-encoded key from the given file.
   *
   * @throws EncryptionException if the file's contents are not a 256-bit key
   * @throws UncheckedIOException on I/O error
   */
  public static SecretKey loadKey(File keyFile) throws EncryptionException, UncheckedIOException {
    String encoded;
    try {
      encoded = Files.readString(keyFile.toPath(), StandardCharsets.US_ASCII).strip();
    } catch (IOException iox) {
      throw new UncheckedIOException("failed to read key file " + keyFile, iox);
    }
    byte[] key;
    try {
      key = Base64.getDecoder().decode(encoded);
    } catch (IllegalArgumentException iax) {
      throw new EncryptionException("key file " + keyFile + " is not Base64", iax);
    }
    if (key.length != KEY_BYTES)
      throw new EncryptionException(
          "key file " + keyFile + " holds " + key.length + " bytes; expected " + KEY_BYTES);
    return new SecretKeySpec(key, ALGO);
  }


  /**
   * Saves the given key Base64-encoded to a new file.
   *
   * @throws UncheckedIOException if the file already exists, or on I/O error
   */
  public static void saveKey(SecretKey key, File keyFile) throws UncheckedIOException {
    byte[] encoded = Base64.getEncoder().encode(key.getEncoded());
    try {
      Files.write(keyFile.toPath(), encoded, StandardOpenOption.CREATE_NEW);
    } catch (IOException iox) {
      throw new UncheckedIOException("failed to write key file " + keyFile, iox);
    }
  }


  /**
   * Loads the key from the given file, generating and saving one first
   * if the file does not exist.
   */
  public static AesGcmCipher fromKeyFile(File keyFile) {
    if (!keyFile.exists())
      saveKey(generateKey(), keyFile);
    return new AesGcmCipher(loadKey(keyFile));
  }



  private final SecretKey key;
  private final SecureRandom random = new SecureRandom();


  public AesGcmCipher(SecretKey key) {
    this.key = key;
    byte[] encoded = key.getEncoded();
    if (!ALGO.equals(key.getAlgorithm()) || encoded == null || encoded.length != KEY_BYTES)
      throw new IllegalArgumentException("not a 256-bit AES key: " + key.getAlgorithm());
  }


  @Override
  public byte[] encrypt(byte[] plaintext) throws EncryptionException {
    byte[] iv = new byte[IV_BYTES];
    random.nextBytes(iv);
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
      byte[] out = new byte[IV_BYTES + cipher.getOutputSize(plaintext.length)];
      System.arraycopy(iv, 0, out, 0, IV_BYTES);
      int len = cipher.doFinal(plaintext, 0, plaintext.length, out, IV_BYTES);
      return len + IV_BYTES == out.length ? out : Arrays.copyOf(out, len + IV_BYTES);
    } catch (GeneralSecurityException gsx) {
      throw new EncryptionException("encryption failed: " + gsx.getMessage(), gsx);
    }
  }


  @Override
  public byte[] decrypt(byte[] ciphertext) throws EncryptionException {
    if (ciphertext.length < IV_BYTES + TAG_BITS / 8)
      throw new EncryptionException(
          "ciphertext too short (" + ciphertext.length + " bytes)");
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(
          Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, ciphertext, 0, IV_BYTES));
      return cipher.doFinal(ciphertext, IV_BYTES, ciphertext.length - IV_BYTES);
    } catch (GeneralSecurityException gsx) {
      throw new EncryptionException("decryption failed: " + gsx.getMessage(), gsx);
    }
  }

}
