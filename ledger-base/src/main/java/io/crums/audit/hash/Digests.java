/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.hash;

import java.security.MessageDigest;

/**
 * The hashing algorithms we use are gathered here. The point is you
 * should be able to swap one out for another.
 */
public class Digests {


  /**
   * SHA-256. Hash width: 32 bytes. {@linkplain MessageDigest} instances
   * are reused per thread.
   */
  public final static Digest SHA_256 = new Digest() {

    private final ThreadLocal<MessageDigest> workDigest =
        ThreadLocal.withInitial(this::freshDigest);

    @Override
    public int hashWidth() {
      return 32;
    }

    @Override
    public String hashAlgo() {
      return "SHA-256";
    }

    @Override
    public MessageDigest newDigest() {
      return workDigest.get();
    }

    private MessageDigest freshDigest() {
      return Digest.super.newDigest();
    }

    @Override
    public String toString() {
      return hashAlgo();
    }

  };


  /**
   * Returns the digest with the given algorithm name.
   *
   * @throws IllegalArgumentException if not supported
   */
  public static Digest forAlgo(String hashAlgo) {
    if (SHA_256.hashAlgo().equalsIgnoreCase(hashAlgo))
      return SHA_256;
    throw new IllegalArgumentException("unsupported hash algorithm: " + hashAlgo);
  }


  // no instances
  private Digests() {  }

}
