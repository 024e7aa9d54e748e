/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.hash;


import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Specifies a hashing method. Hashes travel through the ledger as lowercase
 * hex strings, so besides the usual algorithm particulars, an instance knows
 * how to render and recognize them.
 */
public interface Digest {


  /**
   * Returns the number of bytes used to form a hash.
   *
   * @see MessageDigest#getDigestLength()
   */
  int hashWidth();


  /**
   * Returns the name of the hashing algorithm.
   *
   * @see MessageDigest#getAlgorithm()
   */
  String hashAlgo();


  /**
   * Creates and returns a new {@code MessageDigest}. The
   * returned instance must match this digest's width.
   */
  default MessageDigest newDigest() {
    String algo = hashAlgo();
    try {

      MessageDigest digest = MessageDigest.getInstance(algo);
      assert digest.getDigestLength() == hashWidth();

      return digest;

    } catch (NoSuchAlgorithmException nsax) {
      throw new RuntimeException("on creating digest with algo " + algo, nsax);
    }
  }


  /**
   * Returns the hex-encoded hash of the given text's UTF-8 bytes.
   *
   * @return lowercase hex string, {@code 2 * hashWidth()} chars long
   */
  default String hashHex(String text) {
    MessageDigest digest = newDigest();
    digest.reset();
    byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
    return HexFormat.of().formatHex(hash);
  }


  /**
   * Returns the hash that stands in for the predecessor of the first entry
   * in a chain: the empty string.
   */
  default String sentinelHash() {
    return "";
  }


  /**
   * Tests whether the given string is a well formed hex hash of this width.
   */
  default boolean isHash(String hex) {
    if (hex == null || hex.length() != 2 * hashWidth())
      return false;
    for (int index = hex.length(); index-- > 0; ) {
      char c = hex.charAt(index);
      if (!(c >= '0' && c <= '9' || c >= 'a' && c <= 'f'))
        return false;
    }
    return true;
  }

}
