/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.hash;


import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

/**
 *
 */
public class DigestsTest {

  @Test
  public void testSha256() {
    var digest = Digests.SHA_256;
    assertEquals("SHA-256", digest.hashAlgo());
    assertEquals(32, digest.hashWidth());
    assertEquals(
        "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
        digest.hashHex("abc"));
    assertEquals(
        "e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
        digest.hashHex(""));
    assertEquals("", digest.sentinelHash());
    assertTrue(digest.isHash(digest.hashHex("x")));
    assertFalse(digest.isHash("not a hash"));
    assertSame(digest, Digests.forAlgo("SHA-256"));
  }

}
