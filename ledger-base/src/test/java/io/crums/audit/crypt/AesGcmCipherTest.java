/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.crypt;


import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 *
 */
public class AesGcmCipherTest {

  @TempDir
  File dir;


  @Test
  public void testEncryptDecrypt() {
    var cipher = new AesGcmCipher(AesGcmCipher.generateKey());
    byte[] plain = "attack at dawn".getBytes(StandardCharsets.UTF_8);
    byte[] a = cipher.encrypt(plain);
    byte[] b = cipher.encrypt(plain);
    assertEquals(AesGcmCipher.IV_BYTES + plain.length + 16, a.length);
    assertFalse(java.util.Arrays.equals(a, b));
    assertArrayEquals(plain, cipher.decrypt(a));
    assertArrayEquals(plain, cipher.decrypt(b));
  }


  @Test
  public void testTamperedCiphertext() {
    var cipher = new AesGcmCipher(AesGcmCipher.generateKey());
    byte[] enc = cipher.encrypt(new byte[] { 1, 2, 3 });
    enc[enc.length - 1] ^= 1;
    assertThrows(EncryptionException.class, () -> cipher.decrypt(enc));
    assertThrows(EncryptionException.class, () -> cipher.decrypt(new byte[5]));
  }


  @Test
  public void testWrongKey() {
    byte[] enc = new AesGcmCipher(AesGcmCipher.generateKey()).encrypt(new byte[] { 9 });
    var other = new AesGcmCipher(AesGcmCipher.generateKey());
    assertThrows(EncryptionException.class, () -> other.decrypt(enc));
  }


  @Test
  public void testKeyFile() throws Exception {
    File keyFile = new File(dir, "audit.key");
    var cipher = AesGcmCipher.fromKeyFile(keyFile);
    assertTrue(keyFile.isFile());
    byte[] enc = cipher.encrypt(new byte[] { 4, 5 });

    var reloaded = AesGcmCipher.fromKeyFile(keyFile);
    assertArrayEquals(new byte[] { 4, 5 }, reloaded.decrypt(enc));

    assertThrows(
        UncheckedIOException.class,
        () -> AesGcmCipher.saveKey(AesGcmCipher.generateKey(), keyFile));

    File bad = new File(dir, "bad.key");
    Files.writeString(bad.toPath(), "c2hvcnQ=");
    assertThrows(EncryptionException.class, () -> AesGcmCipher.loadKey(bad));
  }

}
