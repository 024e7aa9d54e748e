/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.ledger;


import java.io.File;
import java.io.IOException;
import java.lang.System.Logger.Level;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import io.crums.audit.crypt.EncryptionException;
import io.crums.audit.crypt.StreamCipher;
import io.crums.audit.json.JsonParsingException;

/**
 * A ledger's backing file.
 *
 * <h2>Format</h2>
 * <p>
 * Newline-terminated UTF-8 lines. The first line is the {@linkplain LedgerHeader
 * header} (plaintext JSON); every subsequent line is one {@linkplain LedgerEntry
 * entry} record, in append order. With a {@linkplain StreamCipher cipher}, a
 * record line is the Base64 of the encrypted record JSON.
 * </p>
 * <h2>Failure Modes</h2>
 * <ul>
 * <li>If a record fails to encrypt, it is written in plaintext (and a warning logged).</li>
 * <li>On load, a record line that fails to decrypt is read as plaintext (with a
 * warning). If that fails too, or the header is bad, or the last line is torn, the
 * file is {@linkplain UnreadableLedgerException unreadable}.</li>
 * <li>A failed write is rolled back (the file is truncated to its prior length).</li>
 * </ul>
 */
public final class LedgerFile implements LedgerSink {


  /**
   * Opens the given ledger file for appending, creating it if it doesn't exist
   * (or is empty). The file's entries are loaded in full.
   *
   * @param file    path to ledger file
   * @param name    ledger name (written to the header of a new file)
   * @param cipher  optional (may be {@code null})
   * @param clock   stamps a new file's header
   *
   * @throws UnreadableLedgerException if an existing file cannot be read in full
   * @throws PersistenceException on I/O error
   */
  public static LedgerFile open(File file, String name, StreamCipher cipher, Clock clock)
      throws UnreadableLedgerException, PersistenceException {

    Objects.requireNonNull(name, "null name");
    try {
      if (!file.exists() || file.length() == 0) {
        var header = LedgerHeader.forScheme(name, HashScheme.V1, clock.instant());
        var ch = FileChannel.open(
            file.toPath(),
            StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        var lf = new LedgerFile(file, cipher, header, List.of(), ch, 0);
        try {
          byte[] line = (LedgerHeader.PARSER.toJsonLine(header) + "\n").getBytes(StandardCharsets.UTF_8);
          lf.append(line);
        } catch (IOException iox) {
          lf.close();
          throw iox;
        }
        return lf;
      }

      return load(file, Files.readAllBytes(file.toPath()), cipher);

    } catch (IOException iox) {
      throw new PersistenceException("failed to open ledger file " + file + ": " + iox.getMessage(), iox);
    }
  }


  /**
   * Reads and returns the given ledger file's header and entries, without
   * opening it for writing.
   *
   * @param cipher  optional (may be {@code null})
   */
  public static LedgerContents read(File file, StreamCipher cipher)
      throws UnreadableLedgerException, PersistenceException {
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(file.toPath());
    } catch (IOException iox) {
      throw new PersistenceException("failed to read ledger file " + file + ": " + iox.getMessage(), iox);
    }
    if (bytes.length == 0)
      throw new UnreadableLedgerException(file, 0, "empty file");
    return parse(file, bytes, cipher);
  }


  /**
   * Header and entries of a ledger file.
   */
  public record LedgerContents(LedgerHeader header, List<LedgerEntry> entries) {

    public LedgerContents {
      Objects.requireNonNull(header, "null header");
      entries = Collections.unmodifiableList(entries);
    }

    /** Returns an in-memory ledger with these contents. */
    public Ledger toLedger() {
      return Ledger.restore(header.ledger(), header.scheme(), entries);
    }
  }


  private static LedgerFile load(File file, byte[] bytes, StreamCipher cipher) throws IOException {
    var contents = parse(file, bytes, cipher);
    var ch = FileChannel.open(file.toPath(), StandardOpenOption.WRITE);
    return new LedgerFile(file, cipher, contents.header(), contents.entries(), ch, bytes.length);
  }


  private static LedgerContents parse(File file, byte[] bytes, StreamCipher cipher)
      throws UnreadableLedgerException {

    if (bytes[bytes.length - 1] != '\n')
      throw new UnreadableLedgerException(
          file, countLines(bytes), "torn record (no line terminator)");

    var text = new String(bytes, StandardCharsets.UTF_8);
    String[] lines = text.split("\n");

    LedgerHeader header;
    try {
      header = LedgerHeader.PARSER.toEntity(lines[0]);
    } catch (JsonParsingException jpx) {
      throw new UnreadableLedgerException(file, 1, "bad header: " + jpx.getMessage(), jpx);
    }
    HashScheme scheme;
    try {
      scheme = header.scheme();
    } catch (IllegalArgumentException iax) {
      throw new UnreadableLedgerException(file, 1, iax.getMessage(), iax);
    }
    if (!scheme.digest().hashAlgo().equals(header.digest()))
      throw new UnreadableLedgerException(
          file, 1, "digest '" + header.digest() + "' does not match version " + header.version());

    List<LedgerEntry> entries = new ArrayList<>(lines.length);
    for (int index = 1; index < lines.length; ++index)
      entries.add(parseRecord(file, index + 1, lines[index], cipher));

    return new LedgerContents(header, entries);
  }


  private static int countLines(byte[] bytes) {
    int count = 1;
    for (byte b : bytes)
      if (b == '\n')
        ++count;
    return count;
  }


  private static LedgerEntry parseRecord(File file, int lineNo, String line, StreamCipher cipher) {
    if (cipher != null && !line.startsWith("{")) {
      try {
        byte[] plain = cipher.decrypt(Base64.getDecoder().decode(line));
        line = new String(plain, StandardCharsets.UTF_8);
      } catch (EncryptionException | IllegalArgumentException x) {
        LedgerConstants.getLogger().log(
            Level.WARNING,
            "failed to decrypt " + file + " line " + lineNo + "; reading as plaintext: " +
            x.getMessage());
      }
    }
    try {
      return LedgerEntry.PARSER.toEntity(line);
    } catch (JsonParsingException jpx) {
      throw new UnreadableLedgerException(file, lineNo, jpx.getMessage(), jpx);
    }
  }



  private final File file;
  private final StreamCipher cipher;
  private final LedgerHeader header;
  private final List<LedgerEntry> loaded;
  private final FileChannel ch;
  private long length;


  private LedgerFile(
      File file, StreamCipher cipher, LedgerHeader header, List<LedgerEntry> loaded,
      FileChannel ch, long length) {
    this.file = file;
    this.cipher = cipher;
    this.header = header;
    this.loaded = loaded;
    this.ch = ch;
    this.length = length;
  }


  public File file() {
    return file;
  }


  public LedgerHeader header() {
    return header;
  }


  /**
   * Returns the entries read on opening.
   */
  public List<LedgerEntry> loadedEntries() {
    return loaded;
  }


  /**
   * Returns a ledger backed by this file, starting with the
   * {@linkplain #loadedEntries() loaded entries}.
   */
  public Ledger toLedger(Clock clock) {
    return new Ledger(header.ledger(), header.scheme(), loaded, this, clock);
  }


  @Override
  public int write(List<LedgerEntry> entries) throws IOException {
    int fallbacks = 0;
    var lines = new StringBuilder(entries.size() * 512);
    for (var entry : entries) {
      String json = LedgerEntry.PARSER.toJsonLine(entry);
      if (cipher != null) {
        try {
          byte[] encrypted = cipher.encrypt(json.getBytes(StandardCharsets.UTF_8));
          json = Base64.getEncoder().encodeToString(encrypted);
        } catch (EncryptionException ex) {
          ++fallbacks;
          LedgerConstants.getLogger().log(
              Level.WARNING,
              "failed to encrypt entry " + entry.entryId() + " in " + file +
              "; writing plaintext: " + ex.getMessage());
        }
      }
      lines.append(json).append('\n');
    }
    append(lines.toString().getBytes(StandardCharsets.UTF_8));
    return fallbacks;
  }


  private void append(byte[] bytes) throws IOException {
    var buffer = ByteBuffer.wrap(bytes);
    long pos = length;
    try {
      while (buffer.hasRemaining())
        pos += ch.write(buffer, pos);
      ch.force(false);
    } catch (IOException iox) {
      try {
        ch.truncate(length);
      } catch (IOException suppressed) {
        iox.addSuppressed(suppressed);
      }
      throw iox;
    }
    length = pos;
  }


  @Override
  public void close() {
    try {
      ch.close();
    } catch (IOException iox) {
      LedgerConstants.getLogger().log(
          Level.WARNING, "failed to close " + file + ": " + iox.getMessage());
    }
  }

}
