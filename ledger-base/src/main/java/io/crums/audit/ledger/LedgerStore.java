/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.ledger;


import java.io.File;
import java.lang.System.Logger.Level;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

import io.crums.audit.crypt.StreamCipher;

/**
 * A directory of named, file-backed ledgers. Ledger {@code foo} lives in
 * file {@code foo.ledger}. Repeated {@linkplain #open(String) opens} of the
 * same name return the same {@linkplain Ledger} instance, so that every
 * appender shares that ledger's lock.
 *
 * <p>
 * Names are restricted to ASCII letters, digits, {@code '_'}, {@code '-'}
 * and {@code '.'}, and may not begin with a dot.
 * </p>
 */
public class LedgerStore implements AutoCloseable {

  private final static Pattern NAME_REGEX = Pattern.compile("[A-Za-z0-9_\\-][A-Za-z0-9_.\\-]*");


  /**
   * Tests whether the given string is a legal ledger name.
   */
  public static boolean isValidName(String name) {
    return name != null && name.length() <= 200 && NAME_REGEX.matcher(name).matches();
  }



  private final File dir;
  private final StreamCipher cipher;
  private final Clock clock;

  private final Map<String, Ledger> open = new HashMap<>();
  private boolean closed;


  /**
   * Creates an unencrypted store.
   */
  public LedgerStore(File dir) {
    this(dir, null, Clock.systemUTC());
  }


  /**
   * @param dir     directory (created if it doesn't exist)
   * @param cipher  optional (may be {@code null})
   * @param clock   timestamps entries
   *
   * @throws PersistenceException if {@code dir} cannot be created
   */
  public LedgerStore(File dir, StreamCipher cipher, Clock clock) throws PersistenceException {
    this.dir = Objects.requireNonNull(dir, "null dir");
    this.cipher = cipher;
    this.clock = Objects.requireNonNull(clock, "null clock");
    if (!dir.isDirectory() && !dir.mkdirs())
      throw new PersistenceException("failed to create ledger directory " + dir);
  }


  public File dir() {
    return dir;
  }


  public Optional<StreamCipher> cipher() {
    return Optional.ofNullable(cipher);
  }


  public Clock clock() {
    return clock;
  }


  /**
   * Returns the path to the named ledger's file (which may not exist).
   */
  public File file(String name) {
    checkName(name);
    return new File(dir, name + LedgerConstants.LEDGER_EXT);
  }


  /**
   * Opens (or creates) the named ledger.
   *
   * @throws UnreadableLedgerException if the ledger exists but cannot be read in full
   * @throws PersistenceException on I/O error
   * @throws IllegalStateException if the store is closed
   */
  public Ledger open(String name)
      throws UnreadableLedgerException, PersistenceException, IllegalStateException {
    File file = file(name);
    synchronized (open) {
      if (closed)
        throw new IllegalStateException("store closed: " + dir);
      Ledger ledger = open.get(name);
      if (ledger == null) {
        try {
          ledger = LedgerFile.open(file, name, cipher, clock).toLedger(clock);
        } catch (UnreadableLedgerException ulx) {
          LedgerConstants.getLogger().log(Level.ERROR, ulx.getMessage());
          throw ulx;
        }
        open.put(name, ledger);
      }
      return ledger;
    }
  }


  /**
   * Tests whether the named ledger has a file.
   */
  public boolean exists(String name) {
    return file(name).isFile();
  }


  /**
   * Returns the names of the ledgers with the given prefix, sorted.
   *
   * @param prefix empty string for all
   */
  public List<String> names(String prefix) {
    String[] files = dir.list();
    if (files == null)
      return List.of();
    List<String> names = new ArrayList<>();
    for (String f : files) {
      if (!f.endsWith(LedgerConstants.LEDGER_EXT))
        continue;
      String name = f.substring(0, f.length() - LedgerConstants.LEDGER_EXT.length());
      if (name.startsWith(prefix) && isValidName(name))
        names.add(name);
    }
    Collections.sort(names);
    return names;
  }


  /**
   * Closes (if open) and deletes the named ledger.
   *
   * @return {@code true} if a file was deleted
   */
  public boolean delete(String name) {
    File file = file(name);
    synchronized (open) {
      Ledger ledger = open.remove(name);
      if (ledger != null)
        ledger.close();
      return file.delete();
    }
  }


  /**
   * Closes every open ledger. Idempotent.
   */
  @Override
  public void close() {
    synchronized (open) {
      if (closed)
        return;
      closed = true;
      open.values().forEach(Ledger::close);
      open.clear();
    }
  }


  private void checkName(String name) {
    if (!isValidName(name))
      throw new IllegalArgumentException("illegal ledger name: " + name);
  }

}
