/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.session;


import java.io.File;
import java.io.IOException;
import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.Base64;
import java.util.List;
import java.util.Objects;

import org.json.simple.JSONArray;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

import io.crums.audit.crypt.EncryptionException;
import io.crums.audit.crypt.StreamCipher;
import io.crums.audit.json.JsonParsingException;
import io.crums.audit.json.JsonWriter;
import io.crums.audit.ledger.PersistenceException;
import io.crums.audit.ledger.UnreadableLedgerException;

/**
 * The sessions file. Every save rewrites the whole file (a JSON array of
 * {@linkplain UserSession sessions}) by way of a temp file that is then
 * moved over the old one.
 *
 * <p>
 * With a cipher, the file's contents are the Base64 of the encrypted JSON.
 * Encryption and decryption failures fall back to plaintext, as in
 * {@linkplain io.crums.audit.ledger.LedgerFile LedgerFile}.
 * </p>
 */
public class SessionStore {

  private final static String TMP_EXT = ".tmp";
  private final static String UNREADABLE_EXT = ".unreadable-";


  static Logger getLogger() {
    return System.getLogger(SessionConstants.LOG_NAME);
  }


  private final File file;
  private final StreamCipher cipher;


  /**
   * Creates an instance storing {@value SessionConstants#SESSIONS_FILE} in the
   * given directory.
   *
   * @param dir     created if it doesn't exist
   * @param cipher  optional (may be {@code null})
   * @throws PersistenceException if {@code dir} cannot be created
   */
  public SessionStore(File dir, StreamCipher cipher) throws PersistenceException {
    Objects.requireNonNull(dir, "null dir");
    if (!dir.isDirectory() && !dir.mkdirs())
      throw new PersistenceException("failed to create sessions directory " + dir);
    this.file = new File(dir, SessionConstants.SESSIONS_FILE);
    this.cipher = cipher;
  }


  public File file() {
    return file;
  }


  /**
   * Loads and returns the saved sessions, in saved order.
   *
   * @return empty, if there is no file
   * @throws UnreadableLedgerException if the file cannot be parsed
   * @throws PersistenceException on I/O error
   */
  public List<UserSession> load() throws UnreadableLedgerException, PersistenceException {
    if (!file.exists())
      return List.of();
    String text;
    try {
      text = new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8).strip();
    } catch (IOException iox) {
      throw new PersistenceException("failed to read " + file + ": " + iox.getMessage(), iox);
    }
    if (text.isEmpty())
      return List.of();

    if (cipher != null && !text.startsWith("[")) {
      try {
        byte[] plain = cipher.decrypt(Base64.getDecoder().decode(text));
        text = new String(plain, StandardCharsets.UTF_8);
      } catch (EncryptionException | IllegalArgumentException x) {
        getLogger().log(
            Level.WARNING,
            "failed to decrypt " + file + "; reading as plaintext: " + x.getMessage());
      }
    }
    try {
      var jArray = (JSONArray) new JSONParser().parse(text);
      return UserSession.PARSER.toEntityList(jArray);
    } catch (ParseException | ClassCastException | NumberFormatException x) {
      throw new UnreadableLedgerException(file, 0, "malformed sessions file: " + x.getMessage(), x);
    } catch (JsonParsingException jpx) {
      throw new UnreadableLedgerException(file, 0, jpx.getMessage(), jpx);
    }
  }


  /**
   * Saves the given sessions, replacing the file's previous contents.
   *
   * @return {@code false} iff a cipher is set but encryption failed (in which
   *         case the file was written in plaintext)
   * @throws IOException if the file could not be written (the previous file
   *         is left intact)
   */
  public boolean save(List<UserSession> sessions) throws IOException {
    String json = JsonWriter.PRETTY.toJson(UserSession.PARSER.toJsonArray(sessions));
    byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
    boolean encrypted = true;
    if (cipher != null) {
      try {
        bytes = Base64.getEncoder().encode(cipher.encrypt(bytes));
      } catch (EncryptionException ex) {
        encrypted = false;
        getLogger().log(
            Level.WARNING,
            "failed to encrypt " + file + "; writing plaintext: " + ex.getMessage());
      }
    }
    var tmp = new File(file.getParentFile(), file.getName() + TMP_EXT).toPath();
    Files.write(tmp, bytes);
    try {
      Files.move(tmp, file.toPath(), StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException amnsx) {
      Files.move(tmp, file.toPath(), StandardCopyOption.REPLACE_EXISTING);
    }
    return encrypted;
  }


  /**
   * Moves an unreadable sessions file aside, so that it is not overwritten.
   *
   * @param suffix  appended to the file name (after {@code .unreadable-})
   * @return the new location
   */
  public File quarantine(String suffix) throws PersistenceException {
    var target = new File(file.getParentFile(), file.getName() + UNREADABLE_EXT + suffix);
    try {
      Files.move(file.toPath(), target.toPath());
    } catch (IOException iox) {
      throw new PersistenceException(
          "failed to move unreadable " + file + " to " + target + ": " + iox.getMessage(), iox);
    }
    return target;
  }

}
