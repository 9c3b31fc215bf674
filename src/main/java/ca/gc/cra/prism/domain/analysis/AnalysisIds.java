package ca.gc.cra.prism.domain.analysis;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <strong>What:</strong> Derives opaque analysis identifiers for submissions.
 * <p><strong>Why:</strong> Ids must stay distinct even when the same submitter sends the same file many
 * times within one clock tick.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; a shared sequence and thread-local randomness
 * feed every digest.</p>
 * <p><strong>Performance:</strong> One SHA-256 digest per id.</p>
 *
 * @implNote The digest covers the file reference, submitter, wall clock, nano clock, a process-wide
 *     sequence, and 64 random bits; the first {@value #ID_HEX_LENGTH} hex characters form the id.
 *     Callers still reserve ids with a put-if-absent so a truncated-digest collision cannot overwrite a
 *     live record.
 * @since 0.1.0
 */
public final class AnalysisIds {
  /** Length of generated identifiers in hex characters. */
  public static final int ID_HEX_LENGTH = 16;

  private static final HexFormat HEX = HexFormat.of();
  private static final AtomicLong SEQUENCE = new AtomicLong();

  private AnalysisIds() {}

  /**
   * Generates an identifier for a submission.
   *
   * @param fileRef submitted file reference
   * @param submitter submitting identity
   * @param epochMillis submission wall-clock time
   * @return 16-character lowercase hex identifier
   */
  public static String newId(String fileRef, String submitter, long epochMillis) {
    Objects.requireNonNull(fileRef, "fileRef");
    Objects.requireNonNull(submitter, "submitter");
    String material =
        fileRef
            + '_'
            + submitter
            + '_'
            + epochMillis
            + '_'
            + System.nanoTime()
            + '_'
            + SEQUENCE.incrementAndGet()
            + '_'
            + ThreadLocalRandom.current().nextLong();
    byte[] digest = sha256().digest(material.getBytes(StandardCharsets.UTF_8));
    return HEX.formatHex(digest).substring(0, ID_HEX_LENGTH);
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 not available in this JVM", ex);
    }
  }
}
