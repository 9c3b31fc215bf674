package ca.gc.cra.prism.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Helpers that keep job failure detail and file references bounded in logs and
 * stored records.
 * <p><strong>Why:</strong> Detector exceptions can carry arbitrarily long messages; records are retained
 * for a day and logs are shipped off-host.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @implNote Decoding uses {@link CodingErrorAction#IGNORE} so a cut in the middle of a code point drops
 *     the partial character instead of failing.
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested UTF-8 byte length, appending the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxBytes maximum number of bytes to retain; must be positive
   * @return truncated string when the input exceeds {@code maxBytes}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer buffer = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return buffer + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
    } catch (CharacterCodingException ex) {
      String prefix = new String(bytes, 0, maxBytes, StandardCharsets.UTF_8);
      return prefix + "... (truncated)";
    }
  }

  /**
   * Renders a throwable as {@code SimpleName: message}, bounded to {@code maxBytes}.
   *
   * @param error failure to describe; {@code null} yields {@code "<null>"}
   * @param maxBytes maximum UTF-8 length of the result
   * @return bounded description
   */
  public static String describe(Throwable error, int maxBytes) {
    if (error == null) {
      return NULL_PLACEHOLDER;
    }
    String message = error.getMessage();
    String text = error.getClass().getSimpleName()
        + (message == null || message.isBlank() ? "" : ": " + message);
    return truncate(text, maxBytes);
  }
}
