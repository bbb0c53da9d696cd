package ca.gc.cra.logmerge.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Helpers that keep record contents short in log messages.
 *
 * <p>Records can be up to the configured maximum record length, so anything quoted in a log line
 * goes through {@link #preview(byte[])} or {@link #truncate(String, int)} first.</p>
 *
 * @implNote Decoding ignores malformed input so a cut in the middle of a code point never throws.
 * @since 0.1.0
 */
public final class Logs {
  /** Byte budget used by {@link #preview(byte[])}. */
  public static final int PREVIEW_BYTES = 120;

  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to {@code maxBytes} UTF-8 bytes, appending the original length.
   *
   * @param value string to truncate; {@code null} yields {@code "<null>"}
   * @param maxBytes bytes to keep; must be positive
   * @return the value itself when short enough, otherwise a truncated copy with a length suffix
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    return truncate(value.getBytes(StandardCharsets.UTF_8), maxBytes, value);
  }

  /**
   * Renders the start of a raw record for log messages.
   *
   * @param record raw record bytes; {@code null} yields {@code "<null>"}
   * @return UTF-8 rendering of at most {@link #PREVIEW_BYTES} bytes
   */
  public static String preview(byte[] record) {
    if (record == null) {
      return NULL_PLACEHOLDER;
    }
    return truncate(record, PREVIEW_BYTES, null);
  }

  private static String truncate(byte[] bytes, int maxBytes, String original) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (bytes.length <= maxBytes) {
      return original != null ? original : new String(bytes, StandardCharsets.UTF_8);
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    try {
      CharBuffer head = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return head + "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
    } catch (CharacterCodingException ex) {
      return new String(bytes, 0, maxBytes, StandardCharsets.UTF_8) + "... (truncated)";
    }
  }
}
