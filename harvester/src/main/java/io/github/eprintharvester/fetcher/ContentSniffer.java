package io.github.eprintharvester.fetcher;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Best-effort check that a 200 response really carries an archive. Servers without a useful
 * Content-Type are given the benefit of the doubt unless the first chunk reads as an HTML page.
 */
@Singleton
public class ContentSniffer {

  /**
   * Size of the chunk peeked when the Content-Type is inconclusive.
   */
  public static final int PEEK_BYTES = 1024;

  /**
   * Marker of a disguised error page.
   */
  public static final String HTML_MARKER = "<html";

  /**
   * Content-Type fragments accepted as archive payloads.
   */
  public static final List<String> ARCHIVE_TYPES = List.of("gzip", "tar", "octet-stream");

  /**
   * Classification of a peeked chunk.
   */
  public enum Verdict {
    /**
     * Nothing to read.
     */
    EMPTY,

    /**
     * Text containing the HTML marker.
     */
    MARKUP,

    /**
     * Anything else.
     */
    BINARY
  }

  private final int peekBytes;
  private final String htmlMarker;

  /**
   * Instantiates a new Content sniffer with the default thresholds.
   */
  @Inject
  public ContentSniffer() {
    this(PEEK_BYTES, HTML_MARKER);
  }

  /**
   * Instantiates a new Content sniffer.
   *
   * @param peekBytes the peek size
   * @param htmlMarker the html marker
   */
  public ContentSniffer(final int peekBytes, final String htmlMarker) {
    if (peekBytes < 1) {
      throw new IllegalArgumentException("peekBytes must be positive");
    }
    this.peekBytes = peekBytes;
    this.htmlMarker = htmlMarker.toLowerCase(Locale.ROOT);
  }

  /**
   * Peek bytes.
   *
   * @return the int
   */
  public int peekBytes() {
    return peekBytes;
  }

  /**
   * True when the Content-Type names a gzip, tar or generic binary payload.
   *
   * @param contentType the header value, may be null
   * @return the boolean
   */
  public boolean looksLikeArchive(final String contentType) {
    if (contentType == null) {
      return false;
    }
    final String lower = contentType.toLowerCase(Locale.ROOT);
    return ARCHIVE_TYPES.stream().anyMatch(lower::contains);
  }

  /**
   * Classify the first chunk of a body. Bytes that are not valid UTF-8 are binary.
   *
   * @param chunk the chunk
   * @return the verdict
   */
  public Verdict classify(final byte[] chunk) {
    if (chunk.length == 0) {
      return Verdict.EMPTY;
    }
    try {
      final String text = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(chunk))
          .toString();
      return text.toLowerCase(Locale.ROOT).contains(htmlMarker) ? Verdict.MARKUP : Verdict.BINARY;
    } catch (CharacterCodingException e) {
      return Verdict.BINARY;
    }
  }
}
