package io.github.eprintharvester.fetcher;

import io.github.eprintharvester.exception.ArtifactStorageException;
import io.github.eprintharvester.exception.HarvestInterruptedException;
import io.github.eprintharvester.helper.Sleeper;
import io.github.eprintharvester.http.factory.HttpClientFactory;
import io.github.eprintharvester.model.Configuration;
import io.github.eprintharvester.model.DownloadOutcome;
import io.github.eprintharvester.model.DownloadTarget;
import io.github.eprintharvester.model.ErrorCodes;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.net.URIBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ArtifactFetcher} that GETs {@code {artifactBase}/{identifier}} with bounded retries.
 *
 * <p>Per call: skip when the target already holds data, otherwise up to
 * {@link RetryPolicy#MAX_ATTEMPTS} attempts. Transient statuses and network failures back off and
 * retry; other statuses, empty bodies and HTML error pages end the call at once. A partially
 * written file is left in place.
 */
@Singleton
public class HttpArtifactFetcher implements ArtifactFetcher {

  private static final Logger log = LoggerFactory.getLogger(HttpArtifactFetcher.class);

  private static final int COPY_BUFFER_BYTES = 1024 * 1024;

  private final CloseableHttpClient httpClient;
  private final HttpClientFactory httpClientFactory;
  private final RetryPolicy retryPolicy;
  private final BackoffPolicy backoffPolicy;
  private final ContentSniffer contentSniffer;
  private final Sleeper sleeper;
  private final URI artifactBase;

  /**
   * Instantiates a new Http artifact fetcher.
   *
   * @param httpClient the http client
   * @param httpClientFactory the http client factory
   * @param retryPolicy the retry policy
   * @param backoffPolicy the backoff policy
   * @param contentSniffer the content sniffer
   * @param sleeper the sleeper
   * @param configuration the configuration
   */
  @Inject
  public HttpArtifactFetcher(final CloseableHttpClient httpClient,
                             final HttpClientFactory httpClientFactory,
                             final RetryPolicy retryPolicy,
                             final BackoffPolicy backoffPolicy,
                             final ContentSniffer contentSniffer,
                             final Sleeper sleeper,
                             final Configuration configuration) {
    this.httpClient = httpClient;
    this.httpClientFactory = httpClientFactory;
    this.retryPolicy = retryPolicy;
    this.backoffPolicy = backoffPolicy;
    this.contentSniffer = contentSniffer;
    this.sleeper = sleeper;
    this.artifactBase = configuration.artifactBase();
  }

  @Override
  public DownloadOutcome fetch(final String identifier, final Path destinationDir) {
    final DownloadTarget target = DownloadTarget.of(identifier, destinationDir);
    try {
      Files.createDirectories(destinationDir);
      if (target.isSatisfied()) {
        log.debug("Skipping {}, {} already present", identifier, target.path());
        return DownloadOutcome.skip();
      }
    } catch (IOException | RuntimeException e) {
      log.warn("Unable to prepare {} for {}: {}", target.path(), identifier, e.toString());
      return DownloadOutcome.error(ErrorCodes.EXCEPTION);
    }

    Integer lastStatus = null;
    for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
      // Set as soon as the status line arrives, before the body is read.
      final AtomicReference<Integer> observed = new AtomicReference<>();
      try {
        final HttpGet get = new HttpGet(artifactUri(identifier));
        get.setConfig(httpClientFactory.artifactRequestConfig());
        final Attempt result = httpClient.execute(get, response -> {
          observed.set(response.getCode());
          return handle(response, target);
        });
        lastStatus = result.status;
        if (result.outcome != null) {
          log.debug("{} -> {}", identifier, result.outcome.describe());
          return result.outcome;
        }
        log.info("{} answered HTTP {} (attempt {}/{}), backing off",
            identifier, result.status, attempt, retryPolicy.maxAttempts());
      } catch (ArtifactStorageException e) {
        log.warn("Unable to store {}: {}", identifier, e.getMessage());
        return DownloadOutcome.error(ErrorCodes.EXCEPTION);
      } catch (IOException e) {
        if (observed.get() != null) {
          lastStatus = observed.get();
        }
        log.info("{} transport failure (attempt {}/{}): {}",
            identifier, attempt, retryPolicy.maxAttempts(), e.toString());
      } catch (RuntimeException e) {
        log.warn("Unexpected failure fetching {}", identifier, e);
        return DownloadOutcome.error(ErrorCodes.EXCEPTION);
      }
      backOff(attempt);
    }

    final DownloadOutcome exhausted = lastStatus != null
        ? DownloadOutcome.error(lastStatus)
        : DownloadOutcome.error(ErrorCodes.TIMEOUT);
    log.warn("Giving up on {} after {} attempts: {}",
        identifier, retryPolicy.maxAttempts(), exhausted.describe());
    return exhausted;
  }

  /**
   * Artifact URI for an identifier. Old-style identifiers keep their slash as a path separator;
   * every segment is percent-encoded.
   *
   * @param identifier the identifier
   * @return the uri
   */
  URI artifactUri(final String identifier) {
    final URIBuilder builder = new URIBuilder(artifactBase);
    final List<String> segments = new ArrayList<>();
    for (final String segment : builder.getPathSegments()) {
      if (!segment.isEmpty()) {
        segments.add(segment);
      }
    }
    segments.addAll(Arrays.asList(identifier.split("/")));
    try {
      return builder.setPathSegments(segments).build();
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid artifact identifier " + identifier, e);
    }
  }

  private Attempt handle(final ClassicHttpResponse response, final DownloadTarget target)
      throws IOException {
    final int status = response.getCode();
    switch (retryPolicy.decide(status)) {
      case RETRY:
        return Attempt.retry(status);
      case FAIL:
        return Attempt.done(status, DownloadOutcome.error(status));
      default:
        break;
    }

    final HttpEntity entity = response.getEntity();
    final InputStream body = entity == null ? InputStream.nullInputStream() : entity.getContent();
    final Header contentType = response.getFirstHeader(HttpHeaders.CONTENT_TYPE);

    if (contentSniffer.looksLikeArchive(contentType == null ? null : contentType.getValue())) {
      write(new byte[0], body, target.path());
      return Attempt.done(status, DownloadOutcome.ok());
    }

    final byte[] first = body.readNBytes(contentSniffer.peekBytes());
    switch (contentSniffer.classify(first)) {
      case EMPTY:
        return Attempt.done(status, DownloadOutcome.error(ErrorCodes.EMPTY));
      case MARKUP:
        log.debug("{} returned an HTML page instead of an archive", target.identifier());
        return Attempt.done(status, DownloadOutcome.error(ErrorCodes.CONTENT_TYPE_MISMATCH));
      default:
        write(first, body, target.path());
        return Attempt.done(status, DownloadOutcome.ok());
    }
  }

  /**
   * Write the peeked prefix and the rest of the body. Read failures propagate as
   * {@link IOException} (transient); write failures as {@link ArtifactStorageException}.
   */
  private void write(final byte[] prefix, final InputStream body, final Path path)
      throws IOException {
    try (ArtifactSink sink = new ArtifactSink(path)) {
      sink.write(prefix, prefix.length);
      final byte[] buffer = new byte[COPY_BUFFER_BYTES];
      int read;
      while ((read = body.read(buffer)) != -1) {
        sink.write(buffer, read);
      }
    }
  }

  private void backOff(final int attempt) {
    final Duration delay = backoffPolicy.delay(attempt);
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new HarvestInterruptedException(e);
    }
  }

  /**
   * Result of one transport attempt. A null outcome means retry.
   */
  private static final class Attempt {

    private final int status;
    private final DownloadOutcome outcome;

    private Attempt(final int status, final DownloadOutcome outcome) {
      this.status = status;
      this.outcome = outcome;
    }

    static Attempt retry(final int status) {
      return new Attempt(status, null);
    }

    static Attempt done(final int status, final DownloadOutcome outcome) {
      return new Attempt(status, outcome);
    }
  }

  /**
   * Output file whose failures are reported as {@link ArtifactStorageException}.
   */
  private static final class ArtifactSink implements Closeable {

    private final Path path;
    private final OutputStream out;

    ArtifactSink(final Path path) {
      this.path = path;
      try {
        this.out = Files.newOutputStream(path);
      } catch (IOException e) {
        throw new ArtifactStorageException("Unable to open " + path, e);
      }
    }

    void write(final byte[] bytes, final int length) {
      if (length == 0) {
        return;
      }
      try {
        out.write(bytes, 0, length);
      } catch (IOException e) {
        throw new ArtifactStorageException("Unable to write " + path, e);
      }
    }

    @Override
    public void close() {
      try {
        out.close();
      } catch (IOException e) {
        throw new ArtifactStorageException("Unable to close " + path, e);
      }
    }
  }
}
