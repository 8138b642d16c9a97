package io.github.eprintharvester.testing;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpStatus;
import org.apache.hc.core5.http.impl.bootstrap.HttpServer;
import org.apache.hc.core5.http.impl.bootstrap.ServerBootstrap;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.io.CloseMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process HTTP server answering from a queue of canned responses. When the queue is empty it
 * answers 404. Every request URI is recorded.
 */
public class StubHttpServer implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(StubHttpServer.class);

  private final Deque<StubResponse> responses = new ArrayDeque<>();
  private final List<String> requestUris = Collections.synchronizedList(new ArrayList<>());
  private final List<String> userAgents = Collections.synchronizedList(new ArrayList<>());
  private HttpServer server;
  private int port;

  /**
   * Start on a free port.
   *
   * @return this server
   * @throws IOException if the server cannot be started
   */
  public StubHttpServer start() throws IOException {
    port = findAvailablePort();
    server = ServerBootstrap.bootstrap()
        .setListenerPort(port)
        .register("*", (request, response, context) -> {
          requestUris.add(request.getRequestUri());
          if (request.getFirstHeader("User-Agent") != null) {
            userAgents.add(request.getFirstHeader("User-Agent").getValue());
          }
          final StubResponse next;
          synchronized (responses) {
            next = responses.poll();
          }
          if (next == null) {
            response.setCode(HttpStatus.SC_NOT_FOUND);
            return;
          }
          response.setCode(next.status);
          response.setEntity(new ByteArrayEntity(next.body, next.contentType));
        })
        .create();
    server.start();
    log.debug("Stub server started on port {}", port);
    return this;
  }

  /**
   * Queue a response.
   *
   * @param status the status
   * @param contentType the content type, null for none
   * @param body the body
   * @return this server
   */
  public StubHttpServer enqueue(final int status, final ContentType contentType,
                                final byte[] body) {
    synchronized (responses) {
      responses.add(new StubResponse(status, contentType, body));
    }
    return this;
  }

  /**
   * Queue a text response.
   *
   * @param status the status
   * @param contentType the content type, null for none
   * @param body the body
   * @return this server
   */
  public StubHttpServer enqueue(final int status, final ContentType contentType,
                                final String body) {
    return enqueue(status, contentType, body.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Queue a bodiless status response.
   *
   * @param status the status
   * @return this server
   */
  public StubHttpServer enqueue(final int status) {
    return enqueue(status, ContentType.TEXT_PLAIN, new byte[0]);
  }

  /**
   * Base uri without trailing slash.
   *
   * @return the uri
   */
  public URI baseUri() {
    return URI.create("http://127.0.0.1:" + port);
  }

  /**
   * Recorded request URIs (path and query).
   *
   * @return the list
   */
  public List<String> requestUris() {
    return List.copyOf(requestUris);
  }

  /**
   * Recorded User-Agent headers.
   *
   * @return the list
   */
  public List<String> userAgents() {
    return List.copyOf(userAgents);
  }

  /**
   * Number of requests served.
   *
   * @return the int
   */
  public int requestCount() {
    return requestUris.size();
  }

  @Override
  public void close() {
    if (server != null) {
      server.close(CloseMode.IMMEDIATE);
    }
  }

  /**
   * A port nothing listens on, for connection failures.
   *
   * @return the port
   * @throws IOException if no port can be allocated
   */
  public static int findAvailablePort() throws IOException {
    try (ServerSocket socket = new ServerSocket(0)) {
      socket.setReuseAddress(true);
      return socket.getLocalPort();
    }
  }

  private static final class StubResponse {

    private final int status;
    private final ContentType contentType;
    private final byte[] body;

    private StubResponse(final int status, final ContentType contentType, final byte[] body) {
      this.status = status;
      this.contentType = contentType;
      this.body = body;
    }
  }
}
