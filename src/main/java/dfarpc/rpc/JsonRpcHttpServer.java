package dfarpc.rpc;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves a {@link JsonRpcHandler} over HTTP.
 *
 * Every path accepts {@code POST} requests with a JSON body. Requests are
 * handled on a fixed pool of worker threads.
 */
public final class JsonRpcHttpServer implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(JsonRpcHttpServer.class);

  private static final String JSON = "application/json";

  /**
   * Seconds to wait for in-flight exchanges on shutdown.
   */
  private static final int STOP_GRACE_SECONDS = 2;

  private final HttpServer server;
  private final ExecutorService workers;
  private final JsonRpcHandler handler;

  /**
   * Bind the server (but do not start accepting requests yet).
   *
   * @param address address to listen on (port {@code 0} picks any free port)
   * @param threads number of worker threads
   * @param handler JSON-RPC request handler
   * @throws IOException if the address cannot be bound
   */
  public JsonRpcHttpServer(InetSocketAddress address, int threads, JsonRpcHandler handler) throws IOException {
    if (threads < 1) {
      throw new IllegalArgumentException("Need at least one worker thread, got " + threads);
    }
    this.handler = handler;
    this.server = HttpServer.create(address, 0);
    this.workers = Executors.newFixedThreadPool(threads, new WorkerThreadFactory());
    server.setExecutor(workers);
    server.createContext("/", this::exchange);
  }

  public void start() {
    server.start();
    LOG.info("JSON-RPC server listening on {}", address());
  }

  /**
   * Address the server is actually bound to.
   */
  public InetSocketAddress address() {
    return server.getAddress();
  }

  /**
   * Stop accepting requests, wait briefly for in-flight ones, then release
   * the worker threads.
   */
  public void stop() {
    server.stop(STOP_GRACE_SECONDS);
    workers.shutdown();
    try {
      if (!workers.awaitTermination(STOP_GRACE_SECONDS, TimeUnit.SECONDS)) {
        workers.shutdownNow();
      }
    } catch (InterruptedException err) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
    LOG.info("JSON-RPC server stopped");
  }

  @Override
  public void close() {
    stop();
  }

  private void exchange(HttpExchange exchange) throws IOException {
    try {
      if (!"POST".equals(exchange.getRequestMethod())) {
        exchange.getResponseHeaders().set("Allow", "POST");
        exchange.sendResponseHeaders(405, -1);
        return;
      }

      final String contentType = exchange.getRequestHeaders().getFirst("Content-Type");
      if (contentType == null || !contentType.toLowerCase(Locale.ROOT).startsWith(JSON)) {
        exchange.sendResponseHeaders(415, -1);
        return;
      }

      final String body;
      try (InputStream input = exchange.getRequestBody()) {
        body = new String(input.readAllBytes(), StandardCharsets.UTF_8);
      }

      final Optional<String> response = handler.handle(body);
      if (response.isEmpty()) {
        exchange.sendResponseHeaders(204, -1);
        return;
      }

      final byte[] bytes = response.get().getBytes(StandardCharsets.UTF_8);
      exchange.getResponseHeaders().set("Content-Type", JSON + "; charset=utf-8");
      exchange.sendResponseHeaders(200, bytes.length);
      try (OutputStream output = exchange.getResponseBody()) {
        output.write(bytes);
      }
    } catch (IOException err) {
      LOG.warn("I/O failure talking to {}", exchange.getRemoteAddress(), err);
      throw err;
    } finally {
      exchange.close();
    }
  }

  /**
   * Names worker threads so they are recognizable in logs.
   */
  private static final class WorkerThreadFactory implements ThreadFactory {
    private final AtomicInteger count = new AtomicInteger();

    @Override
    public Thread newThread(Runnable runnable) {
      return new Thread(runnable, "jsonrpc-worker-" + count.incrementAndGet());
    }
  }
}
