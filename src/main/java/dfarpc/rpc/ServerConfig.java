package dfarpc.rpc;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.util.Properties;

/**
 * Where and how the JSON-RPC server runs.
 *
 * @param host interface to bind to
 * @param port TCP port ({@code 0} for any free port)
 * @param threads size of the worker pool
 */
public record ServerConfig(String host, int port, int threads) {

  public static final String HOST_KEY = "server.host";
  public static final String PORT_KEY = "server.port";
  public static final String THREADS_KEY = "server.threads";

  public static final ServerConfig DEFAULT = new ServerConfig("127.0.0.1", 3030, 3);

  public ServerConfig {
    if (host == null || host.isBlank()) {
      throw new IllegalArgumentException("Host must not be blank");
    }
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("Port out of range: " + port);
    }
    if (threads < 1) {
      throw new IllegalArgumentException("Need at least one worker thread, got " + threads);
    }
  }

  /**
   * Read a configuration from properties, falling back to {@link #DEFAULT}
   * for missing keys.
   *
   * @param properties properties holding some of the {@code server.*} keys
   * @return configuration
   */
  public static ServerConfig fromProperties(Properties properties) {
    return new ServerConfig(
      properties.getProperty(HOST_KEY, DEFAULT.host).trim(),
      intProperty(properties, PORT_KEY, DEFAULT.port),
      intProperty(properties, THREADS_KEY, DEFAULT.threads)
    );
  }

  /**
   * Read the configuration bundled on the classpath.
   *
   * @param resource classpath resource name, such as {@code /server.properties}
   * @return configuration, or {@link #DEFAULT} if the resource does not exist
   * @throws IOException if the resource exists but cannot be read
   */
  public static ServerConfig fromResource(String resource) throws IOException {
    final var properties = new Properties();
    try (InputStream input = ServerConfig.class.getResourceAsStream(resource)) {
      if (input == null) {
        return DEFAULT;
      }
      properties.load(input);
    }
    return fromProperties(properties);
  }

  /**
   * Replace the settings which are given (non-{@code null}).
   */
  public ServerConfig withOverrides(String host, Integer port, Integer threads) {
    return new ServerConfig(
      host != null ? host : this.host,
      port != null ? port : this.port,
      threads != null ? threads : this.threads
    );
  }

  public InetSocketAddress address() {
    return new InetSocketAddress(host, port);
  }

  private static int intProperty(Properties properties, String key, int fallback) {
    final String value = properties.getProperty(key);
    if (value == null) {
      return fallback;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException err) {
      throw new IllegalArgumentException("Property " + key + " is not an integer: " + value, err);
    }
  }
}
