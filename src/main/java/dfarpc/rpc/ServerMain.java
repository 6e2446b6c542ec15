package dfarpc.rpc;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts a server exposing {@code check} and {@code minimize} over HTTP,
 * following the JSON-RPC 2.0 specification.
 *
 * Defaults come from {@code server.properties} on the classpath and can be
 * overridden from the command line.
 */
public class ServerMain {

  private static final Logger LOG = LoggerFactory.getLogger(ServerMain.class);

  @Parameter(names = "-host", description = "Interface to bind to")
  private String host;

  @Parameter(names = "-port", description = "TCP port to listen on (0 for any free port)")
  private Integer port;

  @Parameter(names = "-threads", description = "Number of worker threads")
  private Integer threads;

  @Parameter(names = "--help", help = true, description = "Displays help")
  private boolean help;

  public static void main(String... args) throws IOException {
    final var main = new ServerMain();
    final var jCommander = JCommander.newBuilder().addObject(main).programName("dfa-rpc").build();
    try {
      jCommander.parse(args);
    } catch (ParameterException err) {
      LOG.error("{}", err.getMessage());
      jCommander.usage();
      System.exit(2);
      return;
    }

    if (main.help) {
      jCommander.usage();
    } else {
      main.run();
    }
  }

  /**
   * Resolve the configuration from defaults and command line flags.
   */
  ServerConfig config() throws IOException {
    return ServerConfig
      .fromResource("/server.properties")
      .withOverrides(host, port, threads);
  }

  private void run() throws IOException {
    final ServerConfig config = config();
    LOG.info("Starting with {}", config);

    final var handler = new JsonRpcHandler(new DfaRpcService(), new ObjectMapper());
    final var server = new JsonRpcHttpServer(config.address(), config.threads(), handler);
    Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "jsonrpc-shutdown"));
    server.start();
  }
}
