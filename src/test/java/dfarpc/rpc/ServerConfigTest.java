package dfarpc.rpc;

import com.beust.jcommander.JCommander;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Properties;

public class ServerConfigTest {

  @Test
  void defaults() {
    Assertions.assertEquals("127.0.0.1", ServerConfig.DEFAULT.host());
    Assertions.assertEquals(3030, ServerConfig.DEFAULT.port());
    Assertions.assertEquals(3, ServerConfig.DEFAULT.threads());
  }

  @Test
  void missingKeysFallBackToDefaults() {
    final var properties = new Properties();
    properties.setProperty(ServerConfig.PORT_KEY, " 8080 ");
    Assertions.assertEquals(new ServerConfig("127.0.0.1", 8080, 3), ServerConfig.fromProperties(properties));
    Assertions.assertEquals(ServerConfig.DEFAULT, ServerConfig.fromProperties(new Properties()));
  }

  @Test
  void invalidSettings() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new ServerConfig("localhost", 70000, 3));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new ServerConfig("localhost", -1, 3));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new ServerConfig("localhost", 3030, 0));
    Assertions.assertThrows(IllegalArgumentException.class, () -> new ServerConfig(" ", 3030, 3));

    final var properties = new Properties();
    properties.setProperty(ServerConfig.THREADS_KEY, "many");
    Assertions.assertThrows(IllegalArgumentException.class, () -> ServerConfig.fromProperties(properties));
  }

  @Test
  void overrides() {
    Assertions.assertEquals(
      new ServerConfig("0.0.0.0", 3030, 8),
      ServerConfig.DEFAULT.withOverrides("0.0.0.0", null, 8)
    );
    Assertions.assertEquals(ServerConfig.DEFAULT, ServerConfig.DEFAULT.withOverrides(null, null, null));
  }

  @Test
  void bundledResource() throws Exception {
    Assertions.assertEquals(ServerConfig.DEFAULT, ServerConfig.fromResource("/server.properties"));
    Assertions.assertEquals(ServerConfig.DEFAULT, ServerConfig.fromResource("/no-such-file.properties"));
  }

  @Test
  void commandLineFlagsOverrideResource() throws Exception {
    final var main = new ServerMain();
    JCommander.newBuilder().addObject(main).build().parse("-port", "4040", "-threads", "5");
    Assertions.assertEquals(new ServerConfig("127.0.0.1", 4040, 5), main.config());
  }
}
