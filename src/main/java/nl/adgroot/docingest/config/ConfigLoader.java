package nl.adgroot.docingest.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

public final class ConfigLoader {

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private ConfigLoader() {
    // utility class
  }

  public static AppConfig load(Path configPath) {
    try (InputStream in = Files.newInputStream(configPath)) {
      return load(in);
    } catch (IOException e) {
      throw new IllegalArgumentException("Could not read config " + configPath + ": " + e.getMessage(), e);
    }
  }

  public static AppConfig load(InputStream in) throws IOException {
    AppConfig cfg = MAPPER.readValue(in, AppConfig.class);
    return cfg == null ? new AppConfig() : cfg;
  }

  /** Loads {@code resource} from the classpath, or returns defaults when it is absent. */
  public static AppConfig loadFromClasspath(String resource) {
    try (InputStream in = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        return new AppConfig();
      }
      return load(in);
    } catch (IOException e) {
      throw new IllegalArgumentException("Could not read config resource " + resource + ": " + e.getMessage(), e);
    }
  }
}
