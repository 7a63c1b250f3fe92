package com.gentoro.ragmcp;

import com.gentoro.ragmcp.exception.ConfigException;
import com.gentoro.ragmcp.exception.IoException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Loads the server's YAML configuration into an Apache Commons {@link Configuration}.
 *
 * <p>Accepted locations: {@code classpath:application.yaml}, {@code file:/etc/rag.yaml} URIs and
 * plain filesystem paths. Values of the form {@code ${env:NAME:-default}} are resolved from the
 * process environment first and from a {@code .env.local} file in the working directory second.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.ragmcp.logging.LoggingService.getLogger(ConfigurationProvider.class);

  static final String CLASSPATH_PREFIX = "classpath:";
  static final String ENV_FILE = ".env.local";

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    String loc = location == null || location.isBlank() ? "classpath:application.yaml" : location;
    YAMLConfiguration yaml = load(loc.trim());
    yaml.getInterpolator().registerLookup("env", new EnvLookup(Path.of(ENV_FILE)));
    this.configuration = yaml;
  }

  public Configuration config() {
    return configuration;
  }

  private static YAMLConfiguration load(String location) {
    if (location.startsWith(CLASSPATH_PREFIX)) {
      return fromClasspath(location.substring(CLASSPATH_PREFIX.length()));
    }
    return fromFile(toPath(location));
  }

  private static Path toPath(String location) {
    if (location.regionMatches(true, 0, "file:", 0, 5)) {
      try {
        return Path.of(URI.create(location));
      } catch (IllegalArgumentException e) {
        throw new ConfigException("Malformed configuration URI: " + location, e);
      }
    }
    return Path.of(location);
  }

  private static YAMLConfiguration fromClasspath(String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) {
        log.warn("Configuration resource {} not found on classpath, using defaults", resource);
        return new YAMLConfiguration();
      }
      log.info("Loading configuration from classpath:{}", resource);
      YAMLConfiguration yaml = new YAMLConfiguration();
      try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
        yaml.read(reader);
      }
      return yaml;
    } catch (IOException e) {
      throw new IoException("Failed to read classpath configuration " + resource, e);
    } catch (ConfigurationException e) {
      throw new ConfigException("Invalid YAML in classpath configuration " + resource, e);
    }
  }

  private static YAMLConfiguration fromFile(Path path) {
    if (!Files.isRegularFile(path)) {
      throw new ConfigException("Configuration file does not exist: " + path.toAbsolutePath());
    }
    log.info("Loading configuration from {}", path.toAbsolutePath());
    try {
      return new FileBasedConfigurationBuilder<>(YAMLConfiguration.class)
          .configure(new Parameters().fileBased().setFile(path.toFile()))
          .getConfiguration();
    } catch (ConfigurationException e) {
      throw new ConfigException("Failed to load configuration " + path.toAbsolutePath(), e);
    }
  }

  /** Environment lookup with a lazily read key/value file as fallback. */
  static final class EnvLookup implements Lookup {
    private final Path envFile;
    private volatile Map<String, String> fileValues;

    EnvLookup(Path envFile) {
      this.envFile = envFile;
    }

    @Override
    public Object lookup(String key) {
      String value = System.getenv(key);
      if (value != null && !value.isEmpty()) {
        return value;
      }
      return fileValues().get(key);
    }

    private Map<String, String> fileValues() {
      Map<String, String> values = fileValues;
      if (values == null) {
        synchronized (this) {
          values = fileValues;
          if (values == null) {
            values = readEnvFile(envFile);
            fileValues = values;
          }
        }
      }
      return values;
    }

    static Map<String, String> readEnvFile(Path file) {
      Map<String, String> values = new HashMap<>();
      if (!Files.isRegularFile(file)) {
        log.debug("No {} found in {}", file.getFileName(), file.toAbsolutePath().getParent());
        return values;
      }
      List<String> lines;
      try {
        lines = Files.readAllLines(file, StandardCharsets.UTF_8);
      } catch (IOException e) {
        log.warn("Could not read {}, ignoring it", file.toAbsolutePath(), e);
        return values;
      }
      for (String raw : lines) {
        String line = raw.trim();
        int eq = line.indexOf('=');
        if (line.startsWith("#") || eq <= 0) continue;
        values.put(line.substring(0, eq).trim(), unquote(line.substring(eq + 1).trim()));
      }
      log.info("Read {} value(s) from {}", values.size(), file.toAbsolutePath());
      return values;
    }

    private static String unquote(String value) {
      if (value.length() >= 2) {
        char first = value.charAt(0);
        if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
          return value.substring(1, value.length() - 1);
        }
      }
      return value;
    }
  }
}
