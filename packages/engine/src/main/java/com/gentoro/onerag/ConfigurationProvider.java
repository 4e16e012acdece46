package com.gentoro.onerag;

import com.gentoro.onerag.exception.ConfigException;
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
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.interpol.Lookup;

/**
 * Reads the OneRag YAML configuration into an Apache Commons {@link Configuration}.
 *
 * <p>Accepted locations: {@code classpath:application.yaml}, {@code file:/etc/onerag.yaml} or a
 * plain filesystem path. A blank location means {@code classpath:application.yaml}. A missing
 * classpath resource yields an empty configuration, so every setting falls back to its default; a
 * missing file is an error.
 *
 * <p>{@code ${env:NAME}} resolves from the process environment first, then from a {@code
 * .env.local} file in the working directory or in {@code packages/engine}.
 */
public final class ConfigurationProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.onerag.logging.LoggingService.getLogger(ConfigurationProvider.class);

  static final String DEFAULT_LOCATION = "classpath:application.yaml";
  private static final List<Path> ENV_FILES =
      List.of(Path.of(".env.local"), Path.of("packages", "engine", ".env.local"));

  private final Configuration configuration;

  public ConfigurationProvider(String location) {
    String loc = location == null || location.isBlank() ? DEFAULT_LOCATION : location.trim();
    YAMLConfiguration yaml = new YAMLConfiguration();
    yaml.getInterpolator().registerLookup("env", new EnvLookup(ENV_FILES));
    if (loc.startsWith("classpath:")) {
      readClasspath(yaml, stripLeadingSlash(loc.substring("classpath:".length())));
    } else if (loc.regionMatches(true, 0, "file:", 0, 5)) {
      readFile(yaml, toPath(loc));
    } else {
      readFile(yaml, Path.of(loc));
    }
    this.configuration = yaml;
  }

  public Configuration config() {
    return configuration;
  }

  private static void readClasspath(YAMLConfiguration target, String resource) {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) {
        log.warn("Configuration resource {} not found on classpath; using defaults", resource);
        return;
      }
      log.info("Loading configuration from classpath resource: {}", resource);
      read(target, new InputStreamReader(in, StandardCharsets.UTF_8), resource);
    } catch (IOException e) {
      throw new ConfigException("Failed to read classpath resource " + resource, e);
    }
  }

  private static void readFile(YAMLConfiguration target, Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ConfigException("Configuration file does not exist: " + file.toAbsolutePath());
    }
    log.info("Loading configuration from file: {}", file.toAbsolutePath());
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      read(target, reader, file.toString());
    } catch (IOException e) {
      throw new ConfigException("Failed to read configuration file " + file, e);
    }
  }

  private static void read(YAMLConfiguration target, Reader reader, String source) {
    try {
      target.read(reader);
    } catch (ConfigurationException e) {
      throw new ConfigException("Invalid YAML in " + source, e);
    }
  }

  private static Path toPath(String fileUri) {
    try {
      return Path.of(URI.create(fileUri));
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Invalid configuration URI: " + fileUri, e);
    }
  }

  private static String stripLeadingSlash(String resource) {
    return resource.startsWith("/") ? resource.substring(1) : resource;
  }

  /** Environment lookup that falls back to the first {@code .env.local} file found. */
  private static final class EnvLookup implements Lookup {
    private final List<Path> candidates;
    private volatile Map<String, String> fileValues;

    EnvLookup(List<Path> candidates) {
      this.candidates = candidates;
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
          if (fileValues == null) {
            fileValues = loadFirstEnvFile();
          }
          values = fileValues;
        }
      }
      return values;
    }

    private Map<String, String> loadFirstEnvFile() {
      for (Path candidate : candidates) {
        if (!Files.isRegularFile(candidate)) continue;
        log.info("Reading environment fallback from {}", candidate.toAbsolutePath());
        try {
          return parseEnvLines(Files.readAllLines(candidate, StandardCharsets.UTF_8));
        } catch (IOException e) {
          log.warn("Failed to read {}; ignoring environment fallback", candidate, e);
          return Map.of();
        }
      }
      log.debug("No .env.local found; environment fallback is empty");
      return Map.of();
    }
  }

  /** {@code KEY=value} lines; blank lines and {@code #} comments are skipped, quotes removed. */
  static Map<String, String> parseEnvLines(List<String> lines) {
    Map<String, String> out = new HashMap<>();
    for (String raw : lines) {
      String line = raw.trim();
      int eq = line.indexOf('=');
      if (line.isEmpty() || line.startsWith("#") || eq <= 0) continue;
      String value = line.substring(eq + 1).trim();
      if (value.length() >= 2) {
        char first = value.charAt(0);
        if ((first == '"' || first == '\'') && value.charAt(value.length() - 1) == first) {
          value = value.substring(1, value.length() - 1);
        }
      }
      out.put(line.substring(0, eq).trim(), value);
    }
    return out;
  }
}
