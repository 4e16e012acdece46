package com.gentoro.onerag.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logger lookup plus runtime level overrides. Levels come from the {@code logging.level} block,
 * where the key {@code root} addresses the root logger:
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com.gentoro.onerag.ingestion: DEBUG
 * </pre>
 */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /** No-op unless Logback is the bound SLF4J backend. */
  public static void applyConfiguration(Configuration cfg) {
    if (cfg == null) {
      return;
    }
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      log.debug("SLF4J is not bound to Logback, level overrides ignored");
      return;
    }
    Configuration levels = cfg.subset("logging.level");
    levels
        .getKeys()
        .forEachRemaining(
            name -> {
              String value = levels.getString(name, "");
              if (value.isBlank()) return;
              String loggerName =
                  "root".equalsIgnoreCase(name) ? Logger.ROOT_LOGGER_NAME : name;
              Level level = Level.toLevel(value.trim(), null);
              if (level == null) {
                log.warn("Ignoring unknown level '{}' for logger {}", value, loggerName);
                return;
              }
              context.getLogger(loggerName).setLevel(level);
              log.debug("Logger {} set to {}", loggerName, level);
            });
  }
}
