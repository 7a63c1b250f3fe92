package com.gentoro.ragmcp.logging;

import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Central place to obtain SLF4J loggers and to apply YAML-driven log levels to Logback. */
public final class LoggingService {
  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  private LoggingService() {}

  public static Logger getLogger(Class<?> clazz) {
    return LoggerFactory.getLogger(clazz);
  }

  /**
   * Apply logging levels from application configuration.
   *
   * <p>Expected YAML structure:
   *
   * <pre>
   * logging:
   *   level:
   *     root: INFO
   *     com.gentoro.ragmcp: DEBUG
   *     org.mongodb.driver: WARN
   * </pre>
   */
  public static void applyConfiguration(Configuration cfg) {
    if (cfg == null) return;
    try {
      ch.qos.logback.classic.LoggerContext ctx =
          (ch.qos.logback.classic.LoggerContext) LoggerFactory.getILoggerFactory();

      String rootLvl = cfg.getString("logging.level.root", null);
      if (rootLvl != null && !rootLvl.isBlank()) {
        setLevel(ctx.getLogger(Logger.ROOT_LOGGER_NAME), rootLvl);
      }

      Configuration levels = cfg.subset("logging.level");
      Iterator<String> it = levels.getKeys();
      while (it.hasNext()) {
        String key = it.next();
        if ("root".equalsIgnoreCase(key)) continue;
        String lvl = levels.getString(key, null);
        if (lvl == null || lvl.isBlank()) continue;
        // hierarchical YAML keys escape dots inside a node name as ".."
        setLevel(ctx.getLogger(key.replace("..", ".")), lvl);
      }
    } catch (ClassCastException e) {
      log.warn("SLF4J is not bound to Logback; YAML logging levels are ignored", e);
    }
  }

  /**
   * Redacted form of a store credential for log lines: scheme and host are kept, user info and
   * query parameters are dropped.
   */
  public static String redact(String credential) {
    if (credential == null || credential.isBlank()) return "<none>";
    int schemeEnd = credential.indexOf("://");
    if (schemeEnd < 0) return "<redacted>";
    String scheme = credential.substring(0, schemeEnd + 3);
    String rest = credential.substring(schemeEnd + 3);
    int at = rest.lastIndexOf('@');
    if (at >= 0) {
      rest = rest.substring(at + 1);
    }
    int cut = indexOfAny(rest, '/', '?');
    if (cut >= 0) {
      rest = rest.substring(0, cut);
    }
    return scheme + (at >= 0 ? "***@" : "") + rest;
  }

  private static int indexOfAny(String s, char a, char b) {
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c == a || c == b) return i;
    }
    return -1;
  }

  private static void setLevel(ch.qos.logback.classic.Logger logger, String levelStr) {
    if (logger == null || levelStr == null) return;
    ch.qos.logback.classic.Level level =
        ch.qos.logback.classic.Level.toLevel(levelStr.trim(), null);
    if (level == null) {
      log.warn("Unknown log level '{}'; ignoring for logger {}", levelStr, logger.getName());
      return;
    }
    logger.setLevel(level);
    log.debug("Set logger '{}' to level {}", logger.getName(), level);
  }
}
