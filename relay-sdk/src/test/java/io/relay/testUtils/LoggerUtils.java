package io.relay.testUtils;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.LoggerFactory;

public class LoggerUtils {
  public static SilenceLoggers silenceLoggers(Class<?>... classes) {
    return new SilenceLoggers(classes);
  }

  /** Captures events of the logger of {@code clazz} without printing them. */
  public static CapturedLogs captureLogs(Class<?> clazz) {
    return new CapturedLogs(clazz);
  }

  public static class SilenceLoggers implements AutoCloseable {
    private final List<Logger> loggers;
    List<Level> oldLogLevels;

    public SilenceLoggers(Class<?>... classes) {
      loggers =
          Arrays.stream(classes)
              .map(LoggerFactory::getLogger)
              .filter(Logger.class::isInstance)
              .map(Logger.class::cast)
              .collect(Collectors.toList());
      oldLogLevels = new ArrayList<>();
      for (Logger logger : loggers) {
        oldLogLevels.add(logger.getLevel());
        logger.setLevel(Level.OFF);
      }
    }

    @Override
    public void close() {
      for (int i = 0; i < loggers.size(); i++) {
        loggers.get(i).setLevel(oldLogLevels.get(i));
      }
    }
  }

  public static class CapturedLogs implements AutoCloseable {
    private final Logger logger;
    private final Level oldLevel;
    private final boolean oldAdditive;
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();

    private CapturedLogs(Class<?> clazz) {
      logger = (Logger) LoggerFactory.getLogger(clazz);
      oldLevel = logger.getLevel();
      oldAdditive = logger.isAdditive();
      appender.start();
      logger.addAppender(appender);
      logger.setAdditive(false);
      logger.setLevel(Level.DEBUG);
    }

    public List<ILoggingEvent> getEvents(Level level) {
      return appender.list.stream()
          .filter(e -> e.getLevel().equals(level))
          .collect(Collectors.toList());
    }

    @Override
    public void close() {
      logger.detachAppender(appender);
      appender.stop();
      logger.setLevel(oldLevel);
      logger.setAdditive(oldAdditive);
    }
  }
}
