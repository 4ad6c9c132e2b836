package difftree;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.filter.ThresholdFilter;
import ch.qos.logback.classic.layout.TTLLLayout;
import ch.qos.logback.classic.spi.Configurator;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import ch.qos.logback.core.spi.ContextAwareBase;

/**
 * Default logging setup, found by logback through the service loader.
 * <p>
 * Logs go to stderr so that stdout only carries command output. The console level can be changed with
 * the {@code difftree.log.level} system property.
 */
public class LogbackConfigurator extends ContextAwareBase implements Configurator {

    static final String LOG_LEVEL_PROPERTY = "difftree.log.level";

    public LogbackConfigurator() {
    }

    public ExecutionStatus configure(LoggerContext lc) {
        addInfo("Setting up difftree logging configuration.");

        TTLLLayout layout = new TTLLLayout();
        layout.setContext(lc);
        layout.start();

        LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
        encoder.setContext(lc);
        encoder.setLayout(layout);

        ThresholdFilter thresholdFilter = new ThresholdFilter();
        thresholdFilter.setContext(lc);
        thresholdFilter.setLevel(consoleLevel().toString());
        thresholdFilter.start();

        ConsoleAppender<ILoggingEvent> consoleAppender = new ConsoleAppender<>();
        consoleAppender.setContext(lc);
        consoleAppender.setName("console");
        consoleAppender.setTarget("System.err");
        consoleAppender.setEncoder(encoder);
        consoleAppender.addFilter(thresholdFilter);
        consoleAppender.start();

        Logger rootLogger = lc.getLogger(Logger.ROOT_LOGGER_NAME);
        rootLogger.setLevel(Level.INFO);
        rootLogger.addAppender(consoleAppender);

        // let the caller decide
        return ExecutionStatus.DO_NOT_INVOKE_NEXT_IF_ANY;
    }

    static Level consoleLevel() {
        return Level.toLevel(System.getProperty(LOG_LEVEL_PROPERTY), Level.INFO);
    }
}
