package difftree;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.layout.TTLLLayout;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import ch.qos.logback.core.encoder.LayoutWrappingEncoder;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public class Main {

    private static final String LOG_FILE = "difftree.log";

    public static void main(String[] args) {
        configureLogger();
        int exitCode = new CommandLine(new DiffTreeCommand()).execute(args);
        System.exit(exitCode);
    }

    /**
     * Adds a log file in the home folder next to the console output set up by {@link LogbackConfigurator}.
     */
    private static void configureLogger() {
        LoggerContext lc = (LoggerContext) LoggerFactory.getILoggerFactory();
        TTLLLayout layout = new TTLLLayout();
        layout.setContext(lc);
        layout.start();

        LayoutWrappingEncoder<ILoggingEvent> encoder = new LayoutWrappingEncoder<>();
        encoder.setContext(lc);
        encoder.setLayout(layout);

        FileAppender<ILoggingEvent> fileAppender = new FileAppender<>();
        fileAppender.setName("file");
        fileAppender.setFile(System.getProperty("user.home") + "/" + LOG_FILE);
        fileAppender.setContext(lc);
        fileAppender.setEncoder(encoder);
        fileAppender.start();

        Logger rootLogger = lc.getLogger(Logger.ROOT_LOGGER_NAME);
        rootLogger.addAppender(fileAppender);

        // debug output goes to the file only, the console appender filters by its own threshold
        lc.getLogger("difftree").setLevel(Level.DEBUG);
    }
}
