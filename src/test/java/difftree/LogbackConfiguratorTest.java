package difftree;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class LogbackConfiguratorTest {

    @AfterEach
    void clearProperty() {
        System.clearProperty(LogbackConfigurator.LOG_LEVEL_PROPERTY);
    }

    @Test
    void consoleLogsInfoByDefault() {
        assertThat(LogbackConfigurator.consoleLevel()).isEqualTo(Level.INFO);
    }

    @Test
    void consoleLevelCanBeChanged() {
        System.setProperty(LogbackConfigurator.LOG_LEVEL_PROPERTY, "warn");
        assertThat(LogbackConfigurator.consoleLevel()).isEqualTo(Level.WARN);

        System.setProperty(LogbackConfigurator.LOG_LEVEL_PROPERTY, "nonsense");
        assertThat(LogbackConfigurator.consoleLevel()).isEqualTo(Level.INFO);
    }
}
