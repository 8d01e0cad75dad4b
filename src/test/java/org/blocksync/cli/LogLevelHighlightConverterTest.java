package org.blocksync.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.LoggingEvent;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LogLevelHighlightConverterTest {

    private final LogLevelHighlightConverter converter = new LogLevelHighlightConverter();

    private static LoggingEvent event(Level level) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(level);
        return event;
    }

    @Test
    void coloursErrorsWarningsAndInfo() {
        assertThat(converter.transform(event(Level.ERROR), "ERROR")).isEqualTo("\u001B[31mERROR\u001B[0m");
        assertThat(converter.transform(event(Level.WARN), "WARN")).isEqualTo("\u001B[33mWARN\u001B[0m");
        assertThat(converter.transform(event(Level.INFO), "INFO")).isEqualTo("\u001B[34mINFO\u001B[0m");
    }

    @Test
    void dimsDebugAndTrace() {
        assertThat(converter.transform(event(Level.DEBUG), "DEBUG")).isEqualTo("\u001B[2mDEBUG\u001B[0m");
        assertThat(converter.transform(event(Level.TRACE), "TRACE")).isEqualTo("\u001B[2mTRACE\u001B[0m");
    }
}
