package org.blocksync.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

/**
 * Logback converter behind {@code %levelColor} in the coloured console appender of
 * {@code logback.xml}. The {@code plain} logging format selects an appender without it.
 *
 * <p>Colours:
 * <ul>
 *   <li>ERROR - Red (failed commands)</li>
 *   <li>WARN - Yellow (unrecognized source, lint findings)</li>
 *   <li>INFO - Blue</li>
 *   <li>DEBUG/TRACE - Faint, so compiler and pipeline tracing stays in the background</li>
 * </ul>
 */
public class LogLevelHighlightConverter extends CompositeConverter<ILoggingEvent> {

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_FAINT = "\u001B[2m";
    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_YELLOW = "\u001B[33m";
    private static final String ANSI_BLUE = "\u001B[34m";

    @Override
    protected String transform(ILoggingEvent event, String in) {
        String colour = switch (event.getLevel().toInt()) {
            case Level.ERROR_INT -> ANSI_RED;
            case Level.WARN_INT -> ANSI_YELLOW;
            case Level.INFO_INT -> ANSI_BLUE;
            case Level.DEBUG_INT, Level.TRACE_INT -> ANSI_FAINT;
            default -> null;
        };
        return colour == null ? in : colour + in + ANSI_RESET;
    }
}
