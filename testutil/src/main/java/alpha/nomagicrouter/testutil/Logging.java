package alpha.nomagicrouter.testutil;

import alpha.nomagicrouter.HttpServer;
import org.assertj.core.groups.Tuple;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static java.time.temporal.ChronoUnit.MILLIS;
import static java.util.Objects.requireNonNull;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Test-side control of the library's JUL loggers.<p>
 *
 * The library logs through {@code System.Logger}, which the JDK backs with
 * JUL. All loggers are children of the logger named after the package of
 * {@link HttpServer}.
 */
public final class Logging
{
    private Logging() {
        // Empty
    }

    // Strong reference, the LogManager only keeps weak ones
    private static final Logger LIBRARY
            = Logger.getLogger(HttpServer.class.getPackageName());

    private static boolean consoleInstalled;

    /**
     * Makes the library log everything, to a one-line console format.<p>
     *
     * The console handler is installed only once, and replaces the parent
     * handlers.
     */
    public static synchronized void everything() {
        LIBRARY.setLevel(Level.ALL);
        if (!consoleInstalled) {
            Handler console = new ConsoleHandler();
            console.setLevel(Level.ALL);
            console.setFormatter(new OneLine());
            LIBRARY.addHandler(console);
            LIBRARY.setUseParentHandlers(false);
            consoleInstalled = true;
        }
    }

    /**
     * Adds a handler to the logger of the component's package.
     *
     * @param component to extract package from
     * @param handler to add
     */
    public static void addHandler(Class<?> component, Handler handler) {
        Logger.getLogger(component.getPackageName()).addHandler(handler);
    }

    /**
     * Removes a handler from the logger of the component's package.
     *
     * @param component to extract package from
     * @param handler to remove
     */
    public static void removeHandler(Class<?> component, Handler handler) {
        Logger.getLogger(component.getPackageName()).removeHandler(handler);
    }

    /**
     * {@return an AssertJ tuple of the JUL level and message}
     *
     * @param level of record
     * @param msg of record
     */
    public static Tuple rec(System.Logger.Level level, String msg) {
        return tuple(toJUL(level), msg);
    }

    /**
     * Maps a {@code System.Logger} level the way the JDK's JUL backend does.
     *
     * @param level to map
     * @return the JUL level
     */
    static Level toJUL(System.Logger.Level level) {
        switch (requireNonNull(level)) {
            case ALL:     return Level.ALL;
            case TRACE:   return Level.FINER;
            case DEBUG:   return Level.FINE;
            case INFO:    return Level.INFO;
            case WARNING: return Level.WARNING;
            case ERROR:   return Level.SEVERE;
            case OFF:     return Level.OFF;
            default:
                throw new IllegalArgumentException("Unknown level: " + level);
        }
    }

    private static final class OneLine extends Formatter {
        @Override
        public String format(LogRecord r) {
            var line = new StringBuilder()
                    .append(r.getInstant().truncatedTo(MILLIS)).append(' ')
                    .append(String.format("%-7s", r.getLevel().getName())).append(' ')
                    .append('[').append(Thread.currentThread().getName()).append("] ")
                    .append(r.getLoggerName()).append(": ")
                    .append(formatMessage(r))
                    .append(System.lineSeparator());
            if (r.getThrown() != null) {
                var trace = new StringWriter();
                r.getThrown().printStackTrace(new PrintWriter(trace, true));
                line.append(trace);
            }
            return line.toString();
        }
    }
}
