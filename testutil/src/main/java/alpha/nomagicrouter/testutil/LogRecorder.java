package alpha.nomagicrouter.testutil;

import alpha.nomagicrouter.HttpServer;
import alpha.nomagicrouter.testutil.functional.AbstractRealTest;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;

import static alpha.nomagicrouter.testutil.Logging.rec;
import static alpha.nomagicrouter.testutil.Logging.toJUL;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.fail;

/**
 * Records the log records of the library, for later assertions.<p>
 *
 * Records are matched on level and a message prefix. Methods with "remove"
 * in the name remove the earliest match, so that it is not matched again.
 * {@link #assertAwait(System.Logger.Level, String)} blocks for at most 3
 * seconds, which is needed for records logged by a server thread after the
 * client already got its response.
 *
 * <pre>
 *     // An expected warning...
 *     recorder.assertRemove(WARNING, "Handler wrote a response")
 *     // ...but nothing else
 *             .assertNoProblem();
 * </pre>
 *
 * {@link AbstractRealTest} asserts a problem-free log after each test.
 */
public final class LogRecorder
{
    private static final long AWAIT_SECONDS = 3;

    /**
     * Starts recording all records of the library.<p>
     *
     * Recording should eventually be stopped using {@link #stopRecording()}.
     *
     * @return a new log recorder
     */
    public static LogRecorder startRecording() {
        var r = new LogRecorder();
        Logging.addHandler(HttpServer.class, r.handler);
        return r;
    }

    // Guarded by this
    private final List<LogRecord> records = new ArrayList<>();
    private final Handler handler;

    private LogRecorder() {
        handler = new Handler() {
            @Override
            public void publish(LogRecord r) {
                synchronized (LogRecorder.this) {
                    records.add(r);
                    LogRecorder.this.notifyAll();
                }
            }

            @Override
            public void flush() {
                // Nothing buffered
            }

            @Override
            public void close() {
                // Nothing to release
            }
        };
        handler.setLevel(Level.ALL);
    }

    /**
     * Removes the earliest record that matches.
     *
     * @param level record's level
     * @param messageStartsWith record's message prefix
     *
     * @return this for chaining/fluency
     *
     * @throws AssertionError
     *             if a match could not be found
     */
    public synchronized LogRecorder assertRemove(
            System.Logger.Level level, String messageStartsWith) {
        var test = matcher(level, messageStartsWith);
        for (Iterator<LogRecord> it = records.iterator(); it.hasNext(); ) {
            if (test.test(it.next())) {
                it.remove();
                return this;
            }
        }
        return fail("No record " + level + " \"" + messageStartsWith + "...\" in " + messages());
    }

    /**
     * Waits for a matching record.
     *
     * @param level record's level
     * @param messageStartsWith record's message prefix
     *
     * @return this for chaining/fluency
     *
     * @throws InterruptedException
     *             if the current thread is interrupted while waiting
     * @throws AssertionError
     *             on timeout
     */
    public synchronized LogRecorder assertAwait(
            System.Logger.Level level, String messageStartsWith)
            throws InterruptedException {
        var test = matcher(level, messageStartsWith);
        final long deadline = System.nanoTime() + SECONDS.toNanos(AWAIT_SECONDS);
        while (records.stream().noneMatch(test)) {
            final long left = deadline - System.nanoTime();
            if (left <= 0) {
                return fail("Timed out waiting on " + level + " \"" + messageStartsWith + "...\"");
            }
            // Woken by publish()
            wait(Math.max(1, left / 1_000_000));
        }
        return this;
    }

    /**
     * Asserts that no record has a throwable or a level above {@code INFO}.
     *
     * @return this for chaining/fluency
     */
    public synchronized LogRecorder assertNoProblem() {
        assertThat(records)
            .noneMatch(r -> r.getLevel().intValue() > Level.INFO.intValue())
            .noneMatch(r -> r.getThrown() != null);
        return this;
    }

    /**
     * Asserts that exactly one record has the given level and message.
     *
     * @param level record's level
     * @param message record's message
     *
     * @return this for chaining/fluency
     */
    public synchronized LogRecorder assertContainsOnlyOnce(
            System.Logger.Level level, String message) {
        assertThat(records)
            .extracting(LogRecord::getLevel, LogRecord::getMessage)
            .containsOnlyOnce(rec(level, message));
        return this;
    }

    /**
     * Stops recording.
     */
    public void stopRecording() {
        Logging.removeHandler(HttpServer.class, handler);
    }

    private List<String> messages() {
        var l = new ArrayList<String>(records.size());
        records.forEach(r -> l.add(r.getLevel() + " " + r.getMessage()));
        return l;
    }

    private static Predicate<LogRecord> matcher(System.Logger.Level level, String prefix) {
        var jul = toJUL(level);
        requireNonNull(prefix);
        return r -> r.getLevel().equals(jul) && r.getMessage().startsWith(prefix);
    }
}
