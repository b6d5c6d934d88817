package com.testme.api;

import com.testme.core.Environment;
import com.testme.core.TestMeConfig;
import com.testme.model.CheckResult;
import com.testme.model.OperandType;
import com.testme.model.SourceLocation;
import com.testme.report.FailureDisposition;
import com.testme.report.MessageRenderer;
import com.testme.report.OutputStreams;
import com.testme.report.ProcessControl;
import com.testme.report.ReportFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;
import java.util.function.IntPredicate;

/**
 * Evaluates checks and reports them.
 *
 * Every construct receives its operands already evaluated -- Java evaluates
 * each argument exactly once -- and works only on those parameters from then
 * on: the comparison, the rendering of {@code Expected:} / {@code Received:}
 * and the message all read the same captured values. An operand expression
 * with side effects therefore runs once per check.
 *
 * All constructs share one reporting path, {@link #check}, parameterised by the
 * operand's {@link OperandType}. Each returns the outcome; after a failure that
 * only happens when TESTME_SLEEP let the process continue.
 *
 * Most test programs use the static {@link TestMe} facade, which is backed by
 * {@link #system()}. Build an engine directly to redirect output or to replace
 * the environment and process control:
 * <pre>
 *   CheckEngine checks = CheckEngine.builder()
 *       .environment(Map.of("TESTME_SLEEP", "1")::get)
 *       .streams(OutputStreams.of(out, err))
 *       .build();
 *   checks.equal(OperandType.INT, count(), 3, "three items");
 * </pre>
 */
public class CheckEngine {

    private static final Logger log = LoggerFactory.getLogger(CheckEngine.class);

    // Frames skipped when locating the test line that made the check
    private static final Class<?>[] ENGINE_FRAMES = { CheckEngine.class, TestMe.class };

    private static final CheckEngine SYSTEM = builder().build();

    private final TestMeConfig    config;
    private final OutputStreams   streams;
    private final ReportFormatter formatter;

    private CheckEngine(Builder b) {
        this.config    = new TestMeConfig(b.environment);
        this.streams   = b.streams;
        this.formatter = new ReportFormatter(streams, new FailureDisposition(config, b.process));
    }

    /** The engine bound to the real environment, console and process. */
    public static CheckEngine system() {
        return SYSTEM;
    }

    // ── Equality ──────────────────────────────────────────────────────────────

    public <T> boolean equal(OperandType<T> type, T received, T expected, String format, Object... args) {
        return check(type.same(received, expected), type, received, expected, format, args);
    }

    public <T> boolean notEqual(OperandType<T> type, T received, T expected, String format, Object... args) {
        return check(!type.same(received, expected), type, received, expected, format, args);
    }

    // ── Ordering ──────────────────────────────────────────────────────────────

    public <T> boolean greaterThan(OperandType<T> type, T received, T expected, String format, Object... args) {
        return check(ordered(type, received, expected, c -> c > 0), type, received, expected, format, args);
    }

    public <T> boolean greaterOrEqual(OperandType<T> type, T received, T expected, String format, Object... args) {
        return check(ordered(type, received, expected, c -> c >= 0), type, received, expected, format, args);
    }

    public <T> boolean lessThan(OperandType<T> type, T received, T expected, String format, Object... args) {
        return check(ordered(type, received, expected, c -> c < 0), type, received, expected, format, args);
    }

    public <T> boolean lessOrEqual(OperandType<T> type, T received, T expected, String format, Object... args) {
        return check(ordered(type, received, expected, c -> c <= 0), type, received, expected, format, args);
    }

    // ── Strings ───────────────────────────────────────────────────────────────

    /**
     * Exact match: both null, or both non-null with identical content.
     */
    public boolean match(String received, String expected, String format, Object... args) {
        boolean passed = received == null
            ? expected == null
            : received.equals(expected);
        return check(passed, OperandType.STRING, received, expected, format, args);
    }

    /**
     * Passes only when both are non-null and {@code needle} occurs in {@code haystack}.
     * Reports the needle as expected and the haystack as received.
     */
    public boolean contains(String haystack, String needle, String format, Object... args) {
        boolean passed = haystack != null && needle != null && haystack.contains(needle);
        return check(passed, OperandType.STRING, haystack, needle, format, args);
    }

    // ── References ────────────────────────────────────────────────────────────

    public boolean isNull(Object value, String format, Object... args) {
        return check(value == null, OperandType.POINTER, value, null, format, args);
    }

    public boolean notNull(Object value, String format, Object... args) {
        return report(value != null, "non-null", OperandType.POINTER.render(value), format, args);
    }

    // ── Truth ─────────────────────────────────────────────────────────────────

    public boolean isTrue(boolean value, String format, Object... args) {
        return check(value, OperandType.BOOLEAN, value, true, format, args);
    }

    public boolean isFalse(boolean value, String format, Object... args) {
        return check(!value, OperandType.BOOLEAN, value, false, format, args);
    }

    /** Always fails. For code that must not be reached. */
    public boolean fail(String format, Object... args) {
        return report(false, "not reached", "reached", format, args);
    }

    // ── Trace output ──────────────────────────────────────────────────────────

    /** Prints a formatted line to stdout, unconditionally. */
    public void write(String format, Object... args) {
        PrintStream out = streams.out();
        String text = MessageRenderer.render(format, args);
        out.print((text != null ? text : "") + "\n");
        out.flush();
    }

    /**
     * Prints a formatted diagnostic line to stdout. Gating on TESTME_VERBOSE is
     * left to the test program, through {@link TestMeConfig#verbose()}.
     */
    public void debug(String format, Object... args) {
        write(format, args);
    }

    public TestMeConfig config() { return config; }

    // ── Reporting ─────────────────────────────────────────────────────────────

    private <T> boolean check(boolean passed, OperandType<T> type, T received, T expected,
                              String format, Object... args) {
        return report(passed, type.render(expected), type.render(received), format, args);
    }

    private boolean report(boolean passed, String expected, String received, String format, Object... args) {
        SourceLocation location = SourceLocation.callerOf(ENGINE_FRAMES);
        String message = MessageRenderer.render(format, args);
        return formatter.report(CheckResult.of(passed, location, expected, received, message));
    }

    // An unordered category (pointer, string, boolean) reports a failure rather than throwing
    private static <T> boolean ordered(OperandType<T> type, T received, T expected, IntPredicate test) {
        if (!type.isOrdered()) {
            log.debug("CheckEngine: Operand type '{}' has no ordering -- reporting as failed", type.getName());
            return false;
        }
        return received != null && expected != null && test.test(type.compare(received, expected));
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private Environment    environment = Environment.system();
        private OutputStreams  streams     = OutputStreams.system();
        private ProcessControl process     = ProcessControl.system();

        public Builder environment(Environment env)     { this.environment = Objects.requireNonNull(env, "env"); return this; }
        public Builder streams(OutputStreams streams)   { this.streams = Objects.requireNonNull(streams, "streams"); return this; }
        public Builder process(ProcessControl process)  { this.process = Objects.requireNonNull(process, "process"); return this; }

        public CheckEngine build() {
            return new CheckEngine(this);
        }
    }
}
