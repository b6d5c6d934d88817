package com.testme.api;

import com.testme.core.TestMeConfig;
import com.testme.model.OperandType;

/**
 * Static entry point for standalone test programs.
 *
 * <pre>
 *   import static com.testme.api.TestMe.*;
 *
 *   public class SumTest {
 *       public static void main(String[] args) {
 *           teqi(2 + 3, 5, "sum check");
 *           tcontains(greeting(), "world");
 *           for (int i = 0; i &lt; 10 * (tdepth() + 1); i++) {
 *               tgti(next(), 0, "iteration %d", i);
 *           }
 *       }
 *   }
 * </pre>
 *
 * A passing check prints one {@code ✓} line on stdout. A failing check prints a
 * {@code ✗} line with {@code Expected:} and {@code Received:} lines on stderr, then
 * exits with status 1 -- or, when TESTME_SLEEP is set, suspends for five minutes
 * so a debugger can attach and afterwards returns {@code false}.
 *
 * Every check takes {@code (received, expected)} followed by an optional
 * {@link String#format} message. The suffix names the operand category:
 * {@code i} int, {@code l} long, {@code ll} long long, {@code z} size (unsigned),
 * {@code u} unsigned int, {@code p} reference identity.
 *
 * No setup or teardown is needed. Output goes to whatever {@code System.out}
 * and {@code System.err} are at the time of the check.
 */
public final class TestMe {

    private static final CheckEngine ENGINE = CheckEngine.system();
    private static final String NO_MESSAGE = null;

    private TestMe() {}

    // ── Equality ─────────────────────────────────────────────────────────────

    public static boolean teqi(int received, int expected) {
        return ENGINE.equal(OperandType.INT, received, expected, NO_MESSAGE);
    }

    public static boolean teqi(int received, int expected, String format, Object... args) {
        return ENGINE.equal(OperandType.INT, received, expected, format, args);
    }

    public static boolean teql(long received, long expected) {
        return ENGINE.equal(OperandType.LONG, received, expected, NO_MESSAGE);
    }

    public static boolean teql(long received, long expected, String format, Object... args) {
        return ENGINE.equal(OperandType.LONG, received, expected, format, args);
    }

    public static boolean teqll(long received, long expected) {
        return ENGINE.equal(OperandType.LONG_LONG, received, expected, NO_MESSAGE);
    }

    public static boolean teqll(long received, long expected, String format, Object... args) {
        return ENGINE.equal(OperandType.LONG_LONG, received, expected, format, args);
    }

    public static boolean teqz(long received, long expected) {
        return ENGINE.equal(OperandType.SIZE, received, expected, NO_MESSAGE);
    }

    public static boolean teqz(long received, long expected, String format, Object... args) {
        return ENGINE.equal(OperandType.SIZE, received, expected, format, args);
    }

    public static boolean tequ(int received, int expected) {
        return ENGINE.equal(OperandType.UNSIGNED, received, expected, NO_MESSAGE);
    }

    public static boolean tequ(int received, int expected, String format, Object... args) {
        return ENGINE.equal(OperandType.UNSIGNED, received, expected, format, args);
    }

    public static boolean teqp(Object received, Object expected) {
        return ENGINE.equal(OperandType.POINTER, received, expected, NO_MESSAGE);
    }

    public static boolean teqp(Object received, Object expected, String format, Object... args) {
        return ENGINE.equal(OperandType.POINTER, received, expected, format, args);
    }

    // ── Inequality ───────────────────────────────────────────────────────────

    public static boolean tneqi(int received, int expected) {
        return ENGINE.notEqual(OperandType.INT, received, expected, NO_MESSAGE);
    }

    public static boolean tneqi(int received, int expected, String format, Object... args) {
        return ENGINE.notEqual(OperandType.INT, received, expected, format, args);
    }

    public static boolean tneql(long received, long expected) {
        return ENGINE.notEqual(OperandType.LONG, received, expected, NO_MESSAGE);
    }

    public static boolean tneql(long received, long expected, String format, Object... args) {
        return ENGINE.notEqual(OperandType.LONG, received, expected, format, args);
    }

    public static boolean tneqll(long received, long expected) {
        return ENGINE.notEqual(OperandType.LONG_LONG, received, expected, NO_MESSAGE);
    }

    public static boolean tneqll(long received, long expected, String format, Object... args) {
        return ENGINE.notEqual(OperandType.LONG_LONG, received, expected, format, args);
    }

    public static boolean tneqz(long received, long expected) {
        return ENGINE.notEqual(OperandType.SIZE, received, expected, NO_MESSAGE);
    }

    public static boolean tneqz(long received, long expected, String format, Object... args) {
        return ENGINE.notEqual(OperandType.SIZE, received, expected, format, args);
    }

    public static boolean tnequ(int received, int expected) {
        return ENGINE.notEqual(OperandType.UNSIGNED, received, expected, NO_MESSAGE);
    }

    public static boolean tnequ(int received, int expected, String format, Object... args) {
        return ENGINE.notEqual(OperandType.UNSIGNED, received, expected, format, args);
    }

    public static boolean tneqp(Object received, Object expected) {
        return ENGINE.notEqual(OperandType.POINTER, received, expected, NO_MESSAGE);
    }

    public static boolean tneqp(Object received, Object expected, String format, Object... args) {
        return ENGINE.notEqual(OperandType.POINTER, received, expected, format, args);
    }

    // ── Greater than ─────────────────────────────────────────────────────────

    public static boolean tgti(int received, int expected) {
        return ENGINE.greaterThan(OperandType.INT, received, expected, NO_MESSAGE);
    }

    public static boolean tgti(int received, int expected, String format, Object... args) {
        return ENGINE.greaterThan(OperandType.INT, received, expected, format, args);
    }

    public static boolean tgtl(long received, long expected) {
        return ENGINE.greaterThan(OperandType.LONG, received, expected, NO_MESSAGE);
    }

    public static boolean tgtl(long received, long expected, String format, Object... args) {
        return ENGINE.greaterThan(OperandType.LONG, received, expected, format, args);
    }

    public static boolean tgtll(long received, long expected) {
        return ENGINE.greaterThan(OperandType.LONG_LONG, received, expected, NO_MESSAGE);
    }

    public static boolean tgtll(long received, long expected, String format, Object... args) {
        return ENGINE.greaterThan(OperandType.LONG_LONG, received, expected, format, args);
    }

    public static boolean tgtz(long received, long expected) {
        return ENGINE.greaterThan(OperandType.SIZE, received, expected, NO_MESSAGE);
    }

    public static boolean tgtz(long received, long expected, String format, Object... args) {
        return ENGINE.greaterThan(OperandType.SIZE, received, expected, format, args);
    }

    public static boolean tgtu(int received, int expected) {
        return ENGINE.greaterThan(OperandType.UNSIGNED, received, expected, NO_MESSAGE);
    }

    public static boolean tgtu(int received, int expected, String format, Object... args) {
        return ENGINE.greaterThan(OperandType.UNSIGNED, received, expected, format, args);
    }

    // ── Greater than or equal ────────────────────────────────────────────────

    public static boolean tgtei(int received, int expected) {
        return ENGINE.greaterOrEqual(OperandType.INT, received, expected, NO_MESSAGE);
    }

    public static boolean tgtei(int received, int expected, String format, Object... args) {
        return ENGINE.greaterOrEqual(OperandType.INT, received, expected, format, args);
    }

    public static boolean tgtel(long received, long expected) {
        return ENGINE.greaterOrEqual(OperandType.LONG, received, expected, NO_MESSAGE);
    }

    public static boolean tgtel(long received, long expected, String format, Object... args) {
        return ENGINE.greaterOrEqual(OperandType.LONG, received, expected, format, args);
    }

    public static boolean tgtell(long received, long expected) {
        return ENGINE.greaterOrEqual(OperandType.LONG_LONG, received, expected, NO_MESSAGE);
    }

    public static boolean tgtell(long received, long expected, String format, Object... args) {
        return ENGINE.greaterOrEqual(OperandType.LONG_LONG, received, expected, format, args);
    }

    public static boolean tgtez(long received, long expected) {
        return ENGINE.greaterOrEqual(OperandType.SIZE, received, expected, NO_MESSAGE);
    }

    public static boolean tgtez(long received, long expected, String format, Object... args) {
        return ENGINE.greaterOrEqual(OperandType.SIZE, received, expected, format, args);
    }

    public static boolean tgteu(int received, int expected) {
        return ENGINE.greaterOrEqual(OperandType.UNSIGNED, received, expected, NO_MESSAGE);
    }

    public static boolean tgteu(int received, int expected, String format, Object... args) {
        return ENGINE.greaterOrEqual(OperandType.UNSIGNED, received, expected, format, args);
    }

    // ── Less than ────────────────────────────────────────────────────────────

    public static boolean tlti(int received, int expected) {
        return ENGINE.lessThan(OperandType.INT, received, expected, NO_MESSAGE);
    }

    public static boolean tlti(int received, int expected, String format, Object... args) {
        return ENGINE.lessThan(OperandType.INT, received, expected, format, args);
    }

    public static boolean tltl(long received, long expected) {
        return ENGINE.lessThan(OperandType.LONG, received, expected, NO_MESSAGE);
    }

    public static boolean tltl(long received, long expected, String format, Object... args) {
        return ENGINE.lessThan(OperandType.LONG, received, expected, format, args);
    }

    public static boolean tltll(long received, long expected) {
        return ENGINE.lessThan(OperandType.LONG_LONG, received, expected, NO_MESSAGE);
    }

    public static boolean tltll(long received, long expected, String format, Object... args) {
        return ENGINE.lessThan(OperandType.LONG_LONG, received, expected, format, args);
    }

    public static boolean tltz(long received, long expected) {
        return ENGINE.lessThan(OperandType.SIZE, received, expected, NO_MESSAGE);
    }

    public static boolean tltz(long received, long expected, String format, Object... args) {
        return ENGINE.lessThan(OperandType.SIZE, received, expected, format, args);
    }

    public static boolean tltu(int received, int expected) {
        return ENGINE.lessThan(OperandType.UNSIGNED, received, expected, NO_MESSAGE);
    }

    public static boolean tltu(int received, int expected, String format, Object... args) {
        return ENGINE.lessThan(OperandType.UNSIGNED, received, expected, format, args);
    }

    // ── Less than or equal ───────────────────────────────────────────────────

    public static boolean tltei(int received, int expected) {
        return ENGINE.lessOrEqual(OperandType.INT, received, expected, NO_MESSAGE);
    }

    public static boolean tltei(int received, int expected, String format, Object... args) {
        return ENGINE.lessOrEqual(OperandType.INT, received, expected, format, args);
    }

    public static boolean tltel(long received, long expected) {
        return ENGINE.lessOrEqual(OperandType.LONG, received, expected, NO_MESSAGE);
    }

    public static boolean tltel(long received, long expected, String format, Object... args) {
        return ENGINE.lessOrEqual(OperandType.LONG, received, expected, format, args);
    }

    public static boolean tltell(long received, long expected) {
        return ENGINE.lessOrEqual(OperandType.LONG_LONG, received, expected, NO_MESSAGE);
    }

    public static boolean tltell(long received, long expected, String format, Object... args) {
        return ENGINE.lessOrEqual(OperandType.LONG_LONG, received, expected, format, args);
    }

    public static boolean tltez(long received, long expected) {
        return ENGINE.lessOrEqual(OperandType.SIZE, received, expected, NO_MESSAGE);
    }

    public static boolean tltez(long received, long expected, String format, Object... args) {
        return ENGINE.lessOrEqual(OperandType.SIZE, received, expected, format, args);
    }

    public static boolean tlteu(int received, int expected) {
        return ENGINE.lessOrEqual(OperandType.UNSIGNED, received, expected, NO_MESSAGE);
    }

    public static boolean tlteu(int received, int expected, String format, Object... args) {
        return ENGINE.lessOrEqual(OperandType.UNSIGNED, received, expected, format, args);
    }

    // ── Strings ───────────────────────────────────────────────────────────────

    /** Passes when both are null, or both are non-null and identical. */
    public static boolean tmatch(String received, String expected) {
        return ENGINE.match(received, expected, NO_MESSAGE);
    }

    public static boolean tmatch(String received, String expected, String format, Object... args) {
        return ENGINE.match(received, expected, format, args);
    }

    /** Passes when both are non-null and {@code needle} occurs in {@code haystack}. */
    public static boolean tcontains(String haystack, String needle) {
        return ENGINE.contains(haystack, needle, NO_MESSAGE);
    }

    public static boolean tcontains(String haystack, String needle, String format, Object... args) {
        return ENGINE.contains(haystack, needle, format, args);
    }

    // ── References ────────────────────────────────────────────────────────────

    public static boolean tnull(Object value) {
        return ENGINE.isNull(value, NO_MESSAGE);
    }

    public static boolean tnull(Object value, String format, Object... args) {
        return ENGINE.isNull(value, format, args);
    }

    public static boolean tnotnull(Object value) {
        return ENGINE.notNull(value, NO_MESSAGE);
    }

    public static boolean tnotnull(Object value, String format, Object... args) {
        return ENGINE.notNull(value, format, args);
    }

    // ── Truth ─────────────────────────────────────────────────────────────────

    public static boolean ttrue(boolean value) {
        return ENGINE.isTrue(value, NO_MESSAGE);
    }

    public static boolean ttrue(boolean value, String format, Object... args) {
        return ENGINE.isTrue(value, format, args);
    }

    public static boolean tfalse(boolean value) {
        return ENGINE.isFalse(value, NO_MESSAGE);
    }

    public static boolean tfalse(boolean value, String format, Object... args) {
        return ENGINE.isFalse(value, format, args);
    }

    /** Fails unconditionally. Place it where control must never arrive. */
    public static boolean tfail() {
        return ENGINE.fail(NO_MESSAGE);
    }

    public static boolean tfail(String format, Object... args) {
        return ENGINE.fail(format, args);
    }

    // ── Legacy aliases ────────────────────────────────────────────────────────

    /** Legacy alias of {@link #teqi(int, int)}. */
    public static boolean teq(int received, int expected) {
        return ENGINE.equal(OperandType.INT, received, expected, NO_MESSAGE);
    }

    /** Legacy alias of {@link #teqi(int, int, String, Object...)}. */
    public static boolean teq(int received, int expected, String format, Object... args) {
        return ENGINE.equal(OperandType.INT, received, expected, format, args);
    }

    /** Legacy alias of {@link #tneqi(int, int)}. */
    public static boolean tneq(int received, int expected) {
        return ENGINE.notEqual(OperandType.INT, received, expected, NO_MESSAGE);
    }

    /** Legacy alias of {@link #tneqi(int, int, String, Object...)}. */
    public static boolean tneq(int received, int expected, String format, Object... args) {
        return ENGINE.notEqual(OperandType.INT, received, expected, format, args);
    }

    /** Legacy alias of {@link #ttrue(boolean)}. */
    public static boolean tassert(boolean value) {
        return ENGINE.isTrue(value, NO_MESSAGE);
    }

    /** Legacy alias of {@link #ttrue(boolean, String, Object...)}. */
    public static boolean tassert(boolean value, String format, Object... args) {
        return ENGINE.isTrue(value, format, args);
    }

    // ── Environment ───────────────────────────────────────────────────────────

    /** Value of {@code key}, or {@code defaultValue} when unset. */
    public static String tget(String key, String defaultValue) {
        return config().get(key, defaultValue);
    }

    /** {@code key} as an integer ({@code atoi} rules), or {@code defaultValue} when unset. */
    public static int tgeti(String key, int defaultValue) {
        return config().getInt(key, defaultValue);
    }

    /** True when {@code key} is set to a nonzero integer. */
    public static boolean thas(String key) {
        return config().has(key);
    }

    /** The TESTME_DEPTH scale, 0 when unset. */
    public static int tdepth() {
        return config().depth();
    }

    /** True when TESTME_VERBOSE is set to a nonzero integer. */
    public static boolean tverbose() {
        return config().verbose();
    }

    // ── Trace output ──────────────────────────────────────────────────────────

    public static void tinfo(String format, Object... args) {
        ENGINE.write(format, args);
    }

    public static void twrite(String format, Object... args) {
        ENGINE.write(format, args);
    }

    /** Diagnostic output; gate it on {@link #tverbose()} where it should be quiet by default. */
    public static void tdebug(String format, Object... args) {
        ENGINE.debug(format, args);
    }

    /** Announces a skip; the caller returns from {@code main} afterwards. */
    public static void tskip(String format, Object... args) {
        ENGINE.write(format, args);
    }

    private static TestMeConfig config() {
        return ENGINE.config();
    }
}
