package com.testme.core;

import java.util.Objects;

/**
 * Typed, default-falling-back access to the environment variables that steer a
 * test program.
 *
 * Recognised environment variables:
 *   TESTME_DEPTH    - Integer thoroughness scale a test may use to size its work (default: 0)
 *   TESTME_VERBOSE  - Nonzero integer enables extra diagnostic output (default: 0)
 *   TESTME_SLEEP    - Presence only; a failing check suspends instead of exiting
 *
 * Nothing is cached. Each accessor performs a fresh lookup through the
 * {@link Environment}, so scripted runs that vary a variable between checks see
 * the new value immediately.
 */
public class TestMeConfig {

    public static final String DEPTH_VAR   = "TESTME_DEPTH";
    public static final String VERBOSE_VAR = "TESTME_VERBOSE";
    public static final String SLEEP_VAR   = "TESTME_SLEEP";

    private final Environment env;

    public TestMeConfig(Environment env) {
        this.env = Objects.requireNonNull(env, "env");
    }

    /** Configuration backed by the live process environment. */
    public static TestMeConfig fromEnvironment() {
        return new TestMeConfig(Environment.system());
    }

    // ── Accessors ─────────────────────────────────────────────────────────────

    /**
     * Returns the value of {@code key}, or {@code defaultValue} when it is unset.
     * A variable set to the empty string is returned as the empty string.
     */
    public String get(String key, String defaultValue) {
        String val = env.get(key);
        return val != null ? val : defaultValue;
    }

    /**
     * Returns {@code key} as a base-10 integer, or {@code defaultValue} when it is unset.
     *
     * A set value is parsed the way C's {@code atoi} does: leading whitespace and
     * an optional sign are skipped, then the leading run of digits is used. A value
     * with no leading digits yields {@code 0}. Out-of-range values saturate.
     */
    public int getInt(String key, int defaultValue) {
        String val = env.get(key);
        return val != null ? parseLeadingInt(val) : defaultValue;
    }

    /**
     * True when {@code key} resolves to a nonzero integer. Unset means false.
     */
    public boolean has(String key) {
        return getInt(key, 0) != 0;
    }

    /** The {@code TESTME_DEPTH} scale, 0 when unset. */
    public int depth() {
        return getInt(DEPTH_VAR, 0);
    }

    /** True when {@code TESTME_VERBOSE} is a nonzero integer. */
    public boolean verbose() {
        return has(VERBOSE_VAR);
    }

    /**
     * True when {@code TESTME_SLEEP} is present with any value, including empty.
     */
    public boolean sleepRequested() {
        return env.get(SLEEP_VAR) != null;
    }

    public Environment getEnvironment() { return env; }

    // ── Parsing ───────────────────────────────────────────────────────────────

    static int parseLeadingInt(String val) {
        int i = 0;
        int n = val.length();
        while (i < n && Character.isWhitespace(val.charAt(i))) i++;

        boolean negative = false;
        if (i < n && (val.charAt(i) == '+' || val.charAt(i) == '-')) {
            negative = val.charAt(i) == '-';
            i++;
        }

        long acc = 0;
        while (i < n) {
            char c = val.charAt(i);
            if (c < '0' || c > '9') break;
            acc = acc * 10 + (c - '0');
            // One past Integer.MAX_VALUE still fits MIN_VALUE once negated
            if (acc > (long) Integer.MAX_VALUE + 1) {
                acc = (long) Integer.MAX_VALUE + 1;
            }
            i++;
        }

        long signed = negative ? -acc : acc;
        if (signed > Integer.MAX_VALUE) return Integer.MAX_VALUE;
        if (signed < Integer.MIN_VALUE) return Integer.MIN_VALUE;
        return (int) signed;
    }

    @Override
    public String toString() {
        return "TestMeConfig{env=" + env + "}";
    }
}
