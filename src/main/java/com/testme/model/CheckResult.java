package com.testme.model;

import java.util.Objects;

/**
 * The outcome of one assertion call, handed straight to the report formatter.
 *
 * A result is built once per check and never stored. {@code expected} and
 * {@code received} are the already-rendered operand texts; either may be
 * {@code null}, which the formatter prints as {@code (NULL)}. {@code message}
 * is the rendered custom message, or {@code null} when the caller gave none.
 *
 * Immutable -- use the static factories.
 */
public final class CheckResult {

    private final boolean        passed;
    private final SourceLocation location;
    private final String         expected;
    private final String         received;
    private final String         message;

    private CheckResult(boolean passed, SourceLocation location,
                        String expected, String received, String message) {
        this.passed   = passed;
        this.location = Objects.requireNonNull(location, "location");
        this.expected = expected;
        this.received = received;
        this.message  = message;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static CheckResult of(boolean passed, SourceLocation location,
                                 String expected, String received, String message) {
        return new CheckResult(passed, location, expected, received, message);
    }

    public static CheckResult passed(SourceLocation location, String message) {
        return new CheckResult(true, location, null, null, message);
    }

    public static CheckResult failed(SourceLocation location,
                                     String expected, String received, String message) {
        return new CheckResult(false, location, expected, received, message);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public boolean        isPassed()    { return passed; }
    public boolean        isFailed()    { return !passed; }
    public SourceLocation getLocation() { return location; }
    public String         getExpected() { return expected; }
    public String         getReceived() { return received; }
    public String         getMessage()  { return message; }
    public boolean        hasMessage()  { return message != null && !message.isEmpty(); }

    @Override
    public String toString() {
        return passed
            ? String.format("CheckResult{PASSED, at=%s}", location)
            : String.format("CheckResult{FAILED, at=%s, expected=%s, received=%s}",
                location, expected, received);
    }
}
