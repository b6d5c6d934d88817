package com.testme.report;

import com.testme.model.CheckResult;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Turns a {@link CheckResult} into its console record and applies the
 * {@link FailureDisposition} when the check failed.
 *
 * Success, one line on stdout:
 * <pre>
 *   ✓ sum check
 *   ✓ Test passed at MathTest.java@12
 * </pre>
 *
 * Failure, three lines on stderr:
 * <pre>
 *   ✗ Test failed at MathTest.java@13: sum check
 *   Expected: 5
 *   Received: 4
 * </pre>
 *
 * A custom message on success is printed as given. On failure it follows the
 * {@code Test failed at <location>: } prefix. An absent expected or received text
 * prints as {@code (NULL)}. Both streams are flushed after every record so output
 * interleaves in real time with whatever captures the process's logs.
 *
 * This line shape is what downstream log scrapers match on; keep it stable.
 */
public class ReportFormatter {

    public static final String PASS_GLYPH = "✓";
    public static final String FAIL_GLYPH = "✗";
    public static final String NULL_TEXT  = "(NULL)";

    private final OutputStreams      streams;
    private final FailureDisposition disposition;

    public ReportFormatter(OutputStreams streams, FailureDisposition disposition) {
        this.streams     = Objects.requireNonNull(streams, "streams");
        this.disposition = Objects.requireNonNull(disposition, "disposition");
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    /**
     * Writes the record for {@code result}; on failure, hands over to the
     * disposition policy, which may not return.
     *
     * @return {@code result.isPassed()}
     */
    public boolean report(CheckResult result) {
        if (result.isPassed()) {
            PrintStream out = streams.out();
            out.print(successLine(result) + "\n");
            out.flush();
            return true;
        }

        PrintStream err = streams.err();
        err.print(failureBlock(result));
        err.flush();
        disposition.apply();
        return false;
    }

    // ── Formatting ────────────────────────────────────────────────────────────

    /** The success line without its trailing newline. */
    public static String successLine(CheckResult result) {
        String text = result.hasMessage()
            ? result.getMessage()
            : "Test passed at " + result.getLocation();
        return PASS_GLYPH + " " + singleLine(MessageRenderer.bound(text));
    }

    /** The three-line failure block, each line newline-terminated. */
    public static String failureBlock(CheckResult result) {
        String heading = "Test failed at " + result.getLocation();
        if (result.hasMessage()) {
            heading += ": " + result.getMessage();
        }
        return FAIL_GLYPH + " " + singleLine(MessageRenderer.bound(heading)) + "\n"
            + "Expected: " + singleLine(orNull(result.getExpected())) + "\n"
            + "Received: " + singleLine(orNull(result.getReceived())) + "\n";
    }

    private static String orNull(String text) {
        return text == null ? NULL_TEXT : MessageRenderer.bound(text);
    }

    // Embedded line breaks would break the one-line and three-line record shapes
    private static String singleLine(String text) {
        return text.replace("\r\n", "\\n").replace("\n", "\\n").replace("\r", "\\r");
    }
}
