package com.testme.report;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Where pass and fail records are written.
 *
 * Streams are looked up on every report, so a test program that redirects
 * {@code System.out} or {@code System.err} mid-run is honoured by the next check.
 */
public final class OutputStreams {

    private final Supplier<PrintStream> out;
    private final Supplier<PrintStream> err;

    private OutputStreams(Supplier<PrintStream> out, Supplier<PrintStream> err) {
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    /**
     * The current {@code System.out} and {@code System.err}, encoded as UTF-8 so
     * the check and cross glyphs survive a non-UTF-8 platform default.
     */
    public static OutputStreams system() {
        return new OutputStreams(() -> utf8(System.out), () -> utf8(System.err));
    }

    /** Fixed streams, typically in-memory ones under test. */
    public static OutputStreams of(PrintStream out, PrintStream err) {
        Objects.requireNonNull(out, "out");
        Objects.requireNonNull(err, "err");
        return new OutputStreams(() -> out, () -> err);
    }

    public PrintStream out() { return out.get(); }
    public PrintStream err() { return err.get(); }

    private static PrintStream utf8(PrintStream target) {
        // Raw bytes pass through PrintStream.write untouched
        return new PrintStream(target, true, StandardCharsets.UTF_8);
    }
}
