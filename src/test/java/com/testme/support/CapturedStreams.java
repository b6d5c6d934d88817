package com.testme.support;

import com.testme.report.OutputStreams;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

/**
 * In-memory stdout and stderr for asserting on exact report text.
 */
public class CapturedStreams {

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private final OutputStreams streams = OutputStreams.of(
        new PrintStream(out, false, StandardCharsets.UTF_8),
        new PrintStream(err, false, StandardCharsets.UTF_8));

    public OutputStreams streams() { return streams; }

    public String out() { return out.toString(StandardCharsets.UTF_8); }
    public String err() { return err.toString(StandardCharsets.UTF_8); }

    public List<String> outLines() { return lines(out()); }
    public List<String> errLines() { return lines(err()); }

    private static List<String> lines(String text) {
        return text.isEmpty() ? List.of() : Arrays.asList(text.split("\n"));
    }
}
