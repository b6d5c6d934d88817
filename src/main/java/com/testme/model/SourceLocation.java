package com.testme.model;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Where a check was written: source file name and line number.
 *
 * Displayed as a single token, {@code CheckoutTest.java@42}, so log scrapers can
 * split a report line on whitespace and still get the location whole.
 *
 * Immutable -- use {@link #of} or {@link #callerOf}.
 */
public final class SourceLocation {

    public static final SourceLocation UNKNOWN = new SourceLocation("unknown", 0);

    private final String file;
    private final int    line;

    private SourceLocation(String file, int line) {
        this.file = file;
        this.line = line;
    }

    public static SourceLocation of(String file, int line) {
        return new SourceLocation(Objects.requireNonNull(file, "file"), Math.max(line, 0));
    }

    /**
     * Captures the location of the first stack frame outside the given classes.
     *
     * Pass every class that sits between the test code and this call (the facade
     * and the engine) so the location names the test's own line.
     *
     * @param engineClasses classes whose frames, and their nested classes' frames, are skipped
     * @return the caller's location, or {@link #UNKNOWN} if every frame was skipped
     */
    public static SourceLocation callerOf(Class<?>... engineClasses) {
        Set<String> skipped = Arrays.stream(engineClasses)
            .map(Class::getName)
            .collect(Collectors.toCollection(HashSet::new));
        skipped.add(SourceLocation.class.getName());

        return StackWalker.getInstance().walk(frames -> frames
            .filter(f -> !isSkipped(f.getClassName(), skipped))
            .findFirst()
            .map(f -> of(f.getFileName() != null ? f.getFileName() : simpleName(f.getClassName()),
                f.getLineNumber()))
            .orElse(UNKNOWN));
    }

    public String getFile() { return file; }
    public int    getLine() { return line; }

    private static boolean isSkipped(String className, Set<String> skipped) {
        if (skipped.contains(className)) return true;
        for (int i = className.indexOf('$'); i > 0; i = className.indexOf('$', i + 1)) {
            if (skipped.contains(className.substring(0, i))) return true;
        }
        return false;
    }

    private static String outerClassName(String className) {
        int nested = className.indexOf('$');
        return nested < 0 ? className : className.substring(0, nested);
    }

    private static String simpleName(String className) {
        String outer = outerClassName(className);
        return outer.substring(outer.lastIndexOf('.') + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation)) return false;
        SourceLocation that = (SourceLocation) o;
        return line == that.line && file.equals(that.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, line);
    }

    @Override
    public String toString() {
        return file + "@" + line;
    }
}
