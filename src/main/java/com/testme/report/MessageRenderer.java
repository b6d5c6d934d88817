package com.testme.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands a custom check message and keeps every rendered text within
 * {@link #MAX_BUFFER} characters.
 *
 * Rendering is best-effort: a format string that does not match its arguments,
 * or an argument that cannot be turned into text, leaves the format printed as
 * written rather than failing the check a second time.
 */
public final class MessageRenderer {

    private static final Logger log = LoggerFactory.getLogger(MessageRenderer.class);

    /** Upper bound on any single rendered text: message, expected or received. */
    public static final int MAX_BUFFER = 4096;

    private MessageRenderer() {}

    /**
     * Renders {@code format} with {@code args} using {@link String#format}.
     *
     * @return {@code null} when {@code format} is null or empty; the format verbatim
     *         when there are no arguments, the format is malformed or an argument
     *         fails to render; otherwise the formatted text. Always bounded by {@link #MAX_BUFFER}.
     */
    public static String render(String format, Object... args) {
        if (format == null || format.isEmpty()) return null;
        if (args == null || args.length == 0) return bound(format);
        try {
            return bound(String.format(format, args));
        } catch (RuntimeException e) {
            // Malformed format, or an argument whose toString() throws
            log.debug("MessageRenderer: Could not render message format \"{}\" -- {}", format, e.toString());
            return bound(format);
        }
    }

    /**
     * Truncates {@code text} to {@link #MAX_BUFFER} characters. Null passes through.
     */
    public static String bound(String text) {
        if (text == null || text.length() <= MAX_BUFFER) return text;
        int end = MAX_BUFFER;
        // Never split a surrogate pair
        if (Character.isHighSurrogate(text.charAt(end - 1))) end--;
        return text.substring(0, end);
    }
}
