package com.testme.model;

import java.util.Comparator;
import java.util.Objects;
import java.util.function.Function;

/**
 * A renderable operand category: how values of one nominal type are compared
 * and how they are printed in a report.
 *
 * The set is closed -- the constants below are the only instances. Each one
 * pairs the category's native comparison with its canonical text form:
 *
 *   INT        32-bit signed, decimal
 *   LONG       64-bit signed, decimal
 *   LONG_LONG  64-bit signed, decimal
 *   SIZE       64-bit size or offset, unsigned comparison and decimal text
 *   UNSIGNED   32-bit unsigned, unsigned comparison and decimal text
 *   POINTER    object reference, identity equality, {@code 0x<identity hash>} text
 *   STRING     text, rendered verbatim
 *   BOOLEAN    {@code true} / {@code false}
 *
 * A {@code null} value always renders as {@code null}; the formatter prints
 * that as {@code (NULL)}.
 *
 * @param <T> the boxed Java type carried by the category
 */
public final class OperandType<T> {

    public static final OperandType<Integer> INT = new OperandType<>(
        "int", String::valueOf, Integer::compare, true);

    public static final OperandType<Long> LONG = new OperandType<>(
        "long", String::valueOf, Long::compare, true);

    public static final OperandType<Long> LONG_LONG = new OperandType<>(
        "long long", String::valueOf, Long::compare, true);

    public static final OperandType<Long> SIZE = new OperandType<>(
        "size", Long::toUnsignedString, Long::compareUnsigned, true);

    public static final OperandType<Integer> UNSIGNED = new OperandType<>(
        "unsigned", Integer::toUnsignedString, Integer::compareUnsigned, true);

    public static final OperandType<Object> POINTER = new OperandType<>(
        "pointer", OperandType::address, null, false);

    public static final OperandType<String> STRING = new OperandType<>(
        "string", Function.identity(), null, true);

    public static final OperandType<Boolean> BOOLEAN = new OperandType<>(
        "boolean", String::valueOf, null, true);

    private final String              name;
    private final Function<T, String> renderer;
    private final Comparator<T>       ordering;     // null for unordered categories
    private final boolean             byValue;      // false = identity equality

    private OperandType(String name, Function<T, String> renderer,
                        Comparator<T> ordering, boolean byValue) {
        this.name     = name;
        this.renderer = renderer;
        this.ordering = ordering;
        this.byValue  = byValue;
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    /**
     * Canonical text for {@code value}, or {@code null} when {@code value} is null.
     */
    public String render(T value) {
        return value == null ? null : renderer.apply(value);
    }

    /**
     * Equality under the category's native semantics. Two nulls are equal.
     */
    public boolean same(T a, T b) {
        if (a == null || b == null) return a == b;
        if (!byValue) return a == b;
        return a.equals(b);
    }

    /**
     * Native ordering of two non-null values: negative, zero or positive.
     *
     * @throws UnsupportedOperationException if the category has no ordering
     */
    public int compare(T a, T b) {
        if (ordering == null) {
            throw new UnsupportedOperationException("Operand type '" + name + "' has no ordering");
        }
        return ordering.compare(Objects.requireNonNull(a, "a"), Objects.requireNonNull(b, "b"));
    }

    public boolean isOrdered() { return ordering != null; }
    public String  getName()   { return name; }

    private static String address(Object ref) {
        return "0x" + Integer.toHexString(System.identityHashCode(ref));
    }

    @Override
    public String toString() {
        return "OperandType{" + name + "}";
    }
}
