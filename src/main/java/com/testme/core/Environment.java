package com.testme.core;

/**
 * Source of named configuration values.
 *
 * The engine never caches what it reads from here: every accessor on
 * {@link TestMeConfig} performs a fresh lookup, so a change to the underlying
 * environment is visible to the very next check.
 *
 * Tests substitute a map-backed implementation to drive the engine
 * deterministically.
 */
@FunctionalInterface
public interface Environment {

    /**
     * Returns the value of the named variable, or {@code null} if it is not set.
     */
    String get(String name);

    /**
     * The live process environment.
     */
    static Environment system() {
        return SystemEnvironment.INSTANCE;
    }
}
