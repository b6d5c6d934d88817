package com.testme.core;

/**
 * Reads {@link System#getenv(String)} on every call.
 */
final class SystemEnvironment implements Environment {

    static final SystemEnvironment INSTANCE = new SystemEnvironment();

    private SystemEnvironment() {}

    @Override
    public String get(String name) {
        return System.getenv(name);
    }

    @Override
    public String toString() {
        return "SystemEnvironment";
    }
}
