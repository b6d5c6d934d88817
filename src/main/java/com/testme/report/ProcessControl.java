package com.testme.report;

import java.time.Duration;

/**
 * The process-level effects a failing check can have.
 *
 * {@link SystemProcessControl} acts on the real JVM. Tests supply a recording
 * implementation so the disposition policy can be exercised in-process.
 */
public interface ProcessControl {

    /**
     * Terminates the process with {@code status}. The system implementation does
     * not return.
     */
    void exit(int status);

    /**
     * Blocks the calling thread for {@code duration}.
     */
    void sleep(Duration duration);

    static ProcessControl system() {
        return SystemProcessControl.INSTANCE;
    }
}
