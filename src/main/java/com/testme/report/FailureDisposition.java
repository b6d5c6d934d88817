package com.testme.report;

import com.testme.core.TestMeConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Decides what happens to the process after a failing check has been reported.
 *
 * There is one decision point and two outcomes:
 *   - TESTME_SLEEP present (any value) -> SUSPEND: block for {@link #SUSPEND_INTERVAL}
 *     so a debugger can attach, then let the test carry on.
 *   - otherwise                        -> TERMINATE: exit immediately with
 *     {@link #FAILURE_EXIT_STATUS}.
 *
 * The decision is re-read from the environment on every failure, so toggling
 * TESTME_SLEEP mid-run affects only the failures that follow.
 */
public class FailureDisposition {

    private static final Logger log = LoggerFactory.getLogger(FailureDisposition.class);

    public static final int      FAILURE_EXIT_STATUS = 1;
    public static final Duration SUSPEND_INTERVAL    = Duration.ofMinutes(5);

    public enum Action { TERMINATE, SUSPEND }

    private final TestMeConfig   config;
    private final ProcessControl process;

    public FailureDisposition(TestMeConfig config, ProcessControl process) {
        this.config  = Objects.requireNonNull(config, "config");
        this.process = Objects.requireNonNull(process, "process");
    }

    /** The action the next failure would take, given the current environment. */
    public Action decide() {
        return config.sleepRequested() ? Action.SUSPEND : Action.TERMINATE;
    }

    /**
     * Applies the current decision. Returns only after a suspend, or when the
     * {@link ProcessControl} does not really terminate.
     *
     * @return the action taken
     */
    public Action apply() {
        Action action = decide();
        switch (action) {
            case SUSPEND -> {
                log.info("FailureDisposition: {} is set -- suspending for {} (pid {}) to allow a debugger to attach",
                    TestMeConfig.SLEEP_VAR, SUSPEND_INTERVAL, ProcessHandle.current().pid());
                process.sleep(SUSPEND_INTERVAL);
            }
            case TERMINATE -> {
                log.debug("FailureDisposition: Terminating with status {}", FAILURE_EXIT_STATUS);
                process.exit(FAILURE_EXIT_STATUS);
            }
        }
        return action;
    }
}
