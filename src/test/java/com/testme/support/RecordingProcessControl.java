package com.testme.support;

import com.testme.report.ProcessControl;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Records exit and sleep requests instead of acting on the JVM.
 *
 * {@link #exit} throws {@link SimulatedExit} so that, as with a real exit, no
 * statement after the failing check runs. {@link #sleep} returns immediately.
 */
public class RecordingProcessControl implements ProcessControl {

    private final List<Integer>  exits  = new ArrayList<>();
    private final List<Duration> sleeps = new ArrayList<>();

    @Override
    public void exit(int status) {
        exits.add(status);
        throw new SimulatedExit(status);
    }

    @Override
    public void sleep(Duration duration) {
        sleeps.add(duration);
    }

    public List<Integer>  getExits()  { return exits; }
    public List<Duration> getSleeps() { return sleeps; }

    public static class SimulatedExit extends RuntimeException {
        private final int status;

        public SimulatedExit(int status) {
            super("exit(" + status + ")");
            this.status = status;
        }

        public int getStatus() { return status; }
    }
}
