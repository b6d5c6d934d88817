package com.testme.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * {@link ProcessControl} backed by {@link System#exit} and {@link Thread#sleep}.
 */
final class SystemProcessControl implements ProcessControl {

    private static final Logger log = LoggerFactory.getLogger(SystemProcessControl.class);

    static final SystemProcessControl INSTANCE = new SystemProcessControl();

    private SystemProcessControl() {}

    @Override
    public void exit(int status) {
        System.exit(status);
    }

    @Override
    public void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("SystemProcessControl: Suspend interrupted before {} elapsed -- resuming", duration);
        }
    }
}
