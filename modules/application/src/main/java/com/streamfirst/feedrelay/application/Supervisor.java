package com.streamfirst.feedrelay.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * Keeps a background loop alive: any failure or unexpected return is logged and the loop is
 * restarted after a fixed delay. Cancellation (thread interrupt) is the only way out, apart from
 * {@link VirtualMachineError}s, which are rethrown.
 */
@Slf4j
@RequiredArgsConstructor
public class Supervisor {

    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(5);

    private final Sleeper sleeper;

    public Supervisor() {
        this(Sleeper.SYSTEM);
    }

    /**
     * Runs the loop until the calling thread is interrupted.
     *
     * @param name loop name used in log messages
     * @param loop the loop body
     * @param retryDelay pause before each restart
     * @throws InterruptedException when the loop is cancelled
     */
    public void supervise(String name, SupervisedLoop loop, Duration retryDelay) throws InterruptedException {
        log.info("Starting {} loop", name);
        while (true) {
            try {
                loop.run();
                log.warn("{} loop returned, restarting in {}", name, retryDelay);
            } catch (InterruptedException | CancellationException e) {
                log.info("{} loop cancelled", name);
                throw cancellation(e);
            } catch (VirtualMachineError e) {
                log.error("{} loop stopped by fatal error", name, e);
                throw e;
            } catch (Exception | Error e) {
                if (Thread.currentThread().isInterrupted()) {
                    log.info("{} loop cancelled while failing: {}", name, e.toString());
                    throw cancellation(e);
                }
                log.error("{} loop failed, restarting in {}", name, retryDelay, e);
            }
            sleeper.sleep(retryDelay);
        }
    }

    private static InterruptedException cancellation(Throwable cause) {
        if (cause instanceof InterruptedException interrupted) {
            return interrupted;
        }
        InterruptedException interrupted = new InterruptedException("Loop cancelled");
        interrupted.initCause(cause);
        return interrupted;
    }
}
