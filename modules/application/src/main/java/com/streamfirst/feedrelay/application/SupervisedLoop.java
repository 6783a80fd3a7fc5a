package com.streamfirst.feedrelay.application;

/**
 * Body of a long-running background loop. Implementations normally never return; an interrupt
 * ends them with {@link InterruptedException}.
 */
@FunctionalInterface
public interface SupervisedLoop {

    void run() throws Exception;
}
