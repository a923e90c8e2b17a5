package dev.divertscan.tickets.ticketparser;

import java.time.Duration;

/**
 * Waits between extraction attempts.
 */
@FunctionalInterface
public interface BackoffSleeper {

    BackoffSleeper THREAD_SLEEP = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
