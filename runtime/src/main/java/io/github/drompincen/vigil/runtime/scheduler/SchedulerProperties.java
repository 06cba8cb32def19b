package io.github.drompincen.vigil.runtime.scheduler;

import java.time.Duration;

/**
 * Tunables for the trigger engine, bound from {@code vigil.scheduler.*}.
 */
public class SchedulerProperties {

    /** Concurrent firings allowed for one schedule id. */
    private int maxInstances = 3;
    /** How late a timer may fire and still count as on time. */
    private long misfireGraceSeconds = 900;
    private int timerPoolSize = 4;
    private int workerPoolSize = 8;

    public SchedulerProperties() {}

    public Duration misfireGrace() {
        return Duration.ofSeconds(misfireGraceSeconds);
    }

    public int getMaxInstances() { return maxInstances; }
    public void setMaxInstances(int maxInstances) { this.maxInstances = maxInstances; }
    public long getMisfireGraceSeconds() { return misfireGraceSeconds; }
    public void setMisfireGraceSeconds(long misfireGraceSeconds) { this.misfireGraceSeconds = misfireGraceSeconds; }
    public int getTimerPoolSize() { return timerPoolSize; }
    public void setTimerPoolSize(int timerPoolSize) { this.timerPoolSize = timerPoolSize; }
    public int getWorkerPoolSize() { return workerPoolSize; }
    public void setWorkerPoolSize(int workerPoolSize) { this.workerPoolSize = workerPoolSize; }
}
