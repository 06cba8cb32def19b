package io.github.drompincen.vigil.runtime.job;

/**
 * A job body that {@link JobRegistry} can resolve by its job type tag.
 */
public interface MonitoringJob extends JobBody {

    String jobType();
}
