package io.github.drompincen.vigil.runtime.job;

/**
 * The work a schedule performs. Throwing and returning an unsuccessful result are both
 * recorded as a failed run.
 */
@FunctionalInterface
public interface JobBody {

    JobResult run(JobContext ctx) throws Exception;
}
