package io.github.drompincen.vigil.runtime.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class JobRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);
    private final Map<String, MonitoringJob> jobs = new ConcurrentHashMap<>();

    @Autowired
    public JobRegistry(ObjectProvider<MonitoringJob> monitoringJobs) {
        this(monitoringJobs.orderedStream().toList());
    }

    JobRegistry(List<MonitoringJob> monitoringJobs) {
        monitoringJobs.forEach(this::register);
        log.info("Loaded {} job types: {}", jobs.size(), jobs.keySet());
    }

    public void register(MonitoringJob job) {
        MonitoringJob previous = jobs.put(job.jobType(), job);
        if (previous != null) {
            log.warn("Job type {} registered twice, {} replaces {}", job.jobType(),
                    job.getClass().getSimpleName(), previous.getClass().getSimpleName());
        }
    }

    public Optional<MonitoringJob> get(String jobType) {
        return jobType == null ? Optional.empty() : Optional.ofNullable(jobs.get(jobType));
    }

    public boolean supports(String jobType) {
        return get(jobType).isPresent();
    }

    public Set<String> jobTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(jobs.keySet()));
    }

    /** The registered body, or one that fails the run with "Unknown job type". */
    public JobBody resolve(String jobType) {
        return get(jobType).<JobBody>map(j -> j)
                .orElse(ctx -> JobResult.failure("Unknown job type: " + jobType));
    }
}
