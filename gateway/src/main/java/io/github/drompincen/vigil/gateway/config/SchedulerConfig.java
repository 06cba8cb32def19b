package io.github.drompincen.vigil.gateway.config;

import io.github.drompincen.vigil.runtime.scheduler.SchedulerProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class SchedulerConfig {

    @Bean
    @ConfigurationProperties(prefix = "vigil.scheduler")
    SchedulerProperties schedulerProperties() {
        return new SchedulerProperties();
    }

    /** Timer threads only; they hand every occurrence to the job worker pool. */
    @Bean
    ThreadPoolTaskScheduler taskScheduler(SchedulerProperties properties) {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getTimerPoolSize());
        scheduler.setThreadNamePrefix("vigil-timer-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean(name = "jobWorkerExecutor")
    ThreadPoolTaskExecutor jobWorkerExecutor(SchedulerProperties properties) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWorkerPoolSize());
        executor.setMaxPoolSize(properties.getWorkerPoolSize());
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("vigil-job-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
