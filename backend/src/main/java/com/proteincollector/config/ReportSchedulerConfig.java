package com.proteincollector.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Single-thread scheduler that runs the periodic governance report. The report only reads limiter and cache
 * statistics, so one thread is enough; a failed run is logged and the next run still fires.
 */
@Slf4j
@Configuration
@EnableScheduling
public class ReportSchedulerConfig {

    public static final String REPORT_SCHEDULER = "governance-report-scheduler";

    @Bean(name = REPORT_SCHEDULER)
    public ThreadPoolTaskScheduler governanceReportScheduler() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(1);
        s.setThreadNamePrefix("governance-report-");
        s.setErrorHandler(e -> log.error("Governance report run failed", e));
        s.setWaitForTasksToCompleteOnShutdown(true);
        s.setAwaitTerminationSeconds(5);
        s.initialize();
        return s;
    }
}
