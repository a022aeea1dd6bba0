package com.example.blockalert.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class TaskConfig {

    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("alert-scheduler-");
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Blocking JDBC work triggered from reactive pipelines (stream callbacks, reconnects) runs here,
     * never on the Netty event loop.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler jdbcScheduler() {
        return Schedulers.newBoundedElastic(32, 10_000, "jdbc-io-");
    }
}
