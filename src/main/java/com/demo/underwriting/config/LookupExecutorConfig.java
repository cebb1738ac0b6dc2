package com.demo.underwriting.config;

import com.demo.underwriting.thread.MdcTaskDecorator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Threads for profile lookups. Tasks are handed straight to a worker, never
 * queued, so a lookup's deadline is spent running and not waiting behind the
 * lookups of another assessment.
 */
@Configuration
public class LookupExecutorConfig {

    @Bean(name = "profileLookupExecutor")
    public ThreadPoolTaskExecutor profileLookupExecutor(
            @Value("${profileSearch.coreLookupThreads:8}") int coreThreads,
            @Value("${profileSearch.maxLookupThreads:256}") int maxThreads) {
        // container gọi initialize() qua afterPropertiesSet
        return configure("profile-lookup-", coreThreads, maxThreads);
    }

    /** Ready-to-use executor with the same settings, for code outside the container. */
    public static ThreadPoolTaskExecutor lookupExecutor(String threadNamePrefix, int coreThreads, int maxThreads) {
        ThreadPoolTaskExecutor executor = configure(threadNamePrefix, coreThreads, maxThreads);
        executor.initialize();
        return executor;
    }

    private static ThreadPoolTaskExecutor configure(String threadNamePrefix, int coreThreads, int maxThreads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreThreads);
        executor.setMaxPoolSize(Math.max(coreThreads, maxThreads));
        executor.setQueueCapacity(0); // direct handoff
        executor.setKeepAliveSeconds(60);
        executor.setAllowCoreThreadTimeOut(true);
        executor.setDaemon(true);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setTaskDecorator(new MdcTaskDecorator());
        return executor;
    }
}
