package com.demo.underwriting.thread;

import com.demo.underwriting.config.LookupExecutorConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MdcTaskDecoratorTest {

    private final ThreadPoolTaskExecutor executor = LookupExecutorConfig.lookupExecutor("mdc-test-", 1, 1);

    @AfterEach
    void tearDown() {
        MDC.clear();
        executor.shutdown();
    }

    @Test
    void tasksSeeTheSubmittersMdc() throws Exception {
        MDC.put("applicantRef", "app-123456");

        String seen = CompletableFuture.supplyAsync(() -> MDC.get("applicantRef"), executor)
                .get(5, TimeUnit.SECONDS);

        assertThat(seen).isEqualTo("app-123456");
    }

    @Test
    void pooledThreadDoesNotLeakContextIntoNextTask() throws Exception {
        MDC.put("applicantRef", "app-first");
        CompletableFuture.runAsync(() -> { }, executor).get(5, TimeUnit.SECONDS);

        MDC.clear();
        // one thread, so the second task reuses the first one's worker
        String seen = CompletableFuture.supplyAsync(() -> MDC.get("applicantRef"), executor)
                .get(5, TimeUnit.SECONDS);

        assertThat(seen).isNull();
    }

    @Test
    void decoratedRunnableRestoresTheWorkersOwnContext() {
        MDC.put("applicantRef", "app-submitter");
        Runnable task = new MdcTaskDecorator().decorate(() ->
                assertThat(MDC.get("applicantRef")).isEqualTo("app-submitter"));

        MDC.put("applicantRef", "app-worker");
        task.run();

        assertThat(MDC.get("applicantRef")).isEqualTo("app-worker");
    }

    @Test
    void workerThreadsAreNamedAndDaemon() throws Exception {
        Thread worker = CompletableFuture.supplyAsync(Thread::currentThread, executor).get(5, TimeUnit.SECONDS);

        assertThat(worker.getName()).startsWith("mdc-test-");
        assertThat(worker.isDaemon()).isTrue();
    }
}
