package com.eainde.intent.thread;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MdcAwareExecutorTest {

    private final MdcAwareExecutor executor = new MdcAwareExecutor(1);

    @AfterEach
    void tearDown() {
        MDC.clear();
        executor.shutdown();
    }

    @Test
    void execute_shouldCarryCallerMdcIntoTask() throws Exception {
        MDC.put("sessionRound", "2");

        String seen = CompletableFuture.supplyAsync(() -> MDC.get("sessionRound"), executor)
                .get(5, TimeUnit.SECONDS);

        assertThat(seen).isEqualTo("2");
    }

    @Test
    void execute_shouldNotLeakMdcToLaterTasks() throws Exception {
        MDC.put("sessionRound", "1");
        CompletableFuture.runAsync(() -> { }, executor).get(5, TimeUnit.SECONDS);
        MDC.clear();

        String seen = CompletableFuture.supplyAsync(() -> MDC.get("sessionRound"), executor)
                .get(5, TimeUnit.SECONDS);

        assertThat(seen).isNull();
    }

    @Test
    void execute_shouldNameWorkerThreads() throws Exception {
        String threadName = CompletableFuture.supplyAsync(() -> Thread.currentThread().getName(), executor)
                .get(5, TimeUnit.SECONDS);

        assertThat(threadName).startsWith("catalog-retrieval-");
    }
}
