package com.eainde.intent.thread;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool that carries the submitting thread's MDC into each task,
 * so retrieval logs keep the session round they belong to.
 */
public class MdcAwareExecutor implements Executor {

    private final ExecutorService delegate;

    public MdcAwareExecutor(int threads) {
        this(Executors.newFixedThreadPool(threads, namedDaemonThreads("catalog-retrieval-")));
    }

    public MdcAwareExecutor(ExecutorService delegate) {
        this.delegate = delegate;
    }

    @Override
    public void execute(Runnable command) {
        // caller context, restored on the worker
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                command.run();
            } finally {
                MDC.clear();
            }
        });
    }

    public void shutdown() {
        delegate.shutdown();
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
