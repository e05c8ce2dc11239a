package com.hartwig.minijd;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

public final class ThreadUtil {
    private ThreadUtil() {
    }

    /**
     * Runs at most {@code nMaxThreads} tasks at the same time, queueing the rest. Idle threads are released after a minute.
     */
    public static ExecutorService createExecutorService(int nMaxThreads, String nameTemplate) {
        var executor = new ThreadPoolExecutor(nMaxThreads,
                nMaxThreads,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new ThreadFactoryBuilder().setNameFormat(nameTemplate).build());
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    /**
     * Unbounded pool of daemon threads, for helpers that must never keep the JVM alive.
     */
    public static ExecutorService createDaemonExecutorService(String nameTemplate) {
        return Executors.newCachedThreadPool(new ThreadFactoryBuilder().setNameFormat(nameTemplate).setDaemon(true).build());
    }
}
