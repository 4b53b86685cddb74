package com.hartwig.wdl2cwl;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

public final class ExecutorUtil {

    private ExecutorUtil() {
    }

    /**
     * A pool of at most {@code nMaxThreads} named threads. Work submitted while all threads are busy is queued.
     */
    public static ExecutorService createExecutorService(int nMaxThreads, String nameTemplate) {
        var executor = new ThreadPoolExecutor(nMaxThreads,
                nMaxThreads,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new ThreadFactoryBuilder().setNameFormat(nameTemplate).setDaemon(true).build());
        executor.allowCoreThreadTimeOut(true);
        return executor;
    }

    /**
     * A pool that starts a named daemon thread for every task that finds no idle one. For work that only waits, such as
     * draining the output of a child process.
     */
    public static ExecutorService createUnboundedExecutorService(String nameTemplate) {
        return Executors.newCachedThreadPool(new ThreadFactoryBuilder().setNameFormat(nameTemplate).setDaemon(true).build());
    }
}
