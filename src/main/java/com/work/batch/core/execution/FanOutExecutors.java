package com.work.batch.core.execution;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * fan-out 执行器与 join-all 辅助方法。
 *
 * 约束：
 * - 线程数 >= chunkSize 时，一个 chunk 内的任务全部同时在途
 * - 提交到这里的任务自己负责把异常转成结果，join 不应抛出业务异常
 */
public final class FanOutExecutors {

    private FanOutExecutors() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static ThreadPoolExecutor newFanOutExecutor(int threads, String threadNamePrefix) {
        if (threads <= 0) throw new IllegalArgumentException("threads must be > 0");
        final String prefix = (threadNamePrefix == null || threadNamePrefix.trim().isEmpty())
                ? "batch-io-"
                : threadNamePrefix.trim();
        final AtomicInteger seq = new AtomicInteger();
        ThreadFactory tf = r -> {
            Thread t = new Thread(r);
            t.setName(prefix + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
        // 无界队列：超过线程数的任务排队而不是被拒绝（扫描 256 个 slot 时可能发生）
        ThreadPoolExecutor exec = new ThreadPoolExecutor(
                threads, threads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                tf
        );
        exec.allowCoreThreadTimeOut(true);
        return exec;
    }

    /**
     * 同 CompletableFuture.supplyAsync，但执行器拒绝任务（已关闭等）时返回异常完成的 future 而不是直接抛出，
     * 使拒绝与任务自身的失败走同一条处理路径。
     */
    public static <T> CompletableFuture<T> supply(Supplier<T> task, Executor executor) {
        try {
            return CompletableFuture.supplyAsync(task, executor);
        } catch (RejectedExecutionException e) {
            CompletableFuture<T> rejected = new CompletableFuture<>();
            rejected.completeExceptionally(e);
            return rejected;
        }
    }

    /**
     * 等待全部完成并按原顺序返回结果。任一任务异常时抛出其原始异常（解开 CompletionException）。
     */
    public static <T> List<T> joinAll(List<CompletableFuture<T>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            throw e;
        }
        List<T> out = new ArrayList<>(futures.size());
        for (CompletableFuture<T> f : futures) {
            out.add(f.join());
        }
        return out;
    }

    /**
     * 取异常的可读描述，优先使用 CompletionException 内部的原因。
     */
    public static String describe(Throwable t) {
        Throwable cause = t;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        String msg = cause.getMessage();
        return (msg == null || msg.trim().isEmpty()) ? "Unknown error" : msg;
    }
}
