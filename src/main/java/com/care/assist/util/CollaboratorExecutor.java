package com.care.assist.util;

import com.care.assist.exception.CollaboratorTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 外部協作者呼叫執行器 (Collaborator Executor)
 * <p>
 * 功能：
 * 所有可能阻塞的外部呼叫（風險分類器、轉接、語言生成）都透過此處執行，
 * 並受到時限約束，避免拖住 Session 鎖。
 * <p>
 * 機制：
 * 1. 固定大小的 ThreadPool 與有界佇列，滿載時直接拒絕 (AbortPolicy)。
 * 2. 逾時後取消 Future 並中斷執行緒。
 * 3. 逾時、拒絕、中斷或呼叫本身失敗，一律轉為 {@link CollaboratorTimeoutException}。
 */
public class CollaboratorExecutor {

    private static final Logger logger = LoggerFactory.getLogger(CollaboratorExecutor.class);

    private final ThreadPoolExecutor executor;

    public CollaboratorExecutor(int coreThreads, int maxThreads, int queueCapacity) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "collaborator-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.executor = new ThreadPoolExecutor(
                coreThreads,
                Math.max(coreThreads, maxThreads),
                60L,
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(1, queueCapacity)),
                factory,
                new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * 非同步提交，供需要與其他工作並行的呼叫端使用
     */
    public <T> Future<T> submit(String collaborator, Callable<T> task) throws CollaboratorTimeoutException {
        try {
            return executor.submit(task);
        } catch (RejectedExecutionException e) {
            logger.warn("協作者呼叫被拒絕（執行緒池已滿）: {}", collaborator);
            throw new CollaboratorTimeoutException(collaborator, "rejected", e);
        }
    }

    /**
     * 等待已提交的呼叫，超過時限即取消
     */
    public <T> T await(String collaborator, Future<T> future, long timeoutMs) throws CollaboratorTimeoutException {
        try {
            return future.get(Math.max(1L, timeoutMs), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("協作者呼叫逾時: {} (>{}ms)", collaborator, timeoutMs);
            throw new CollaboratorTimeoutException(collaborator, "timeout after " + timeoutMs + "ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CollaboratorTimeoutException(collaborator, "interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.warn("協作者呼叫失敗: {}: {}", collaborator, cause.getMessage());
            throw new CollaboratorTimeoutException(collaborator, "failed: " + cause.getMessage(), cause);
        }
    }

    public <T> T call(String collaborator, Callable<T> task, long timeoutMs) throws CollaboratorTimeoutException {
        return await(collaborator, submit(collaborator, task), timeoutMs);
    }

    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
