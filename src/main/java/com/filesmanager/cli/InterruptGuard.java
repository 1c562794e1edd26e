package com.filesmanager.cli;

import com.filesmanager.config.Constants;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ctrl+C / kill 时置位取消标志，并等待正在执行的任务收尾后再让 JVM 退出。
 *
 * 任务收尾包括：放弃未重命名的复制、删除临时文件、写出最后一次缓存。
 */
final class InterruptGuard implements AutoCloseable {
    private final AtomicBoolean cancel;
    private final CountDownLatch finished = new CountDownLatch(1);
    private final Thread hook;
    private final boolean registered;

    InterruptGuard(AtomicBoolean cancel) {
        this.cancel = cancel;
        this.hook = new Thread(this::onShutdown, "fm-cancel");
        this.registered = register(hook);
    }

    private static boolean register(Thread hook) {
        try {
            Runtime.getRuntime().addShutdownHook(hook);
            return true;
        } catch (IllegalStateException | SecurityException exception) {
            // JVM 已在退出，或运行环境不允许注册钩子
            System.err.println("⚠️ 无法注册中断处理: " + exception.getMessage());
            return false;
        }
    }

    private void onShutdown() {
        cancel.set(true);
        System.err.println("⚠️ 收到中断信号 (" + Instant.now() + ")，正在等待进行中的操作结束...");
        try {
            finished.await(Constants.POOL_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
        }
    }

    boolean isRegistered() {
        return registered;
    }

    @Override
    public void close() {
        finished.countDown();
        if (!registered) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException exception) {
            // JVM 正在关闭，钩子已在运行，countDown 之后它会自行返回
            cancel.set(true);
        }
    }
}
