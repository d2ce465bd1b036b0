package com.github.anirbanmu.kookbridge.kook;

import com.github.anirbanmu.kookbridge.log.Log;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot stop signal shared by a monitor, its supervisors and their sessions. Once cancelled it
 * stays cancelled; callbacks registered afterwards run immediately on the registering thread.
 */
public final class Cancellation {
    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Runnable> callbacks = new ArrayList<>();
    private boolean cancelled;

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    public void cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        latch.countDown();
        for (Runnable callback : toRun) {
            try {
                callback.run();
            } catch (RuntimeException ex) {
                Log.error("cancellation.callback_failed", ex);
            }
        }
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    public Registration onCancel(Runnable callback) {
        synchronized (this) {
            if (!cancelled) {
                callbacks.add(callback);
                return () -> remove(callback);
            }
        }
        callback.run();
        return () -> {
        };
    }

    private synchronized void remove(Runnable callback) {
        callbacks.remove(callback);
    }

    // true when cancelled before the wait ran out
    public boolean await(long millis) throws InterruptedException {
        return latch.await(millis, TimeUnit.MILLISECONDS);
    }
}
