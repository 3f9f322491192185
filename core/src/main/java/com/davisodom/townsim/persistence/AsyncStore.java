package com.davisodom.townsim.persistence;

import com.davisodom.townsim.obs.Metrics;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fire-and-forget access to a {@link StateStore}.
 *
 * Work runs on the given executor, never on the caller. Failures are logged, counted as
 * {@code store.failures} and turned into the fallback value; nothing is rethrown. With no store
 * configured every call completes immediately.
 */
public class AsyncStore {

    private static final Logger LOGGER = Logger.getLogger(AsyncStore.class.getName());

    @FunctionalInterface
    public interface StoreTask {
        void run(StateStore store) throws IOException;
    }

    @FunctionalInterface
    public interface StoreQuery<T> {
        T run(StateStore store) throws IOException;
    }

    private final StateStore store;
    private final Executor executor;
    private final Metrics metrics;

    public AsyncStore(StateStore store, Executor executor, Metrics metrics) {
        this.store = store;
        this.executor = executor;
        this.metrics = metrics;
    }

    public static AsyncStore disabled(Metrics metrics) {
        return new AsyncStore(null, Runnable::run, metrics);
    }

    public boolean isEnabled() {
        return store != null;
    }

    public StateStore getStore() {
        return store;
    }

    public CompletableFuture<Void> write(String description, StoreTask task) {
        if (store == null) {
            return CompletableFuture.completedFuture(null);
        }
        return CompletableFuture.runAsync(() -> {
            try {
                task.run(store);
            } catch (IOException e) {
                throw new CompletionException(e);
            }
        }, executor).exceptionally(e -> {
            fail(description, e);
            return null;
        });
    }

    public <T> CompletableFuture<T> read(String description, StoreQuery<T> query, T fallback) {
        if (store == null) {
            return CompletableFuture.completedFuture(fallback);
        }
        return CompletableFuture.supplyAsync(() -> {
            try {
                return query.run(store);
            } catch (IOException e) {
                throw new CompletionException(e);
            }
        }, executor).exceptionally(e -> {
            fail(description, e);
            return fallback;
        });
    }

    private void fail(String description, Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        metrics.increment("store.failures");
        LOGGER.log(Level.WARNING, "[STORE] " + description + " failed: " + cause.getMessage(), cause);
    }
}
