package com.walkforage.core.synchronization;

import com.walkforage.core.domain.session.GameSession;
import com.walkforage.core.infrastructure.CoreConfig;

import java.util.Objects;
import java.util.concurrent.*;
import java.util.function.Function;

/**
 * Single writer for one {@link GameSession}.
 *
 * Every unlock, craft or inventory change for the session runs on one dedicated thread,
 * so a validate-then-apply sequence never interleaves with another one.
 */
public final class SessionCommandQueue implements AutoCloseable {

    private final GameSession session;
    private final ExecutorService writer;
    private final long shutdownSeconds;

    public SessionCommandQueue(GameSession session) {
        this(session, CoreConfig.getInt("session.queue.shutdownSeconds", 2));
    }

    public SessionCommandQueue(GameSession session, long shutdownSeconds) {
        this.session = Objects.requireNonNull(session, "session");
        this.shutdownSeconds = Math.max(0, shutdownSeconds);

        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "wf-session-writer");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Queues a command. The future completes with its result, or exceptionally with whatever it threw.
     *
     * @throws RejectedExecutionException once the queue is closed
     */
    public <T> CompletableFuture<T> submit(Function<GameSession, T> command) {
        Objects.requireNonNull(command, "command");
        return CompletableFuture.supplyAsync(() -> command.apply(session), writer);
    }

    public boolean isClosed() {
        return writer.isShutdown();
    }

    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(shutdownSeconds, TimeUnit.SECONDS)) {
                System.err.println("⚠️ [SessionQueue] Commands still pending after " + shutdownSeconds
                        + "s for session " + session.getSessionId() + ", forcing shutdown");
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
