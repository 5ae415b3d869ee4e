package net.jobledger.core.spi;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Body of a recurring job.
 * <p>
 * The returned stage signals completion; an exceptionally completed stage or an exception
 * thrown from {@link #execute()} counts as a failed run. Handlers must tolerate being skipped
 * for a cycle and must not assume they are the only process that ever runs them, only that
 * they never run concurrently with themselves.
 */
@FunctionalInterface
public interface JobHandler {
    CompletionStage<Void> execute() throws Exception;

    /** Adapts a synchronous body. */
    static JobHandler blocking(Body body) {
        return () -> {
            body.run();
            return CompletableFuture.completedFuture(null);
        };
    }

    @FunctionalInterface
    interface Body {
        void run() throws Exception;
    }
}
