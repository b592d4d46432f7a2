package com.reliefx.orchestrator.pipeline;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs an external engine call with a hard deadline.
 *
 * The call executes on a separate thread; the stage worker waits at most
 * {@code timeout}. Exceeding it cancels the call and is reported exactly like
 * an engine error: as {@link ExternalFunctionException}.
 */
@Component
public class EngineCallRunner {

    private final ExecutorService calls;
    private final MeterRegistry   meterRegistry;

    public EngineCallRunner(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        AtomicInteger seq = new AtomicInteger();
        this.calls = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "engine-call-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * @param engine  name used in errors and the {@code reliefx.engine.calls} timer
     * @throws ExternalFunctionException on failure or timeout
     * @throws IllegalStateException     if the waiting thread is interrupted (shutdown);
     *                                   the claim is left for the stalled-claim reaper
     */
    public <T> T call(String engine, Duration timeout, Callable<T> call) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        Future<T> future = calls.submit(call);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            outcome = "timeout";
            future.cancel(true);
            throw new ExternalFunctionException(engine + " timed out after " + timeout, e);
        } catch (ExecutionException e) {
            outcome = "error";
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ExternalFunctionException(engine + " failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            outcome = "interrupted";
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException(engine + " call interrupted", e);
        } finally {
            sample.stop(meterRegistry.timer("reliefx.engine.calls", "engine", engine, "outcome", outcome));
        }
    }

    @PreDestroy
    void shutdown() {
        calls.shutdownNow();
    }
}
