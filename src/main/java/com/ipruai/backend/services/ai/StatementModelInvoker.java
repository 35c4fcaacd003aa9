package com.ipruai.backend.services.ai;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import com.ipruai.backend.config.ModelProperties;
import com.ipruai.backend.services.emails.parsers.NormalizedText;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs statistical classifier calls on a bounded pool with a hard timeout, so no request can
 * block on the model for longer than {@code ipruai.model.timeout-ms}.
 */
@Slf4j
@Component
public class StatementModelInvoker {

    private final StatementModelClient client;
    private final Executor executor;
    private final long timeoutMs;

    public StatementModelInvoker(StatementModelClient client,
                                 @Qualifier("statementModelExecutor") Executor executor,
                                 ModelProperties modelProperties) {
        this.client = client;
        this.executor = executor;
        this.timeoutMs = Math.max(1, modelProperties.getTimeoutMs());
    }

    public boolean isAvailable() {
        return client.isAvailable();
    }

    public String modelVersion() {
        return client.version();
    }

    /**
     * @throws StatementModelException on unavailability, timeout, saturation or model failure
     */
    public ModelPrediction invoke(NormalizedText text) {
        if (!client.isAvailable()) {
            throw StatementModelException.unavailable(client.version());
        }

        CompletableFuture<ModelPrediction> future;
        try {
            future = CompletableFuture.supplyAsync(() -> client.predict(text), executor);
        } catch (RejectedExecutionException e) {
            throw new StatementModelException("statement model executor saturated", false, true, e);
        }

        try {
            ModelPrediction prediction = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (prediction == null) {
                throw new StatementModelException("statement model returned no prediction");
            }
            return prediction;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[StatementModel] Timed out after {}ms", timeoutMs);
            throw StatementModelException.timeout(timeoutMs);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StatementModelException("interrupted while waiting for statement model", false, false, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StatementModelException sme) {
                throw sme;
            }
            throw new StatementModelException("statement model failed: " + cause, false, false, cause);
        }
    }
}
