package com.example.alerthistory.suppression;

import com.example.alerthistory.error.AlertHistoryException;
import com.example.alerthistory.error.StateStoreException;
import com.example.alerthistory.error.SuppressionTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs state store calls made on the query path on the suppression executor and waits no longer
 * than the caller's deadline. Store failures surface as {@link StateStoreException}, deadline expiry
 * as {@link SuppressionTimeoutException}; the call itself is interrupted on expiry.
 */
@Slf4j
@Component
public class StateStoreReader {

    private final AsyncTaskExecutor executor;

    public StateStoreReader(@Qualifier("suppressionExecutor") AsyncTaskExecutor executor) {
        this.executor = executor;
    }

    public <T> T read(QueryContext ctx, String operation, Supplier<T> read) {
        return call(ctx, operation, "read", read);
    }

    /**
     * A write made on behalf of a query. On expiry the caller gets its timeout while the write may
     * still complete on the executor.
     */
    public <T> T write(QueryContext ctx, String operation, Supplier<T> write) {
        return call(ctx, operation, "write", write);
    }

    private <T> T call(QueryContext ctx, String operation, String kind, Supplier<T> call) {
        ctx.checkDeadline(operation);

        Future<T> future;
        try {
            future = executor.submit(call::get);
        } catch (TaskRejectedException e) {
            throw new StateStoreException("Suppression executor saturated during " + operation, e);
        }

        try {
            return future.get(ctx.remainingNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.debug("Store {} {} exceeded its {}ms budget", kind, operation, ctx.getBudget().toMillis());
            throw new SuppressionTimeoutException(operation, ctx.getBudget());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SuppressionTimeoutException(operation, ctx.getBudget());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AlertHistoryException ahe) {
                throw ahe;
            }
            throw new StateStoreException("State store " + kind + " failed during " + operation + ": "
                    + (cause != null ? cause.getMessage() : e.getMessage()), cause != null ? cause : e);
        }
    }
}
