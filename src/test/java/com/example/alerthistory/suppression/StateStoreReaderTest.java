package com.example.alerthistory.suppression;

import com.example.alerthistory.error.NotFoundException;
import com.example.alerthistory.error.StateStoreException;
import com.example.alerthistory.error.SuppressionTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class StateStoreReaderTest {

    private ThreadPoolTaskExecutor executor;
    private StateStoreReader reader;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.initialize();
        reader = new StateStoreReader(executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void returnsReadResult() {
        assertEquals("ok", reader.read(QueryContext.withTimeoutMillis(1000), "read", () -> "ok"));
    }

    @Test
    void slowReadTimesOutAndIsInterrupted() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);
        QueryContext ctx = QueryContext.withTimeoutMillis(50);

        SuppressionTimeoutException e = assertThrows(SuppressionTimeoutException.class, () ->
                reader.read(ctx, "slow read", () -> {
                    try {
                        Thread.sleep(5000);
                    } catch (InterruptedException ie) {
                        interrupted.countDown();
                    }
                    return "late";
                }));

        assertEquals("timeout", e.getCode());
        assertTrue(interrupted.await(2, TimeUnit.SECONDS), "read should be cancelled on timeout");
    }

    @Test
    void storeFailureBecomesStateStoreException() {
        StateStoreException e = assertThrows(StateStoreException.class, () ->
                reader.read(QueryContext.withTimeoutMillis(1000), "failing read", () -> {
                    throw new DataAccessResourceFailureException("connection refused");
                }));
        assertTrue(e.getMessage().contains("connection refused"));
    }

    @Test
    void engineExceptionsPassThrough() {
        assertThrows(NotFoundException.class, () ->
                reader.read(QueryContext.withTimeoutMillis(1000), "read", () -> {
                    throw new NotFoundException("silence", "x");
                }));
    }

    @Test
    void cancelledContextFailsBeforeReading() {
        QueryContext ctx = QueryContext.withTimeoutMillis(1000);
        ctx.cancel();
        assertThrows(SuppressionTimeoutException.class, () -> reader.read(ctx, "read", () -> "never"));
    }
}
