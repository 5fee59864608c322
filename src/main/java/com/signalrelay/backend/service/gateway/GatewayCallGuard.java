package com.signalrelay.backend.service.gateway;

import com.signalrelay.backend.config.TradingProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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
 * Runs exchange calls with an upper time bound so a hung venue cannot pin an instrument lock.
 */
@Component
public class GatewayCallGuard {

    private static final Logger logger = LoggerFactory.getLogger(GatewayCallGuard.class);

    private final Duration timeout;
    private final ExecutorService executor;

    public GatewayCallGuard(TradingProperties tradingProperties) {
        this.timeout = tradingProperties.getGatewayTimeout();
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "gateway-call-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public <T> T call(String operation, Callable<T> call) {
        Future<T> future = executor.submit(call);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.warn("{} timed out after {} ms", operation, timeout.toMillis());
            throw GatewayException.unavailable(operation + " timed out after " + timeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw GatewayException.unavailable(operation + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof GatewayException) {
                throw (GatewayException) cause;
            }
            throw GatewayException.unavailable(operation + " failed: " + cause.getMessage(), cause);
        }
    }

    public void run(String operation, Runnable call) {
        call(operation, () -> {
            call.run();
            return null;
        });
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
