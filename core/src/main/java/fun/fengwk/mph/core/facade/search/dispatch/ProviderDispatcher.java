package fun.fengwk.mph.core.facade.search.dispatch;

import fun.fengwk.mph.core.facade.search.SearchProperties;
import fun.fengwk.mph.core.provider.PriceProvider;
import fun.fengwk.mph.core.provider.RawOffer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded fan-out of provider fetches with a per-provider timeout.
 *
 * <p>Every search gets its own permit pool of {@code maxConcurrent} slots. The coordinator takes a slot
 * before starting each provider, in the given order, and the slot is returned once the fetch completes,
 * fails or times out. A timed-out fetch is cancelled and its offers are discarded, siblings keep running.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class ProviderDispatcher {

    private final int maxConcurrent;
    private final ExecutorService executor;

    @Autowired
    public ProviderDispatcher(SearchProperties searchProperties) {
        this(searchProperties.getMaxConcurrent());
    }

    public ProviderDispatcher(int maxConcurrent) {
        this(maxConcurrent, Executors.newCachedThreadPool(new ProviderThreadFactory()));
    }

    ProviderDispatcher(int maxConcurrent, ExecutorService executor) {
        this.maxConcurrent = Math.max(1, maxConcurrent);
        this.executor = executor;
    }

    /**
     * Run the providers and return one outcome per provider, in the given order.
     *
     * @throws IllegalStateException if the calling thread is interrupted while waiting
     */
    public List<ProviderOutcome> dispatch(List<PriceProvider> providers, String query, String country,
                                          long perProviderTimeoutMs) {
        if (providers.isEmpty()) {
            return List.of();
        }

        Semaphore slots = new Semaphore(maxConcurrent);
        List<Future<ProviderOutcome>> futures = new ArrayList<>(providers.size());
        try {
            for (PriceProvider provider : providers) {
                slots.acquire();
                try {
                    futures.add(executor.submit(() -> runInSlot(provider, query, country, perProviderTimeoutMs, slots)));
                } catch (RuntimeException ex) {
                    slots.release();
                    throw ex;
                }
            }

            List<ProviderOutcome> outcomes = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(awaitOutcome(futures.get(i), providers.get(i).getName()));
            }
            return outcomes;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            futures.forEach(future -> future.cancel(true));
            log.warn("search interrupted, dispatched={}, total={}", futures.size(), providers.size());
            throw new IllegalStateException("search interrupted", ex);
        }
    }

    private ProviderOutcome runInSlot(PriceProvider provider, String query, String country,
                                      long timeoutMs, Semaphore slots) {
        String name = provider.getName();
        long start = System.currentTimeMillis();
        Future<List<RawOffer>> fetch = null;
        try {
            fetch = executor.submit(() -> provider.fetch(query, country));
            List<RawOffer> offers = fetch.get(timeoutMs, TimeUnit.MILLISECONDS);
            long elapsed = System.currentTimeMillis() - start;
            log.info("provider finished, provider={}, offers={}, elapsedMs={}",
                name, offers == null ? 0 : offers.size(), elapsed);
            return ProviderOutcome.success(name, offers, elapsed);
        } catch (TimeoutException ex) {
            fetch.cancel(true);
            log.warn("provider timeout, provider={}, timeoutMs={}", name, timeoutMs);
            return ProviderOutcome.timeout(name, System.currentTimeMillis() - start);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.warn("provider fault, provider={}, error={}", name, cause.getMessage(), cause);
            return ProviderOutcome.failure(name, describe(cause), System.currentTimeMillis() - start);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            fetch.cancel(true);
            return ProviderOutcome.failure(name, "interrupted", System.currentTimeMillis() - start);
        } catch (RuntimeException ex) {
            log.warn("provider dispatch failed, provider={}, error={}", name, ex.getMessage(), ex);
            return ProviderOutcome.failure(name, describe(ex), System.currentTimeMillis() - start);
        } finally {
            slots.release();
        }
    }

    private ProviderOutcome awaitOutcome(Future<ProviderOutcome> future, String name) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.warn("provider slot failed, provider={}, error={}", name, cause.getMessage(), cause);
            return ProviderOutcome.failure(name, describe(cause), 0);
        }
    }

    private static String describe(Throwable throwable) {
        String message = throwable.getMessage();
        return message == null || message.isBlank() ? throwable.getClass().getSimpleName() : message;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }

    private static class ProviderThreadFactory implements ThreadFactory {

        private final AtomicInteger threadIdGen = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName("mph-provider-" + threadIdGen.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }

    }

}
