package com.xcpradar.ingestion.job;

import com.xcpradar.common.RetryPolicy;
import com.xcpradar.config.AsyncConfig;
import com.xcpradar.config.SchedulerConfig;
import com.xcpradar.domain.Transaction;
import com.xcpradar.domain.TransactionNotifier;
import com.xcpradar.ingestion.adapter.LedgerClient;
import com.xcpradar.ingestion.adapter.LedgerEvent;
import com.xcpradar.ingestion.classifier.MarketEventClassifier;
import com.xcpradar.ingestion.config.IngestionAdapterConfig;
import com.xcpradar.ingestion.config.MonitorProperties;
import com.xcpradar.ingestion.filter.MarketEventAdmission;
import com.xcpradar.ingestion.store.TransactionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Polls the ledger for market activity from an in-memory block cursor, stores each new event once and
 * hands freshly stored transactions to the {@link TransactionNotifier}.
 * <p>
 * The cursor starts at the ledger height read on {@link #start()} (no backfill) and only moves forward,
 * to one past the highest block seen in a successful cycle. A cycle that fails in fetch or storage leaves
 * the cursor untouched so the next tick re-reads the same range; dedup on tx hash makes that safe.
 */
@Slf4j
@Component
public class TransactionMonitor {

    private final LedgerClient ledgerClient;
    private final TransactionStore store;
    private final MarketEventAdmission admission;
    private final MarketEventClassifier classifier;
    private final TransactionNotifier notifier;
    private final MonitorProperties properties;
    private final RetryPolicy startupRetryPolicy;
    private final TaskScheduler scheduler;
    private final Executor fetchExecutor;
    private final Clock clock;

    private final AtomicLong cursor = new AtomicLong();
    private final AtomicLong completedCycles = new AtomicLong();
    private final AtomicLong failedCycles = new AtomicLong();
    private volatile MonitorState state = MonitorState.NOT_STARTED;
    private volatile ScheduledFuture<?> schedule;
    private volatile Instant lastPollTime;
    private volatile Instant lastTransactionTime;

    public TransactionMonitor(
            LedgerClient ledgerClient,
            TransactionStore store,
            MarketEventAdmission admission,
            MarketEventClassifier classifier,
            TransactionNotifier notifier,
            MonitorProperties properties,
            @Qualifier(IngestionAdapterConfig.STARTUP_RETRY_POLICY) RetryPolicy startupRetryPolicy,
            @Qualifier(SchedulerConfig.SCHEDULER_POOL) TaskScheduler scheduler,
            @Qualifier(AsyncConfig.LEDGER_FETCH_EXECUTOR) Executor fetchExecutor,
            Clock clock
    ) {
        this.ledgerClient = ledgerClient;
        this.store = store;
        this.admission = admission;
        this.classifier = classifier;
        this.notifier = notifier;
        this.properties = properties;
        this.startupRetryPolicy = startupRetryPolicy;
        this.scheduler = scheduler;
        this.fetchExecutor = fetchExecutor;
        this.clock = clock;
    }

    /**
     * Reads the current ledger height (with backoff), sets the cursor to it and schedules polling at a
     * fixed rate, first tick immediately. No-op when already starting or running.
     *
     * @throws MonitorStartupException when the height cannot be read within the retry budget
     */
    public synchronized void start() {
        if (state == MonitorState.RUNNING || state == MonitorState.STARTING) {
            log.debug("Monitor already {}", state);
            return;
        }
        state = MonitorState.STARTING;
        long height;
        try {
            height = resolveStartHeight();
        } catch (MonitorStartupException e) {
            state = MonitorState.STOPPED;
            throw e;
        }
        cursor.set(height);
        state = MonitorState.RUNNING;
        Duration interval = Duration.ofSeconds(Math.max(1, properties.getPollIntervalSeconds()));
        schedule = scheduler.scheduleAtFixedRate(this::runScheduledCycle, clock.instant(), interval);
        log.info("Transaction monitor started at block {} (poll every {}s, dex {})",
                height, interval.toSeconds(), properties.isDexEnabled() ? "on" : "off");
    }

    /**
     * Stops scheduling further cycles. A cycle already running finishes. Idempotent.
     */
    public synchronized void stop() {
        MonitorState previous = state;
        state = MonitorState.STOPPED;
        ScheduledFuture<?> current = schedule;
        schedule = null;
        if (current != null) {
            current.cancel(false);
        }
        if (previous == MonitorState.RUNNING) {
            log.info("Transaction monitor stopped at block {}", cursor.get());
        }
    }

    /**
     * Runs one cycle: fetch all categories from the cursor, admit, dedup, classify, store, notify, advance.
     *
     * @throws RuntimeException from the ledger or the store; the cursor is not advanced in that case
     */
    public PollCycleResult pollOnce() {
        lastPollTime = clock.instant();
        long from = cursor.get();
        try {
            List<LedgerEvent> sales = new ArrayList<>();
            List<LedgerEvent> listings = new ArrayList<>();
            fetch(from, sales, listings);

            int salesStored = 0;
            for (LedgerEvent event : sales) {
                if (process(event)) {
                    salesStored++;
                }
            }
            int listingsStored = 0;
            for (LedgerEvent event : listings) {
                if (process(event)) {
                    listingsStored++;
                }
            }

            long maxBlock = -1L;
            for (LedgerEvent event : sales) {
                maxBlock = Math.max(maxBlock, event.blockIndex());
            }
            for (LedgerEvent event : listings) {
                maxBlock = Math.max(maxBlock, event.blockIndex());
            }
            long next = maxBlock >= 0 ? maxBlock + 1 : from;
            long advanced = cursor.accumulateAndGet(next, Math::max);
            completedCycles.incrementAndGet();
            log.info("Market poll from block {}: {} events, {} sales and {} listings stored, cursor {}",
                    from, sales.size() + listings.size(), salesStored, listingsStored, advanced);
            return new PollCycleResult(from, advanced, sales.size() + listings.size(), salesStored, listingsStored);
        } catch (RuntimeException e) {
            failedCycles.incrementAndGet();
            throw e;
        }
    }

    public MonitorHealth getHealthStatus() {
        return new MonitorHealth(
                state,
                cursor.get(),
                lastPollTime,
                lastTransactionTime,
                properties.getPollIntervalSeconds(),
                completedCycles.get(),
                failedCycles.get());
    }

    public MonitorState getState() {
        return state;
    }

    public long getCursor() {
        return cursor.get();
    }

    void runScheduledCycle() {
        if (state != MonitorState.RUNNING) {
            return;
        }
        try {
            pollOnce();
        } catch (RuntimeException e) {
            log.error("Market poll from block {} failed; will retry next cycle", cursor.get(), e);
        }
    }

    private long resolveStartHeight() {
        RuntimeException lastError = null;
        for (int attempt = 0; attempt < startupRetryPolicy.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                startupRetryPolicy.backoff(attempt - 1);
            }
            try {
                return ledgerClient.currentHeight();
            } catch (RuntimeException e) {
                lastError = e;
                log.warn("Reading ledger height failed (attempt {}/{}): {}",
                        attempt + 1, startupRetryPolicy.getMaxAttempts(), e.getMessage());
            }
        }
        throw new MonitorStartupException("Could not read ledger height after "
                + startupRetryPolicy.getMaxAttempts() + " attempts", lastError);
    }

    private void fetch(long from, List<LedgerEvent> sales, List<LedgerEvent> listings) {
        boolean dex = properties.isDexEnabled();
        CompletableFuture<? extends List<? extends LedgerEvent>> dispenses = async(() -> ledgerClient.listSales(from));
        CompletableFuture<? extends List<? extends LedgerEvent>> dispensers = async(() -> ledgerClient.listListings(from));
        CompletableFuture<? extends List<? extends LedgerEvent>> matches = dex
                ? async(() -> ledgerClient.listOrderMatches(from))
                : CompletableFuture.completedFuture(List.of());
        CompletableFuture<? extends List<? extends LedgerEvent>> orders = dex
                ? async(() -> ledgerClient.listOrders(from))
                : CompletableFuture.completedFuture(List.of());
        try {
            CompletableFuture.allOf(dispenses, dispensers, matches, orders).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
        sales.addAll(dispenses.join());
        sales.addAll(matches.join());
        listings.addAll(dispensers.join());
        listings.addAll(orders.join());
        sales.sort(Comparator.comparingLong(LedgerEvent::blockIndex));
        listings.sort(Comparator.comparingLong(LedgerEvent::blockIndex));
    }

    private <T extends LedgerEvent> CompletableFuture<List<T>> async(Supplier<List<T>> call) {
        return CompletableFuture.supplyAsync(call, fetchExecutor);
    }

    /**
     * Returns true when the event produced a new row.
     */
    private boolean process(LedgerEvent event) {
        if (!admission.admits(event)) {
            return false;
        }
        if (store.exists(event.txHash())) {
            log.debug("Already stored {}", event.txHash());
            return false;
        }
        Optional<Transaction> classified;
        try {
            classified = classifier.classify(event);
        } catch (RuntimeException e) {
            log.warn("Could not classify {} {}: {}", event.getClass().getSimpleName(), event.txHash(), e.getMessage());
            return false;
        }
        if (classified.isEmpty()) {
            return false;
        }
        Transaction transaction = classified.get();
        if (!store.insert(transaction)) {
            log.debug("Lost insert race for {}", transaction.getTxHash());
            return false;
        }
        lastTransactionTime = clock.instant();
        log.debug("Stored {} {} x{} at block {}", transaction.getType(), transaction.getAsset(),
                transaction.getAmount(), transaction.getBlockIndex());
        try {
            notifier.publish(transaction);
        } catch (RuntimeException e) {
            log.error("Notification for {} failed", transaction.getTxHash(), e);
        }
        return true;
    }
}
