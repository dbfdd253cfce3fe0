package com.driftindexer.ingestion.job;

import com.driftindexer.common.Base58;
import com.driftindexer.common.InvalidConfigurationException;
import com.driftindexer.config.SchedulerConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Runs {@link AccountIndexer#indexOnce} for one account at a fixed rate, first tick immediately. A fixed-rate
 * task never overlaps itself, so ticks of the same account are serialized; a slow tick delays the next one.
 */
@Component
@Slf4j
public class AccountPollScheduler {

    private static final int ACCOUNT_KEY_LENGTH = 32;

    private final AccountIndexer accountIndexer;
    private final TaskScheduler taskScheduler;

    public AccountPollScheduler(AccountIndexer accountIndexer,
                                @Qualifier(SchedulerConfig.POLL_SCHEDULER) TaskScheduler taskScheduler) {
        this.accountIndexer = accountIndexer;
        this.taskScheduler = taskScheduler;
    }

    /**
     * @return future that only completes, exceptionally, on a fatal error; transient tick failures are logged
     * and retried on the next tick. Cancelling it stops polling.
     */
    public CompletableFuture<Void> run(String account, Duration interval) {
        CompletableFuture<Void> termination = new CompletableFuture<>();
        if (account == null || !Base58.isValid(account, ACCOUNT_KEY_LENGTH)) {
            termination.completeExceptionally(new InvalidConfigurationException("Invalid account address: " + account));
            return termination;
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            termination.completeExceptionally(new InvalidConfigurationException("Poll interval must be positive: " + interval));
            return termination;
        }
        ScheduledFuture<?> task = taskScheduler.scheduleAtFixedRate(() -> tick(account, termination), interval);
        termination.whenComplete((ignored, error) -> task.cancel(false));
        log.info("Polling {} every {}s", account, interval.toSeconds());
        return termination;
    }

    private void tick(String account, CompletableFuture<Void> termination) {
        if (termination.isDone()) {
            return;
        }
        try {
            accountIndexer.indexOnce(account);
        } catch (InvalidConfigurationException e) {
            log.error("Stopping poller for {}: {}", account, e.getMessage());
            termination.completeExceptionally(e);
        } catch (RuntimeException e) {
            log.warn("Tick for {} failed, retrying on next tick: {}", account, e.getMessage(), e);
        }
    }
}
