package com.driftindexer.ingestion.job;

import com.driftindexer.common.InvalidConfigurationException;
import com.driftindexer.domain.ProgramAddress;
import com.driftindexer.ingestion.config.IndexerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Starts one poller per configured account once the context is up and exposes the first fatal outcome
 * to the main thread.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IndexerLauncher implements ApplicationRunner {

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = 1;

    private final AccountPollScheduler accountPollScheduler;
    private final IndexerProperties indexerProperties;
    private final ProgramAddress programAddress;

    private final CompletableFuture<Object> termination = new CompletableFuture<>();

    @Override
    public void run(ApplicationArguments args) {
        start();
    }

    void start() {
        List<String> accounts = indexerProperties.getAccounts();
        if (accounts.isEmpty()) {
            termination.completeExceptionally(new InvalidConfigurationException(
                    "No accounts configured (driftindexer.accounts or --accounts)"));
            return;
        }
        Duration interval = Duration.ofSeconds(indexerProperties.getPollIntervalSeconds());
        log.info("Indexing program {} for {} account(s), page size {}, interval {}s",
                programAddress, accounts.size(),
                indexerProperties.getPageSize(), interval.toSeconds());

        List<CompletableFuture<Void>> pollers = new ArrayList<>(accounts.size());
        for (String account : accounts) {
            pollers.add(accountPollScheduler.run(account, interval));
        }
        CompletableFuture.anyOf(pollers.toArray(new CompletableFuture[0]))
                .whenComplete((result, error) -> {
                    pollers.forEach(p -> p.cancel(false));
                    if (error != null) {
                        termination.completeExceptionally(error);
                    } else {
                        termination.complete(result);
                    }
                });
    }

    /**
     * Blocks until a poller stops.
     *
     * @return process exit status
     */
    public int awaitTermination() {
        try {
            termination.join();
            return EXIT_OK;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Indexer stopped: {}", cause.getMessage(), cause);
            return EXIT_FATAL;
        } catch (CancellationException e) {
            log.error("Indexer stopped: poller cancelled");
            return EXIT_FATAL;
        }
    }
}
