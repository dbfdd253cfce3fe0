package com.driftindexer.ingestion.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * What to index and how fast. page-size / poll-interval-seconds is the ceiling on transactions indexed per
 * second per account, and should be tuned together against the RPC provider's rate limit.
 */
@ConfigurationProperties(prefix = "driftindexer")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class IndexerProperties {

    public static final String DRIFT_PROGRAM_ID = "dRiftyHA39MWEi3m9aunc5MzRF1JYuBsbn6VPcn33UH";

    /** Base58 accounts to monitor; one poller each. */
    private List<String> accounts = new ArrayList<>();

    /** Program whose events are extracted; transactions not referencing it are skipped. */
    @NotBlank
    private String programId = DRIFT_PROGRAM_ID;

    @Min(1)
    private long pollIntervalSeconds = 3;

    /** Signatures requested per tick. */
    @Min(1)
    @Max(1000)
    private int pageSize = 3;

    private Store store = new Store();

    public void setAccounts(List<String> accounts) {
        List<String> trimmed = new ArrayList<>();
        if (accounts != null) {
            for (String account : accounts) {
                if (account != null && !account.isBlank()) {
                    trimmed.add(account.trim());
                }
            }
        }
        this.accounts = trimmed;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Store {

        /** mongo (default) or memory. */
        private String type = "mongo";
    }
}
