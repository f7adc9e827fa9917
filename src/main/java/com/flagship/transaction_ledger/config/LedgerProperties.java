package com.flagship.transaction_ledger.config;

import com.flagship.transaction_ledger.ledger.DuplicateTransactionPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "ledger")
@Data
public class LedgerProperties {

    /**
     * What to do when a deposit or withdrawal reuses a transaction id
     */
    private DuplicateTransactionPolicy duplicatePolicy = DuplicateTransactionPolicy.OVERWRITE;

    /**
     * Reject dispute/resolve/chargeback records whose client does not own the transaction
     */
    private boolean verifyClientOwnership = false;

    private Input input = new Input();

    private Output output = new Output();

    @Data
    public static class Input {

        /**
         * Skip the first CSV row
         */
        private boolean hasHeader = true;
    }

    @Data
    public static class Output {

        /**
         * PER_TRANSACTION: one summary row per applied record
         * FINAL_SNAPSHOT: one row per account once the replay is done
         */
        private OutputMode mode = OutputMode.PER_TRANSACTION;
    }

    public enum OutputMode {
        PER_TRANSACTION, FINAL_SNAPSHOT
    }
}
