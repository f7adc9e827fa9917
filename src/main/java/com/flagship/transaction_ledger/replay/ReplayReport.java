package com.flagship.transaction_ledger.replay;

import lombok.Value;

/**
 * Outcome counts of one replay.
 */
@Value
public class ReplayReport {
    long applied;
    long rejected;
    long skipped;
    int accounts;
}
