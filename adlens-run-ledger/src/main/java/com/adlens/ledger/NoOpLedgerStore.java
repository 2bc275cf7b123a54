package com.adlens.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** LedgerStore used when ledger persistence is disabled. Logs so users see the ledger path was hit. */
public final class NoOpLedgerStore implements LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(NoOpLedgerStore.class);

    @Override
    public void save(RunLedger ledger) {
        log.info("Ledger (no-op): save | runId={} | errors={} | tasksExecuted={} | persistence disabled",
                ledger.getRunId(), ledger.getErrors().size(), ledger.getTasksExecuted().size());
    }
}
