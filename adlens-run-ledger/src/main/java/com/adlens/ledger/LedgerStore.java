package com.adlens.ledger;

import java.io.IOException;

/**
 * Write-only sink for a finished run ledger. {@link RunLedger#persist(LedgerStore)} wraps calls so a store failure
 * never fails the run.
 */
public interface LedgerStore {

    void save(RunLedger ledger) throws IOException;
}
