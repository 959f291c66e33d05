package com.continuum.relayer.ledger;

import com.continuum.relayer.exception.LedgerException;
import java.util.function.Predicate;

/**
 * Retry predicate for the {@code ledgerRead} Resilience4j instance: only transient ledger
 * failures are worth repeating. Referenced by class name from application.yml.
 */
public class TransientLedgerFailurePredicate implements Predicate<Throwable> {

    @Override
    public boolean test(Throwable throwable) {
        return throwable instanceof LedgerException ledgerException && ledgerException.isTransient();
    }
}
