package com.continuum.relayer.oms;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The engine's local view of the last ledger sequence that reached a terminal outcome.
 *
 * <p>A cache of ledger-enforced ordering, not a source of truth: it is seeded from the ledger
 * at startup and only ever moves forward, one sequence at a time, when the engine settles the
 * next expected sequence.
 */
public class SequenceCursor {

    private static final Logger log = LoggerFactory.getLogger(SequenceCursor.class);

    private volatile long position;
    private volatile long ledgerHead;

    public SequenceCursor(long position) {
        if (position < 0) {
            throw new IllegalArgumentException("Cursor position cannot be negative: " + position);
        }
        this.position = position;
        this.ledgerHead = position;
    }

    /**
     * Records the ledger's current sequence.
     *
     * @return true when the ledger holds sequences past the cursor
     */
    public synchronized boolean observe(long ledgerCurrentSequence) {
        if (ledgerCurrentSequence < ledgerHead) {
            log.warn("Ledger sequence went backwards: observed={}, previous={}", ledgerCurrentSequence, ledgerHead);
        }
        ledgerHead = ledgerCurrentSequence;
        return ledgerCurrentSequence > position;
    }

    public long nextExpected() {
        return position + 1;
    }

    public synchronized void advance() {
        position = position + 1;
    }

    public long position() {
        return position;
    }

    public long ledgerHead() {
        return ledgerHead;
    }
}
