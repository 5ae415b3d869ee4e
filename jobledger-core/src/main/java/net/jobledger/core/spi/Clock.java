package net.jobledger.core.spi;

import java.time.Instant;

/** Time source for every timestamp the scheduler writes to the ledger. */
@FunctionalInterface
public interface Clock {
    Instant now();

    static Clock system() {
        return Instant::now;
    }
}
