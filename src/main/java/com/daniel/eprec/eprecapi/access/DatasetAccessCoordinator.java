package com.daniel.eprec.eprecapi.access;

import java.util.concurrent.Semaphore;

import org.springframework.stereotype.Component;

@Component
// One instance per application context. RefreshScheduler and CatalogQueryService get the same bean injected.

public class DatasetAccessCoordinator {

    /*
     * Global mutual exclusion over the on-disk snapshot:
     * - at most one holder at a time (a query or a refresh, never both),
     * - waiters are served in arrival order (fair semaphore),
     * - no reentrancy: a holder that calls acquire() again blocks itself.
     * A semaphore is used instead of a ReentrantLock because the ticket may be
     * released from a different thread than the one that acquired it.
     */
    private final Semaphore permit = new Semaphore(1, true);

    // Blocks (no spinning, no timeout) until the previous holder releases.
    public AccessTicket acquire() {
        permit.acquireUninterruptibly();
        return new AccessTicket(this);
    }

    public void release(AccessTicket ticket) {
        if (ticket == null || ticket.owner() != this) {
            throw new IllegalStateException("Ticket was not issued by this coordinator");
        }
        if (!ticket.markReleased()) {
            throw new IllegalStateException("Ticket already released");
        }
        permit.release();
    }

    // Used by AccessTicket.close(), which has already flipped its released flag.
    void releasePermit() {
        permit.release();
    }

    public boolean isHeld() {
        return permit.availablePermits() == 0;
    }
}
