package com.daniel.eprec.eprecapi.access;

import java.util.concurrent.atomic.AtomicBoolean;

// Opaque proof of exclusive access. Use with try-with-resources so every exit path releases.
public final class AccessTicket implements AutoCloseable {

    private final DatasetAccessCoordinator owner;
    private final AtomicBoolean released = new AtomicBoolean(false);

    AccessTicket(DatasetAccessCoordinator owner) {
        this.owner = owner;
    }

    DatasetAccessCoordinator owner() {
        return owner;
    }

    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        // close() after an explicit release(ticket) is a no-op, a second release(ticket) is not.
        if (markReleased()) {
            owner.releasePermit();
        }
    }
}
