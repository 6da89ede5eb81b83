package com.daniel.eprec.eprecapi.access;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

class DatasetAccessCoordinatorTests {

    // acquire/release toggles the held flag.
    @Test
    void acquireMarksCoordinatorHeldUntilRelease() {
        DatasetAccessCoordinator coordinator = new DatasetAccessCoordinator();
        AccessTicket ticket = coordinator.acquire();
        assertTrue(coordinator.isHeld());

        coordinator.release(ticket);
        assertFalse(coordinator.isHeld());
        assertTrue(ticket.isReleased());
    }

    // try-with-resources is the expected usage; it must release on exceptions as well.
    @Test
    void closeReleasesEvenWhenBodyThrows() {
        DatasetAccessCoordinator coordinator = new DatasetAccessCoordinator();
        assertThrows(IllegalArgumentException.class, () -> {
            try (AccessTicket ticket = coordinator.acquire()) {
                throw new IllegalArgumentException("boom");
            }
        });
        assertFalse(coordinator.isHeld());
    }

    // A second release would hand out a second permit, so it is rejected.
    @Test
    void releasingTwiceIsRejected() {
        DatasetAccessCoordinator coordinator = new DatasetAccessCoordinator();
        AccessTicket ticket = coordinator.acquire();
        coordinator.release(ticket);

        assertThrows(IllegalStateException.class, () -> coordinator.release(ticket));
        assertFalse(coordinator.isHeld());
    }

    // close() after an explicit release is a no-op.
    @Test
    void closeAfterReleaseDoesNothing() {
        DatasetAccessCoordinator coordinator = new DatasetAccessCoordinator();
        AccessTicket ticket = coordinator.acquire();
        coordinator.release(ticket);
        ticket.close();

        AccessTicket next = coordinator.acquire();
        assertTrue(coordinator.isHeld());
        next.close();
    }

    @Test
    void ticketFromAnotherCoordinatorIsRejected() {
        DatasetAccessCoordinator first = new DatasetAccessCoordinator();
        DatasetAccessCoordinator second = new DatasetAccessCoordinator();
        AccessTicket ticket = first.acquire();

        assertThrows(IllegalStateException.class, () -> second.release(ticket));
        assertTrue(first.isHeld());
        ticket.close();
    }

    // A waiting acquire stays blocked until the holder releases.
    @Test
    void acquireBlocksWhileAnotherHolderIsActive() throws Exception {
        DatasetAccessCoordinator coordinator = new DatasetAccessCoordinator();
        AccessTicket holder = coordinator.acquire();
        CountDownLatch acquired = new CountDownLatch(1);

        Thread waiter = new Thread(() -> {
            try (AccessTicket ticket = coordinator.acquire()) {
                acquired.countDown();
            }
        });
        waiter.start();

        assertFalse(acquired.await(200, TimeUnit.MILLISECONDS));
        holder.close();
        assertTrue(acquired.await(5, TimeUnit.SECONDS));
        waiter.join(5000);
        assertFalse(coordinator.isHeld());
    }

    // Many threads, one permit: never more than one holder inside the critical section.
    @Test
    void neverMoreThanOneHolderAtATime() throws Exception {
        DatasetAccessCoordinator coordinator = new DatasetAccessCoordinator();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                futures.add(pool.submit(() -> {
                    try (AccessTicket ticket = coordinator.acquire()) {
                        int now = inside.incrementAndGet();
                        maxInside.accumulateAndGet(now, Math::max);
                        Thread.yield();
                        inside.decrementAndGet();
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, maxInside.get());
        assertFalse(coordinator.isHeld());
    }
}
