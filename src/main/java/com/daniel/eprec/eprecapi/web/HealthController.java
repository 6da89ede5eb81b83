package com.daniel.eprec.eprecapi.web;

import java.time.Instant;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.daniel.eprec.eprecapi.access.DatasetAccessCoordinator;
import com.daniel.eprec.eprecapi.sync.RefreshScheduler;

@RestController
public class HealthController {

    private final RefreshScheduler refreshScheduler;
    private final DatasetAccessCoordinator coordinator;

    public HealthController(RefreshScheduler refreshScheduler, DatasetAccessCoordinator coordinator) {
        this.refreshScheduler = refreshScheduler;
        this.coordinator = coordinator;
    }

    @GetMapping("/health")
    public String health() {
        return "OK";
    }

    // Last refresh cycle as seen by the scheduler; PENDING until the first cycle finishes.
    @GetMapping("/health/refresh")
    public RefreshStatus refresh() {
        return refreshScheduler.lastOutcome()
                .map(outcome -> new RefreshStatus(
                        outcome.status().name(),
                        outcome.reason(),
                        outcome.finishedAt(),
                        coordinator.isHeld()))
                .orElseGet(() -> new RefreshStatus("PENDING", null, null, coordinator.isHeld()));
    }

    public record RefreshStatus(
            String status,
            String reason,
            Instant finishedAt,
            boolean datasetLocked) {
    }
}
// Quick checks that routing is wired and the background refresh is alive.
