package com.daniel.eprec.eprecapi.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
// Operational record of every refresh cycle. Failures are only logged; the next cycle is the retry.

public class LoggingRefreshOutcomeListener implements RefreshOutcomeListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingRefreshOutcomeListener.class);

    @Override
    public void onRefreshOutcome(RefreshOutcome outcome) {
        if (outcome.isFailure()) {
            log.warn("Dataset refresh failed, keeping current snapshot: {}", outcome.reason());
        } else {
            log.info("Dataset refresh {}: {}", outcome.status(), outcome.reason());
        }
    }
}
