package com.daniel.eprec.eprecapi.sync;

@FunctionalInterface
public interface RefreshOutcomeListener {

    void onRefreshOutcome(RefreshOutcome outcome);
}
