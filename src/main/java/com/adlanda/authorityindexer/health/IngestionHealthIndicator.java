package com.adlanda.authorityindexer.health;

import com.adlanda.authorityindexer.model.IngestionSummary;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Health indicator for the ingestion process.
 *
 * Reports the status of the last ingestion run, including:
 * - Whether it completed, was cancelled or failed
 * - Documents, chunks, batches and tokens processed
 * - Estimated embedding cost
 * - Error details if the run failed
 */
@Component
public class IngestionHealthIndicator implements HealthIndicator {

    private final AtomicReference<HealthState> state = new AtomicReference<>(
            new HealthState(true, null, null, null)
    );

    /**
     * Marks the ingestion as healthy with the given summary.
     */
    public void markHealthy(IngestionSummary summary) {
        state.set(new HealthState(true, summary, null, Instant.now()));
    }

    /**
     * Marks the ingestion as unhealthy with the given error message.
     */
    public void markUnhealthy(String error) {
        state.set(new HealthState(false, null, error, Instant.now()));
    }

    @Override
    public Health health() {
        HealthState current = state.get();

        if (current.healthy()) {
            Health.Builder builder = Health.up()
                    .withDetail("lastRun", current.timestamp() != null ? current.timestamp().toString() : "never");

            if (current.summary() != null) {
                IngestionSummary summary = current.summary();
                builder.withDetail("documents", summary.documents())
                       .withDetail("chunks", summary.chunks())
                       .withDetail("batches", summary.batches())
                       .withDetail("tokens", summary.tokens())
                       .withDetail("estimatedCostUsd", summary.estimatedCostUsd())
                       .withDetail("cancelled", summary.cancelled());
            }

            return builder.build();
        }

        return Health.down()
                .withDetail("error", current.error())
                .withDetail("lastAttempt", current.timestamp() != null ? current.timestamp().toString() : "never")
                .build();
    }

    private record HealthState(
            boolean healthy,
            IngestionSummary summary,
            String error,
            Instant timestamp
    ) {}
}
