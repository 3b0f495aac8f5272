package com.sermonarchive.collector.domain.dto;

import com.sermonarchive.collector.domain.enums.CandidateOutcome;
import com.sermonarchive.collector.domain.enums.IngestionStatus;

import java.util.UUID;

public record IngestionSummary(
        String correlationId,
        int candidates,
        int inserted,
        int skippedDuplicates,
        int failed,
        boolean cancelled,
        IngestionStatus status
) {

    public static IngestionSummary sourceUnavailable(UUID correlationId) {
        return new IngestionSummary(correlationId.toString(), 0, 0, 0, 0, false, IngestionStatus.SOURCE_UNAVAILABLE);
    }

    public static Builder builder(UUID correlationId) {
        return new Builder(correlationId.toString());
    }

    public static final class Builder {
        private final String correlationId;
        private int candidates;
        private int inserted;
        private int skippedDuplicates;
        private int failed;
        private boolean cancelled;

        private Builder(String correlationId) {
            this.correlationId = correlationId;
        }

        public Builder candidates(int candidates) {
            this.candidates = candidates;
            return this;
        }

        public Builder record(CandidateOutcome outcome) {
            switch (outcome) {
                case INSERTED -> inserted++;
                case DUPLICATE -> skippedDuplicates++;
                case FAILED -> failed++;
            }
            return this;
        }

        public Builder cancelled() {
            this.cancelled = true;
            return this;
        }

        public IngestionSummary build() {
            IngestionStatus status = (failed == 0 && !cancelled) ? IngestionStatus.SUCCESS : IngestionStatus.PARTIAL;
            return new IngestionSummary(correlationId, candidates, inserted, skippedDuplicates, failed, cancelled, status);
        }
    }
}
