package com.skystack.pipeline.acquisition;

import java.nio.file.Path;
import java.util.Objects;

public record FetchOutcome(Kind kind, AcquisitionState state, Path image, int exposureCount, String reason) {
    public enum Kind {
        SUCCESS,
        RETRYABLE,
        ABANDON,
        FATAL
    }

    public FetchOutcome {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(state, "state is required");
    }

    public static FetchOutcome success(Path image, int exposureCount) {
        return new FetchOutcome(Kind.SUCCESS, AcquisitionState.PERSISTED, image, exposureCount, null);
    }

    public static FetchOutcome retryable(AcquisitionState state, String reason) {
        return new FetchOutcome(Kind.RETRYABLE, state, null, 0, reason);
    }

    public static FetchOutcome abandon(AcquisitionState state, String reason) {
        return new FetchOutcome(Kind.ABANDON, state, null, 0, reason);
    }

    public static FetchOutcome fatal(AcquisitionState state, String reason) {
        return new FetchOutcome(Kind.FATAL, state, null, 0, reason);
    }

    public boolean succeeded() {
        return kind == Kind.SUCCESS;
    }
}
