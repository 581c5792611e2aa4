package com.skystack.pipeline.api;

import com.skystack.core.bus.EventBus;
import com.skystack.pipeline.config.AcquisitionConfig;

import java.time.Clock;
import java.util.Objects;

public record AcquisitionContext(
        ArchiveClient archiveClient,
        ExposureStacker stacker,
        ImageSmoother smoother,
        EventBus eventBus,
        Clock clock,
        AcquisitionConfig config
) {
    public AcquisitionContext {
        Objects.requireNonNull(archiveClient, "archiveClient is required");
        Objects.requireNonNull(stacker, "stacker is required");
        Objects.requireNonNull(smoother, "smoother is required");
        Objects.requireNonNull(eventBus, "eventBus is required");
        Objects.requireNonNull(clock, "clock is required");
        Objects.requireNonNull(config, "config is required");
    }
}
