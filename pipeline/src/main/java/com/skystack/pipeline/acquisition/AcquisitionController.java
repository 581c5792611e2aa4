package com.skystack.pipeline.acquisition;

import com.skystack.core.events.AcquisitionAttemptFailed;
import com.skystack.core.events.AcquisitionAttemptStarted;
import com.skystack.core.events.AlertRaised;
import com.skystack.core.events.CompositePersisted;
import com.skystack.core.model.CelestialLocation;
import com.skystack.core.model.ExposureGroup;
import com.skystack.core.model.ExposureRecord;
import com.skystack.core.model.VisitedLocations;
import com.skystack.pipeline.api.AcquisitionContext;
import com.skystack.pipeline.api.ArchiveQuery;
import com.skystack.pipeline.api.InvalidQueryException;
import com.skystack.pipeline.config.AcquisitionConfig;
import com.skystack.pipeline.config.AcquisitionMode;
import com.skystack.pipeline.contrast.ContrastEnhancer;
import com.skystack.pipeline.geometry.GeometryNormalizer;
import com.skystack.pipeline.image.ImageProcessingException;
import com.skystack.pipeline.image.PixelBuffer;
import com.skystack.pipeline.sampling.LocationSampler;
import com.skystack.pipeline.selection.ExposureSelection;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

public class AcquisitionController {
    private static final Logger LOGGER = Logger.getLogger(AcquisitionController.class.getName());

    private final AcquisitionContext ctx;
    private final AcquisitionConfig config;
    private final LocationSampler sampler;
    private final GeometryNormalizer normalizer;
    private final ContrastEnhancer enhancer;
    private final ScratchDirectory scratch;
    private final CompositeImageStore store;

    public AcquisitionController(AcquisitionContext ctx, LocationSampler sampler) {
        this.ctx = Objects.requireNonNull(ctx, "ctx is required");
        this.sampler = Objects.requireNonNull(sampler, "sampler is required");
        this.config = ctx.config();
        if (config.mode() == AcquisitionMode.ALL_SKY) {
            throw new IllegalArgumentException("ALL_SKY runs are handled by AllSkySweep, not the acquisition loop");
        }
        this.normalizer = new GeometryNormalizer(config.whiteLevel());
        this.enhancer = new ContrastEnhancer();
        this.scratch = new ScratchDirectory(config.scratchPath());
        this.store = new CompositeImageStore(config.outputPath());
    }

    public AcquisitionReport run() {
        return run(config.imageCount());
    }

    public AcquisitionReport run(int imageCount) {
        if (imageCount < 0) {
            throw new IllegalArgumentException("imageCount must not be negative: " + imageCount);
        }
        scratch.create();
        VisitedLocations visited = VisitedLocations.empty();
        List<Path> images = new ArrayList<>();
        int attempts = 0;
        int retries = 0;
        int abandoned = 0;

        for (int imageIndex = 0; imageIndex < imageCount; imageIndex++) {
            CelestialLocation location = sampler.next(visited);
            int attempt = 0;
            while (true) {
                attempt++;
                attempts++;
                LOGGER.info("Image " + (imageIndex + 1) + "/" + imageCount + " attempt " + attempt + " at " + location);
                ctx.eventBus().publish(new AcquisitionAttemptStarted(ctx.clock().instant(), location, imageIndex, attempt));
                FetchOutcome outcome = fetch(location, images.size());
                if (outcome.succeeded()) {
                    visited = visited.with(location);
                    images.add(outcome.image());
                    LOGGER.info("Image " + (imageIndex + 1) + "/" + imageCount + " written to " + outcome.image());
                    break;
                }

                scratch.purge();
                LOGGER.log(outcome.kind() == FetchOutcome.Kind.FATAL ? Level.SEVERE : Level.WARNING,
                        outcome.kind() + " in " + outcome.state() + " at " + location + ": " + outcome.reason());
                ctx.eventBus().publish(new AcquisitionAttemptFailed(
                        ctx.clock().instant(),
                        location,
                        outcome.kind().name(),
                        outcome.state().name(),
                        outcome.reason()
                ));

                if (outcome.kind() == FetchOutcome.Kind.FATAL) {
                    ctx.eventBus().publish(new AlertRaised(
                            ctx.clock().instant(),
                            "acquisition",
                            "Acquisition stopped: " + outcome.reason(),
                            Map.of("location", location.fileKey(), "state", outcome.state().name())
                    ));
                    throw new AcquisitionAbortedException(
                            "Invalid archive query at " + location + ": " + outcome.reason(), location, images.size(), null);
                }
                if (outcome.kind() == FetchOutcome.Kind.RETRYABLE) {
                    retries++;
                    pause(location, images.size());
                } else {
                    abandoned++;
                    location = sampler.next(visited);
                    attempt = 0;
                }
            }
        }
        return new AcquisitionReport(images, visited, attempts, retries, abandoned);
    }

    FetchOutcome fetch(CelestialLocation location, int completedImages) {
        Instant startedAt = ctx.clock().instant();
        AcquisitionState state = AcquisitionState.QUERYING;
        try {
            scratch.purge();
            List<ExposureRecord> records = ctx.archiveClient().query(queryFor(location));
            if (records.isEmpty()) {
                return FetchOutcome.abandon(state, "EmptySearch: no exposures near " + location);
            }

            state = AcquisitionState.GROUPING;
            List<ExposureGroup> groups = ExposureSelection.group(records);

            state = AcquisitionState.SELECTING;
            if (config.mode() == AcquisitionMode.PREPROCESSED) {
                return fetchPreprocessed(location, groups.get(0), startedAt);
            }
            ExposureGroup selected = ExposureSelection.selectLargest(groups).orElseThrow();
            if (selected.size() < config.minExposures()) {
                return FetchOutcome.abandon(state, "NotEnoughExposures: largest group at " + selected.location()
                        + " has " + selected.size() + " of " + config.minExposures());
            }

            List<Path> exposures = new ArrayList<>(selected.size());
            for (int index = 0; index < selected.size(); index++) {
                state = AcquisitionState.DOWNLOADING;
                Path exposure = scratch.exposurePath(index);
                download(selected.urls().get(index), exposure);
                exposures.add(exposure);

                state = AcquisitionState.NORMALIZING;
                normalizer.straighten(exposure);
            }

            state = AcquisitionState.STACKING;
            PixelBuffer composite = stack(exposures);

            state = AcquisitionState.ENHANCING;
            PixelBuffer enhanced = enhancer.equalize(smooth(composite));

            state = AcquisitionState.PERSISTED;
            Path image = store.write(selected.location(), enhanced);
            publishPersisted(location, selected.location(), image, selected.size(), startedAt);
            return FetchOutcome.success(image, selected.size());
        } catch (InvalidQueryException e) {
            return FetchOutcome.fatal(state, rootMessage(e));
        } catch (IOException e) {
            return FetchOutcome.retryable(state, rootMessage(e));
        } catch (ImageProcessingException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
            return FetchOutcome.abandon(state, rootMessage(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AcquisitionAbortedException("Interrupted while acquiring " + location, location, completedImages, e);
        }
    }

    ArchiveQuery queryFor(CelestialLocation location) {
        return new ArchiveQuery(
                location,
                config.searchRadiusDegrees(),
                config.productType(),
                config.instrument(),
                config.spectralElements(),
                config.autoscale(),
                config.asinh()
        );
    }

    private FetchOutcome fetchPreprocessed(CelestialLocation sampled, ExposureGroup group, Instant startedAt)
            throws IOException, InterruptedException {
        Path image = store.pathFor(group.location());
        try {
            download(group.urls().get(0), image);
            normalizer.straighten(image);
        } catch (IOException | InterruptedException | RuntimeException e) {
            Files.deleteIfExists(image);
            throw e;
        }
        publishPersisted(sampled, group.location(), image, 1, startedAt);
        return FetchOutcome.success(image, 1);
    }

    private PixelBuffer stack(List<Path> exposures) {
        try {
            return ctx.stacker().stack(exposures);
        } catch (ImageProcessingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ImageProcessingException("Stacking failed: " + rootMessage(e), e);
        } finally {
            scratch.delete(exposures);
        }
    }

    private PixelBuffer smooth(PixelBuffer composite) {
        try {
            return ctx.smoother().smooth(composite);
        } catch (ImageProcessingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ImageProcessingException("Smoothing failed: " + rootMessage(e), e);
        }
    }

    private void download(URI url, Path target) throws IOException, InterruptedException {
        Files.createDirectories(target.toAbsolutePath().getParent());
        try (InputStream in = ctx.archiveClient().download(url)) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void publishPersisted(CelestialLocation sampled, CelestialLocation imageLocation, Path image,
                                  int exposureCount, Instant startedAt) {
        ctx.eventBus().publish(new CompositePersisted(
                ctx.clock().instant(),
                sampled,
                imageLocation,
                image.toString(),
                exposureCount,
                Duration.between(startedAt, ctx.clock().instant()).toMillis()
        ));
    }

    private void pause(CelestialLocation location, int completedImages) {
        Duration delay = config.retryDelay();
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AcquisitionAbortedException("Interrupted while waiting to retry " + location, location, completedImages, e);
        }
    }

    static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root.getCause() != null) {
            root = root.getCause();
        }
        String message = root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
        return root == throwable || throwable.getMessage() == null ? message : throwable.getMessage() + ": " + message;
    }
}
