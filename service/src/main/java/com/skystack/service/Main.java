package com.skystack.service;

import com.skystack.core.bus.EventBus;
import com.skystack.pipeline.acquisition.AcquisitionAbortedException;
import com.skystack.pipeline.acquisition.AcquisitionController;
import com.skystack.pipeline.acquisition.AcquisitionReport;
import com.skystack.pipeline.api.AcquisitionContext;
import com.skystack.pipeline.api.ArchiveClient;
import com.skystack.pipeline.config.AcquisitionConfig;
import com.skystack.pipeline.config.AcquisitionMode;
import com.skystack.pipeline.sampling.LocationSampler;
import com.skystack.pipeline.stacking.BilateralSmoother;
import com.skystack.pipeline.stacking.EccExposureStacker;
import com.skystack.pipeline.sweep.AllSkySweep;
import com.skystack.service.archive.HlaArchiveClient;
import com.skystack.service.config.ConfigLoader;
import com.skystack.service.http.HttpClientFactory;
import com.skystack.service.store.EventCodec;
import com.skystack.service.store.JsonlEventStore;

import java.io.IOException;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        if (args.length > 0) {
            LOGGER.warning("Ignoring command line arguments; the run is configured in config/acquisition.json");
        }
        Path configDir = Path.of("config");
        Path eventLogFile = Path.of("logs/events.jsonl");

        AcquisitionConfig config = ConfigLoader.loadAcquisition(configDir);
        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(eventLogFile);
        EventCodec.subscribeAll(eventBus, eventStore::append);

        HttpClient httpClient = HttpClientFactory.create(config);
        ArchiveClient archiveClient = new HlaArchiveClient(httpClient, config.requestTimeout());
        AcquisitionContext ctx = new AcquisitionContext(
                archiveClient,
                new EccExposureStacker(),
                new BilateralSmoother(),
                eventBus,
                Clock.systemUTC(),
                config
        );

        if (config.mode() == AcquisitionMode.ALL_SKY) {
            List<Path> images = new AllSkySweep(ctx).run();
            LOGGER.info("All-sky sweep saved " + images.size() + " images to " + config.outputPath().toAbsolutePath());
            return;
        }

        AcquisitionController controller = new AcquisitionController(ctx, new LocationSampler(random(config)));
        LOGGER.info("Acquiring " + config.imageCount() + " " + config.mode() + " images into "
                + config.outputPath().toAbsolutePath());
        try {
            AcquisitionReport report = controller.run();
            LOGGER.info("Acquisition finished: " + report.images().size() + " images, "
                    + report.attempts() + " attempts, " + report.retries() + " retries, "
                    + report.abandoned() + " abandoned locations");
        } catch (AcquisitionAbortedException e) {
            LOGGER.log(Level.SEVERE, "Acquisition aborted after " + e.completedImages() + " images", e);
            System.exit(1);
        }
    }

    static Random random(AcquisitionConfig config) {
        return config.seed() == null ? new Random() : new Random(config.seed());
    }
}
