package com.skystack.pipeline.sweep;

import com.skystack.core.events.AlertRaised;
import com.skystack.core.model.ExposureGroup;
import com.skystack.core.model.ExposureRecord;
import com.skystack.pipeline.api.AcquisitionContext;
import com.skystack.pipeline.api.ArchiveQuery;
import com.skystack.pipeline.config.AcquisitionConfig;
import com.skystack.pipeline.selection.ExposureSelection;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

public class AllSkySweep {
    private static final Logger LOGGER = Logger.getLogger(AllSkySweep.class.getName());

    private final AcquisitionContext ctx;
    private final AcquisitionConfig config;

    public AllSkySweep(AcquisitionContext ctx) {
        this.ctx = ctx;
        this.config = ctx.config();
    }

    public List<Path> run() throws IOException, InterruptedException {
        List<ExposureRecord> records = ctx.archiveClient().query(ArchiveQuery.allSky(config.productType(), config.instrument()));
        List<ExposureGroup> groups = ExposureSelection.group(records);
        LOGGER.info("All-sky query returned " + records.size() + " rows in " + groups.size() + " locations");

        Files.createDirectories(config.outputPath());
        List<Path> images = new ArrayList<>();
        for (int index = 0; index < groups.size(); index++) {
            ExposureGroup group = groups.get(index);
            Path target = config.outputPath().resolve(index + ".jpeg");
            if (download(group.urls().get(0), target)) {
                images.add(target);
            }
        }
        return images;
    }

    private boolean download(URI url, Path target) throws IOException, InterruptedException {
        int maxRetries = config.sweepMaxRetries();
        int failures = 0;
        while (true) {
            try (InputStream in = ctx.archiveClient().download(url)) {
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                return true;
            } catch (IOException e) {
                failures++;
                LOGGER.warning("Download of " + url + " failed (" + failures + "): " + e.getMessage());
                if (maxRetries > 0 && failures > maxRetries) {
                    Files.deleteIfExists(target);
                    ctx.eventBus().publish(new AlertRaised(
                            ctx.clock().instant(),
                            "sweep",
                            "Giving up on " + url + " after " + failures + " attempts",
                            Map.of("target", target.toString())
                    ));
                    return false;
                }
                Thread.sleep(config.retryDelay().toMillis());
            }
        }
    }
}
