package com.skystack.pipeline.acquisition;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

public final class ScratchDirectory {
    private static final Logger LOGGER = Logger.getLogger(ScratchDirectory.class.getName());

    public static final String GLOB = "exposure_*.jpeg";

    private final Path directory;

    public ScratchDirectory(Path directory) {
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    public Path exposurePath(int index) {
        return directory.resolve("exposure_" + index + ".jpeg");
    }

    public void create() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed creating scratch directory " + directory, e);
        }
    }

    public List<Path> list() {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, GLOB)) {
            stream.forEach(files::add);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed listing scratch directory " + directory, e);
        }
        files.sort(null);
        return files;
    }

    public int purge() {
        List<Path> files = list();
        for (Path file : files) {
            delete(file);
        }
        if (!files.isEmpty()) {
            LOGGER.fine("Purged " + files.size() + " scratch exposures from " + directory);
        }
        return files.size();
    }

    public void delete(List<Path> files) {
        files.forEach(this::delete);
    }

    private void delete(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed deleting scratch exposure " + file, e);
        }
    }
}
