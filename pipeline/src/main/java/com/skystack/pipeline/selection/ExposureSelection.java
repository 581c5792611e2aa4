package com.skystack.pipeline.selection;

import com.skystack.core.model.CelestialLocation;
import com.skystack.core.model.ExposureGroup;
import com.skystack.core.model.ExposureRecord;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class ExposureSelection {
    private ExposureSelection() {
    }

    public static List<ExposureGroup> group(List<ExposureRecord> records) {
        Map<CelestialLocation, List<URI>> byLocation = new LinkedHashMap<>();
        for (ExposureRecord record : records) {
            byLocation.computeIfAbsent(record.location(), ignored -> new ArrayList<>()).add(record.sourceUrl());
        }
        List<ExposureGroup> groups = new ArrayList<>(byLocation.size());
        byLocation.forEach((location, urls) -> groups.add(new ExposureGroup(location, urls)));
        return groups;
    }

    // Ties go to the earliest group.
    public static Optional<ExposureGroup> selectLargest(List<ExposureGroup> groups) {
        ExposureGroup best = null;
        for (ExposureGroup group : groups) {
            if (best == null || group.size() > best.size()) {
                best = group;
            }
        }
        return Optional.ofNullable(best);
    }
}
