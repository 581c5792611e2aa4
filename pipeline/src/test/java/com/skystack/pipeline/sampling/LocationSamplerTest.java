package com.skystack.pipeline.sampling;

import com.skystack.core.model.CelestialLocation;
import com.skystack.core.model.VisitedLocations;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocationSamplerTest {
    @Test
    void drawsAreInRangeAndOnTheThreeDecimalGrid() {
        LocationSampler sampler = new LocationSampler(new Random(42));

        for (int i = 0; i < 2_000; i++) {
            CelestialLocation location = sampler.next(VisitedLocations.empty());
            assertTrue(location.rightAscension() >= 0.0 && location.rightAscension() < 360.0, location.toString());
            assertTrue(location.declination() >= -90.0 && location.declination() <= 90.0, location.toString());
            assertOnGrid(location.rightAscension());
            assertOnGrid(location.declination());
        }
    }

    @Test
    void neverReturnsAVisitedLocation() {
        LocationSampler sampler = new LocationSampler(new Random(7));
        VisitedLocations visited = VisitedLocations.empty();

        for (int i = 0; i < 500; i++) {
            CelestialLocation location = sampler.next(visited);
            assertFalse(visited.contains(location), "repeated " + location);
            visited = visited.with(location);
        }

        assertEquals(500, visited.size());
    }

    @Test
    void visitedDrawIsRejectedAndRedrawn() {
        LocationSampler sampler = new LocationSampler(new ScriptedRandom(0.5, 0.5, 0.25, 0.75));
        VisitedLocations visited = VisitedLocations.empty().with(new CelestialLocation(180.0, 0.0));

        CelestialLocation location = sampler.next(visited);

        assertEquals(new CelestialLocation(90.0, 30.0), location);
    }

    @Test
    void declinationIsUniformOnTheSphere() {
        LocationSampler sampler = new LocationSampler(new Random(2024));
        int draws = 40_000;
        int highLatitude = 0;
        double sinSum = 0.0;
        double raSum = 0.0;
        int[] sinBins = new int[4];

        for (int i = 0; i < draws; i++) {
            CelestialLocation location = sampler.draw();
            double sin = Math.sin(Math.toRadians(location.declination()));
            sinSum += sin;
            raSum += location.rightAscension();
            sinBins[Math.min(3, (int) ((sin + 1.0) * 2.0))]++;
            if (Math.abs(location.declination()) > 60.0) {
                highLatitude++;
            }
        }

        // area above |dec| = 60 is 1 - sin(60) of the sphere
        assertEquals(1.0 - Math.sqrt(3.0) / 2.0, (double) highLatitude / draws, 0.01);
        assertEquals(0.0, sinSum / draws, 0.02);
        assertEquals(180.0, raSum / draws, 3.0);
        for (int count : sinBins) {
            assertEquals(0.25, (double) count / draws, 0.015);
        }
    }

    private static void assertOnGrid(double value) {
        double scaled = value * 1_000.0;
        assertEquals(Math.rint(scaled), scaled, 1e-6, "not on grid: " + value);
    }

    private static final class ScriptedRandom extends Random {
        private final Deque<Double> values;

        private ScriptedRandom(double... values) {
            this.values = new ArrayDeque<>();
            for (double value : values) {
                this.values.add(value);
            }
        }

        @Override
        public double nextDouble() {
            if (values.isEmpty()) {
                throw new IllegalStateException("script exhausted");
            }
            return values.poll();
        }
    }
}
