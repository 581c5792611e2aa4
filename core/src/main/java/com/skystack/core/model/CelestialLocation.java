package com.skystack.core.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

public record CelestialLocation(double rightAscension, double declination) {
    public static final int DECIMALS = 3;

    public CelestialLocation {
        if (Double.isNaN(rightAscension) || rightAscension < 0.0 || rightAscension >= 360.0) {
            throw new IllegalArgumentException("rightAscension must be in [0, 360): " + rightAscension);
        }
        if (Double.isNaN(declination) || declination < -90.0 || declination > 90.0) {
            throw new IllegalArgumentException("declination must be in [-90, 90]: " + declination);
        }
        rightAscension = rightAscension + 0.0;
        declination = declination + 0.0;
    }

    public static CelestialLocation rounded(double rightAscension, double declination) {
        double ra = round(rightAscension);
        if (ra >= 360.0) {
            ra = 0.0;
        }
        return new CelestialLocation(ra, round(declination));
    }

    public CelestialLocation rounded() {
        return rounded(rightAscension, declination);
    }

    public String fileKey() {
        CelestialLocation key = rounded();
        return "RA_" + plain(key.rightAscension) + "__DEC_" + plain(key.declination);
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(DECIMALS, RoundingMode.HALF_UP).doubleValue();
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).toPlainString();
    }
}
