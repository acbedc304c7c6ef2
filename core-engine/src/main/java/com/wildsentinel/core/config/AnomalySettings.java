package com.wildsentinel.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * Tuning for the activity anomaly detector.
 *
 * @since 1.0.0
 */
public class AnomalySettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Effective number of samples the exponential smoothing remembers. */
    private int smoothingWindow = 24;
    /** Observations a camera/species pair needs before its baseline is trusted. */
    private int minSamples = 5;
    /** |z| at which the anomaly score saturates to 1.0. */
    private double saturationZ = 2.5;
    /** Floor for the baseline standard deviation in the z-score denominator. */
    private double stdDevEpsilon = 0.5;
    /**
     * Baseline mean below which an hour bucket counts as never active. Idle
     * days decay a bucket by {@code 1 - alpha} each, so 0.1 is reached after
     * about a month without a sighting in that hour.
     */
    private double nearZeroMean = 0.1;
    /** Score ceiling while the baseline is still warming up. */
    private double coldStartCap = 0.5;
    /** Trailing window (minutes) over which the current detection rate is counted. */
    private int rateWindowMinutes = 60;

    void validate(List<String> errors) {
        if (smoothingWindow < 1) {
            errors.add("'smoothingWindow' must be >= 1, got: " + smoothingWindow);
        }
        if (minSamples < 1) {
            errors.add("'minSamples' must be >= 1, got: " + minSamples);
        }
        if (saturationZ <= 0) {
            errors.add("'saturationZ' must be > 0, got: " + saturationZ);
        }
        if (stdDevEpsilon <= 0) {
            errors.add("'stdDevEpsilon' must be > 0, got: " + stdDevEpsilon);
        }
        if (nearZeroMean < 0) {
            errors.add("'nearZeroMean' must be >= 0, got: " + nearZeroMean);
        }
        if (coldStartCap < 0 || coldStartCap > 1) {
            errors.add("'coldStartCap' must be in [0, 1], got: " + coldStartCap);
        }
        if (rateWindowMinutes < 1) {
            errors.add("'rateWindowMinutes' must be >= 1, got: " + rateWindowMinutes);
        }
    }

    /**
     * @return smoothing factor equivalent to a window of
     *         {@link #getSmoothingWindow()} samples
     */
    public double smoothingAlpha() {
        return 2.0 / (smoothingWindow + 1.0);
    }

    public int getSmoothingWindow() {
        return smoothingWindow;
    }

    public void setSmoothingWindow(int smoothingWindow) {
        this.smoothingWindow = smoothingWindow;
    }

    public int getMinSamples() {
        return minSamples;
    }

    public void setMinSamples(int minSamples) {
        this.minSamples = minSamples;
    }

    public double getSaturationZ() {
        return saturationZ;
    }

    public void setSaturationZ(double saturationZ) {
        this.saturationZ = saturationZ;
    }

    public double getStdDevEpsilon() {
        return stdDevEpsilon;
    }

    public void setStdDevEpsilon(double stdDevEpsilon) {
        this.stdDevEpsilon = stdDevEpsilon;
    }

    public double getNearZeroMean() {
        return nearZeroMean;
    }

    public void setNearZeroMean(double nearZeroMean) {
        this.nearZeroMean = nearZeroMean;
    }

    public double getColdStartCap() {
        return coldStartCap;
    }

    public void setColdStartCap(double coldStartCap) {
        this.coldStartCap = coldStartCap;
    }

    public int getRateWindowMinutes() {
        return rateWindowMinutes;
    }

    public void setRateWindowMinutes(int rateWindowMinutes) {
        this.rateWindowMinutes = rateWindowMinutes;
    }
}
