package org.hdrequalize.equalization;

import java.io.Serializable;

import javax.annotation.Nullable;

import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Tuning parameters for histogram equalization. Optional features are off when the corresponding field is null.
 */
public class EqualizationParams implements Serializable {

    public static final int DEFAULT_NUMBER_OF_BINS = 1000;
    public static final double DEFAULT_STD_MULT_CUTOFF = 4.0;
    public static final int DEFAULT_LOCAL_RADIUS_PX = 300;
    /**
     * Largest supported radius; a tile of this radius already covers a 2,000,000 pixels wide image.
     */
    public static final int MAX_LOCAL_RADIUS_PX = 1_000_000;
    public static final int MAX_TILE_SIZE = 2 * MAX_LOCAL_RADIUS_PX + 1;

    private int numberOfBins = DEFAULT_NUMBER_OF_BINS;
    private Double stdMultCutoff = DEFAULT_STD_MULT_CUTOFF;
    private int localRadiusPx = DEFAULT_LOCAL_RADIUS_PX;
    private Double clipLimit;
    private Double slopeLimit;
    private Double logOffset;
    private boolean zeroToOneNormalization = true;

    /**
     * Parameters tuned for adaptive equalization of low light imagery.
     */
    public static EqualizationParams adaptiveDefaults() {
        return new EqualizationParams()
                .setStdMultCutoff(3.0)
                .setClipLimit(60.0)
                .setSlopeLimit(3.0)
                .setLogOffset(0.00001);
    }

    public EqualizationParams() {
    }

    public EqualizationParams(EqualizationParams other) {
        this.numberOfBins = other.numberOfBins;
        this.stdMultCutoff = other.stdMultCutoff;
        this.localRadiusPx = other.localRadiusPx;
        this.clipLimit = other.clipLimit;
        this.slopeLimit = other.slopeLimit;
        this.logOffset = other.logOffset;
        this.zeroToOneNormalization = other.zeroToOneNormalization;
    }

    public int getNumberOfBins() {
        return numberOfBins;
    }

    public EqualizationParams setNumberOfBins(int numberOfBins) {
        this.numberOfBins = numberOfBins;
        return this;
    }

    /**
     * @return outlier cutoff in standard deviations from the mean; null if the samples are not trimmed
     */
    @Nullable
    public Double getStdMultCutoff() {
        return stdMultCutoff;
    }

    public EqualizationParams setStdMultCutoff(@Nullable Double stdMultCutoff) {
        this.stdMultCutoff = stdMultCutoff;
        return this;
    }

    public int getLocalRadiusPx() {
        return localRadiusPx;
    }

    public EqualizationParams setLocalRadiusPx(int localRadiusPx) {
        this.localRadiusPx = localRadiusPx;
        return this;
    }

    public int getTileSize() {
        return 2 * localRadiusPx + 1;
    }

    @Nullable
    public Double getClipLimit() {
        return clipLimit;
    }

    public EqualizationParams setClipLimit(@Nullable Double clipLimit) {
        this.clipLimit = clipLimit;
        return this;
    }

    @Nullable
    public Double getSlopeLimit() {
        return slopeLimit;
    }

    public EqualizationParams setSlopeLimit(@Nullable Double slopeLimit) {
        this.slopeLimit = slopeLimit;
        return this;
    }

    /**
     * @return offset added before taking the log of the values; null if values are not log scaled
     */
    @Nullable
    public Double getLogOffset() {
        return logOffset;
    }

    public EqualizationParams setLogOffset(@Nullable Double logOffset) {
        this.logOffset = logOffset;
        return this;
    }

    public boolean hasLogScale() {
        return logOffset != null;
    }

    public boolean isZeroToOneNormalization() {
        return zeroToOneNormalization;
    }

    public EqualizationParams setZeroToOneNormalization(boolean zeroToOneNormalization) {
        this.zeroToOneNormalization = zeroToOneNormalization;
        return this;
    }

    /**
     * @throws IllegalArgumentException if any of the parameters is out of range
     */
    public void validate() {
        if (numberOfBins < 1) {
            throw new IllegalArgumentException("Number of bins must be positive: " + numberOfBins);
        }
        if (localRadiusPx < 0) {
            throw new IllegalArgumentException("Local radius cannot be negative: " + localRadiusPx);
        }
        if (localRadiusPx > MAX_LOCAL_RADIUS_PX) {
            throw new IllegalArgumentException("Local radius " + localRadiusPx + " exceeds " + MAX_LOCAL_RADIUS_PX);
        }
        if (stdMultCutoff != null && !(stdMultCutoff > 0)) {
            throw new IllegalArgumentException("Std cutoff must be positive: " + stdMultCutoff);
        }
        if (clipLimit != null && !(clipLimit >= 0)) {
            throw new IllegalArgumentException("Clip limit cannot be negative: " + clipLimit);
        }
        if (slopeLimit != null && !(slopeLimit >= 0)) {
            throw new IllegalArgumentException("Slope limit cannot be negative: " + slopeLimit);
        }
        if (logOffset != null && !Double.isFinite(logOffset)) {
            throw new IllegalArgumentException("Invalid log offset: " + logOffset);
        }
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("numberOfBins", numberOfBins)
                .append("stdMultCutoff", stdMultCutoff)
                .append("localRadiusPx", localRadiusPx)
                .append("clipLimit", clipLimit)
                .append("slopeLimit", slopeLimit)
                .append("logOffset", logOffset)
                .append("zeroToOneNormalization", zeroToOneNormalization)
                .toString();
    }
}
