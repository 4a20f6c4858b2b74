package org.hdrequalize.equalization;

import java.util.Arrays;

/**
 * Growable buffer of sample values selected from an image.
 */
class SampleValues {

    private double[] values;
    private int size;

    SampleValues() {
        this(256);
    }

    SampleValues(int initialCapacity) {
        this.values = new double[Math.max(initialCapacity, 1)];
        this.size = 0;
    }

    void add(double value) {
        if (size == values.length) {
            values = Arrays.copyOf(values, values.length * 2);
        }
        values[size++] = value;
    }

    int size() {
        return size;
    }

    boolean isEmpty() {
        return size == 0;
    }

    double mean() {
        double sum = 0;
        for (int i = 0; i < size; i++) {
            sum += values[i];
        }
        return sum / size;
    }

    /**
     * Population standard deviation.
     */
    double std(double mean) {
        double sumSq = 0;
        for (int i = 0; i < size; i++) {
            double d = values[i] - mean;
            sumSq += d * d;
        }
        return Math.sqrt(sumSq / size);
    }

    /**
     * Keep only the values strictly inside mean +/- stdMultCutoff * std.
     * If all values are equal (std is 0) nothing is an outlier and all values are kept.
     */
    SampleValues withinStdDevs(double stdMultCutoff) {
        if (size == 0) {
            return this;
        }
        double mean = mean();
        double std = std(mean);
        if (std == 0) {
            return this;
        }
        double lower = mean - std * stdMultCutoff;
        double upper = mean + std * stdMultCutoff;
        SampleValues selected = new SampleValues(size);
        for (int i = 0; i < size; i++) {
            double v = values[i];
            if (v < upper && v > lower) {
                selected.add(v);
            }
        }
        return selected;
    }

    /**
     * @return log(v + offset) for every value that has a finite logarithm.
     */
    SampleValues logScaled(double offset) {
        SampleValues scaled = new SampleValues(size);
        for (int i = 0; i < size; i++) {
            double v = Math.log(values[i] + offset);
            if (Double.isFinite(v)) {
                scaled.add(v);
            }
        }
        return scaled;
    }

    double[] toArray() {
        return Arrays.copyOf(values, size);
    }
}
