package com.azazar.util;

/**
 * Exponential moving average with smoothing factor {@code 1 / period}.
 * The first sample initializes the average.
 *
 * @author Mikhail Yevchenko <spam@azazar.com>
 */
public class ExponentialAverage {

    private static final int DEFAULT_PERIOD = 100;

    private final int period;
    private final double keep, take;
    private double value = Double.NaN;
    private long samples;

    public ExponentialAverage(int period) {
        if (period < 1) {
            throw new IllegalArgumentException("Period must be positive: " + period);
        }
        this.period = period;
        take = 1d / (double)period;
        keep = 1d - take;
    }

    public ExponentialAverage() {
        this(DEFAULT_PERIOD);
    }

    public void add(double sample) {
        if (samples++ == 0)
            value = sample;
        else
            value = value * keep + sample * take;
    }

    /**
     * @return current average, {@link Double#NaN} before the first sample
     */
    public double value() {
        return value;
    }

    public long samples() {
        return samples;
    }

    public int period() {
        return period;
    }

}
