package com.sedmap.model;

public final class Measurement {

    public final double value;
    public final double sigma;

    public Measurement(double value, double sigma) {
        this.value = value;
        this.sigma = sigma;
    }

    @Override
    public String toString() {
        return value + " +/- " + sigma;
    }
}
