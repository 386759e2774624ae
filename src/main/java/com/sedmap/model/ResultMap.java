package com.sedmap.model;

public final class ResultMap {

    public final String name;
    public final String unit;
    private final double[][] data;

    public ResultMap(String name, double[][] data, String unit) {
        this.name = name;
        this.data = Band.copy(data);
        this.unit = unit;
    }

    public double[][] getData() { return Band.copy(data); }

    public double get(int row, int column) { return data[row][column]; }

    public Shape getShape() { return Shape.of(data); }
}
