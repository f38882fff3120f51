package com.killfeed.engine.domain.model;

public record Coordinates(double x, double y, double z) {

    public double distanceTo(Coordinates other) {
        double dx = x - other.x;
        double dy = y - other.y;
        double dz = z - other.z;
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }
}
