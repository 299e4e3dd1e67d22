package org.stackup.geometry;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * 三维向量/点（单位：mm）。
 *
 * @param x X 分量
 * @param y Y 分量
 * @param z Z 分量
 */
public record Vec3(double x, double y, double z) {

    public static final Vec3 ZERO = new Vec3(0, 0, 0);
    public static final Vec3 UNIT_X = new Vec3(1, 0, 0);

    public Vec3 plus(Vec3 other) {
        return new Vec3(x + other.x, y + other.y, z + other.z);
    }

    public Vec3 minus(Vec3 other) {
        return new Vec3(x - other.x, y - other.y, z - other.z);
    }

    public Vec3 scale(double factor) {
        return new Vec3(x * factor, y * factor, z * factor);
    }

    public double dot(Vec3 other) {
        return x * other.x + y * other.y + z * other.z;
    }

    public double length() {
        return Math.sqrt(x * x + y * y + z * z);
    }

    public double distanceTo(Vec3 other) {
        return minus(other).length();
    }

    public Vec3 midpoint(Vec3 other) {
        return new Vec3((x + other.x) / 2, (y + other.y) / 2, (z + other.z) / 2);
    }

    /**
     * 归一化；长度接近 0 时原样返回（避免除零产生 NaN）。
     */
    public Vec3 normalize() {
        double len = length();
        if (len > 1e-10) {
            return new Vec3(x / len, y / len, z / len);
        }
        return this;
    }

    @JsonIgnore
    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(z);
    }
}
