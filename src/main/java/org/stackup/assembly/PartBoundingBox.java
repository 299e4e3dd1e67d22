package org.stackup.assembly;

import org.stackup.geometry.Vec3;

import java.util.List;

/**
 * 零件局部坐标系下的轴对齐包围盒。
 *
 * @param min        最小角点
 * @param max        最大角点
 * @param dimensions 各轴尺寸 {@code max - min}
 */
public record PartBoundingBox(Vec3 min, Vec3 max, Vec3 dimensions) {

    /**
     * 零件缺少包围盒时使用的占位盒（单位立方体）。
     */
    public static final PartBoundingBox UNIT = of(Vec3.ZERO, new Vec3(1, 1, 1));

    public static PartBoundingBox of(Vec3 min, Vec3 max) {
        return new PartBoundingBox(min, max, max.minus(min));
    }

    public double diagonal() {
        return dimensions.length();
    }

    public double maxDimension() {
        return Math.max(dimensions.x(), Math.max(dimensions.y(), dimensions.z()));
    }

    public List<Vec3> corners() {
        return List.of(
                new Vec3(min.x(), min.y(), min.z()),
                new Vec3(max.x(), min.y(), min.z()),
                new Vec3(min.x(), max.y(), min.z()),
                new Vec3(max.x(), max.y(), min.z()),
                new Vec3(min.x(), min.y(), max.z()),
                new Vec3(max.x(), min.y(), max.z()),
                new Vec3(min.x(), max.y(), max.z()),
                new Vec3(max.x(), max.y(), max.z())
        );
    }
}
