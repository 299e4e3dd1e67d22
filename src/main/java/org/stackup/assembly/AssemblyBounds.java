package org.stackup.assembly;

import org.stackup.geometry.Vec3;

/**
 * 装配在世界坐标系下的轴对齐包围盒。
 */
public record AssemblyBounds(Vec3 min, Vec3 max) {

    public Vec3 dimensions() {
        return max.minus(min);
    }
}
