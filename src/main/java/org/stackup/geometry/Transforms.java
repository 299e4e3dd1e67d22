package org.stackup.geometry;

/**
 * 4x4 仿射变换工具（列主序，16 个元素，object -> world）。
 * <p>
 * 列主序布局：{@code [m0..m3]} 为 X 轴列，{@code [m4..m7]} 为 Y 轴列，{@code [m8..m11]} 为 Z 轴列，
 * {@code [m12..m14]} 为平移。
 */
public final class Transforms {

    public static final int MATRIX_SIZE = 16;

    private Transforms() {
    }

    public static double[] identity() {
        return new double[]{
                1, 0, 0, 0,
                0, 1, 0, 0,
                0, 0, 1, 0,
                0, 0, 0, 1
        };
    }

    public static double[] translation(double tx, double ty, double tz) {
        double[] m = identity();
        m[12] = tx;
        m[13] = ty;
        m[14] = tz;
        return m;
    }

    /**
     * 变换点（含平移）。
     */
    public static Vec3 transformPoint(Vec3 p, double[] m) {
        return new Vec3(
                m[0] * p.x() + m[4] * p.y() + m[8] * p.z() + m[12],
                m[1] * p.x() + m[5] * p.y() + m[9] * p.z() + m[13],
                m[2] * p.x() + m[6] * p.y() + m[10] * p.z() + m[14]
        );
    }

    /**
     * 变换方向（不含平移），结果重新归一化。
     */
    public static Vec3 transformDirection(Vec3 d, double[] m) {
        return new Vec3(
                m[0] * d.x() + m[4] * d.y() + m[8] * d.z(),
                m[1] * d.x() + m[5] * d.y() + m[9] * d.z(),
                m[2] * d.x() + m[6] * d.y() + m[10] * d.z()
        ).normalize();
    }

    public static boolean isValid(double[] m) {
        if (m == null || m.length != MATRIX_SIZE) {
            return false;
        }
        for (double v : m) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }
}
