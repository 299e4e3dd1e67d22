package org.stackup.assembly;

import org.stackup.geometry.Vec3;

import java.util.ArrayList;
import java.util.List;

/**
 * 零件渲染色生成：按黄金分割步进色相，使相邻零件颜色区分明显。
 */
public final class PartColors {

    private static final double GOLDEN_RATIO_CONJUGATE = 0.618033988749895;
    private static final double SATURATION = 0.6;
    private static final double LIGHTNESS = 0.5;

    private PartColors() {
    }

    public static List<Vec3> generate(int count, double startHue) {
        List<Vec3> colors = new ArrayList<>(Math.max(0, count));
        double hue = startHue;
        for (int i = 0; i < count; i++) {
            hue = (hue + GOLDEN_RATIO_CONJUGATE) % 1.0;
            colors.add(hslToRgb(hue, SATURATION, LIGHTNESS));
        }
        return colors;
    }

    static Vec3 hslToRgb(double h, double s, double l) {
        if (s == 0) {
            return new Vec3(l, l, l);
        }
        double q = l < 0.5 ? l * (1 + s) : l + s - l * s;
        double p = 2 * l - q;
        return new Vec3(
                hueToRgb(p, q, h + 1.0 / 3),
                hueToRgb(p, q, h),
                hueToRgb(p, q, h - 1.0 / 3)
        );
    }

    private static double hueToRgb(double p, double q, double t) {
        if (t < 0) {
            t += 1;
        }
        if (t > 1) {
            t -= 1;
        }
        if (t < 1.0 / 6) {
            return p + (q - p) * 6 * t;
        }
        if (t < 1.0 / 2) {
            return q;
        }
        if (t < 2.0 / 3) {
            return p + (q - p) * (2.0 / 3 - t) * 6;
        }
        return p;
    }
}
