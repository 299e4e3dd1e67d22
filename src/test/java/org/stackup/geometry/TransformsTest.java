package org.stackup.geometry;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TransformsTest {

    /**
     * 绕 Z 轴 90°，再平移 (10, 0, 0)；列主序。
     */
    private static final double[] ROTATE_Z_THEN_SHIFT = {
            0, 1, 0, 0,
            -1, 0, 0, 0,
            0, 0, 1, 0,
            10, 0, 0, 1
    };

    @Test
    void transformPoint_appliesRotationAndTranslation() {
        Vec3 p = Transforms.transformPoint(new Vec3(1, 0, 0), ROTATE_Z_THEN_SHIFT);

        assertThat(p.x()).isCloseTo(10, within(1e-12));
        assertThat(p.y()).isCloseTo(1, within(1e-12));
        assertThat(p.z()).isCloseTo(0, within(1e-12));
    }

    @Test
    void transformDirection_ignoresTranslationAndRenormalizes() {
        double[] scaled = Transforms.identity();
        scaled[0] = 3;
        scaled[12] = 100;

        Vec3 d = Transforms.transformDirection(new Vec3(1, 0, 0), scaled);

        assertThat(d).isEqualTo(new Vec3(1, 0, 0));
        assertThat(Transforms.transformDirection(new Vec3(1, 0, 0), ROTATE_Z_THEN_SHIFT).y()).isCloseTo(1, within(1e-12));
    }

    @Test
    void isValid_requiresSixteenFiniteValues() {
        assertThat(Transforms.isValid(Transforms.identity())).isTrue();
        assertThat(Transforms.isValid(new double[12])).isFalse();
        assertThat(Transforms.isValid(null)).isFalse();
        double[] broken = Transforms.identity();
        broken[5] = Double.NaN;
        assertThat(Transforms.isValid(broken)).isFalse();
    }

    @Test
    void normalize_keepsNearZeroVectorUnchanged() {
        Vec3 tiny = new Vec3(1e-12, 0, 0);

        assertThat(tiny.normalize()).isEqualTo(tiny);
        assertThat(new Vec3(0, 3, 4).normalize()).isEqualTo(new Vec3(0, 0.6, 0.8));
    }
}
