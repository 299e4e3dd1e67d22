package org.stackup.tolerance;

/**
 * 叠加总量的目标规格。
 *
 * @param nominal        目标名义值
 * @param plusTolerance  上偏差（非负）
 * @param minusTolerance 下偏差（以非负数存储）
 */
public record TargetSpec(
        double nominal,
        double plusTolerance,
        double minusTolerance
) {

    public double upperLimit() {
        return nominal + plusTolerance;
    }

    public double lowerLimit() {
        return nominal - minusTolerance;
    }
}
