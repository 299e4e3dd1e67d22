package org.stackup.assembly;

import org.stackup.geometry.Vec3;
import org.stackup.tolerance.DistributionType;

import java.util.Objects;

/**
 * 识别出的两零件间接触（一次识别生成，之后不可变）。
 *
 * @param id                  界面 id（{@code interface-<n>}）
 * @param partA               A 侧
 * @param partB               B 侧
 * @param interfaceType       界面类型
 * @param proximity           世界坐标下两面中心距离（mm）
 * @param normalAlignment     世界坐标法向点积的绝对值（0–1）
 * @param contactArea         估算接触面积（mm²）
 * @param defaultTolerance    建议的对称公差
 * @param defaultDistribution 建议的分布
 * @param contactPoint        两面中心的中点（世界坐标）
 */
public record MatingInterface(
        String id,
        FaceRef partA,
        FaceRef partB,
        InterfaceType interfaceType,
        double proximity,
        double normalAlignment,
        double contactArea,
        double defaultTolerance,
        DistributionType defaultDistribution,
        Vec3 contactPoint
) {

    public boolean involves(String partId) {
        return Objects.equals(partA.partId(), partId) || Objects.equals(partB.partId(), partId);
    }

    public boolean connects(String partIdA, String partIdB) {
        return (Objects.equals(partA.partId(), partIdA) && Objects.equals(partB.partId(), partIdB))
                || (Objects.equals(partA.partId(), partIdB) && Objects.equals(partB.partId(), partIdA));
    }

    /**
     * 返回指定零件那一侧的面引用；不涉及该零件时返回 null。
     */
    public FaceRef sideOf(String partId) {
        if (Objects.equals(partA.partId(), partId)) {
            return partA;
        }
        if (Objects.equals(partB.partId(), partId)) {
            return partB;
        }
        return null;
    }
}
