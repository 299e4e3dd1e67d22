package org.stackup.dto.tolerance;

/**
 * 单个环节对总方差的贡献（用于界面排序展示）。
 *
 * @param linkId                环节 id
 * @param linkName              环节名称
 * @param nominalContribution   带方向符号的名义值贡献
 * @param toleranceContribution 公差带全宽 {@code plus + minus}
 * @param varianceContribution  该环节方差
 * @param percentOfTotal        占总方差百分比（总方差为 0 时为 0）
 */
public record LinkContribution(
        String linkId,
        String linkName,
        double nominalContribution,
        double toleranceContribution,
        double varianceContribution,
        double percentOfTotal
) {
}
