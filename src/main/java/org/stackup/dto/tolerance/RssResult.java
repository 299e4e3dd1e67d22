package org.stackup.dto.tolerance;

/**
 * 统计法（RSS，均方根）分析结果，统一折算为 3σ 带宽。
 *
 * @param min               {@code totalNominal - tolerance}
 * @param max               {@code totalNominal + tolerance}
 * @param tolerance         3σ 公差 {@code 3 * sigma}
 * @param sigma             合成标准差
 * @param processCapability 过程能力 Cp（约定固定为 1.0：以计算所得公差作为 3σ 规格时 Cp=1）
 */
public record RssResult(
        double min,
        double max,
        double tolerance,
        double sigma,
        double processCapability
) {
}
