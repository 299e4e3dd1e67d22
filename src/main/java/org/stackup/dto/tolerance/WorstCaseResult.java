package org.stackup.dto.tolerance;

/**
 * 极值法（worst-case）分析结果。
 *
 * @param min       所有环节同时取最不利值时的总量下限
 * @param max       所有环节同时取最不利值时的总量上限
 * @param tolerance 半宽 {@code (max - min) / 2}
 * @param range     全宽 {@code max - min}
 */
public record WorstCaseResult(
        double min,
        double max,
        double tolerance,
        double range
) {
}
