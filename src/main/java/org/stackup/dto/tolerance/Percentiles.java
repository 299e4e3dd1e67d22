package org.stackup.dto.tolerance;

/**
 * Monte Carlo 样本的分位数（最近秩法）。
 *
 * @param p0_1  0.1%
 * @param p1    1%
 * @param p5    5%
 * @param p50   50%（中位数）
 * @param p95   95%
 * @param p99   99%
 * @param p99_9 99.9%
 */
public record Percentiles(
        double p0_1,
        double p1,
        double p5,
        double p50,
        double p95,
        double p99,
        double p99_9
) {
}
