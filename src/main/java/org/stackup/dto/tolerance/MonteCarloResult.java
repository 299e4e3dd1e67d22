package org.stackup.dto.tolerance;

import java.util.List;

/**
 * Monte Carlo 仿真结果（经验统计量）。
 *
 * @param mean        样本均值
 * @param stdDev      总体标准差（除以样本数）
 * @param min         最小样本
 * @param max         最大样本
 * @param cpk         过程能力指数；未给定目标规格时约定为 1.0；标准差为 0 时为 ±Infinity（不返回 NaN）
 * @param percentiles 分位数
 * @param histogram   等宽直方图
 * @param sampleSize  样本数
 */
public record MonteCarloResult(
        double mean,
        double stdDev,
        double min,
        double max,
        double cpk,
        Percentiles percentiles,
        List<HistogramBin> histogram,
        int sampleSize
) {
}
