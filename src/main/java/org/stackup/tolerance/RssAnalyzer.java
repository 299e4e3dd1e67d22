package org.stackup.tolerance;

import org.stackup.dto.tolerance.RssResult;

import java.util.List;

/**
 * 统计法（RSS）叠加：各环节误差视为独立随机变量，方差相加。
 * <p>
 * 输出统一折算为 3σ 带宽（与输入 sigma 无关），便于不同链之间比较。
 */
public final class RssAnalyzer {

    /**
     * 输出带宽对应的标准差倍数。
     */
    public static final double OUTPUT_SIGMA_MULTIPLE = 3.0;

    private RssAnalyzer() {
    }

    /**
     * RSS 结果 + 每个环节的方差（与输入顺序一一对应，供贡献度分析复用）。
     */
    public record Analysis(RssResult result, double[] variances) {

        public double totalVariance() {
            double sum = 0;
            for (double v : variances) {
                sum += v;
            }
            return sum;
        }
    }

    public static Analysis analyze(List<ChainLink> links) {
        double totalNominal = 0;
        double[] variances = new double[links.size()];

        for (int i = 0; i < links.size(); i++) {
            ChainLink link = links.get(i);
            totalNominal += link.signedNominal();
            variances[i] = variance(link);
        }

        double totalVariance = 0;
        for (double v : variances) {
            totalVariance += v;
        }
        double stdDev = Math.sqrt(totalVariance);
        double tolerance = OUTPUT_SIGMA_MULTIPLE * stdDev;

        RssResult result = new RssResult(
                totalNominal - tolerance,
                totalNominal + tolerance,
                tolerance,
                stdDev,
                1.0
        );
        return new Analysis(result, variances);
    }

    /**
     * 单个环节的方差：
     * <ul>
     *   <li>均匀分布：{@code (plus + minus)^2 / 12}</li>
     *   <li>其他（正态）：公差全宽覆盖 {@code 2 * sigma} 个标准差，{@code ((plus + minus) / 2 / sigma)^2}</li>
     * </ul>
     */
    public static double variance(ChainLink link) {
        double totalTol = link.totalTolerance();
        if (link.distribution() == DistributionType.UNIFORM) {
            return totalTol * totalTol / 12.0;
        }
        double std = totalTol / 2.0 / link.sigma();
        return std * std;
    }
}
