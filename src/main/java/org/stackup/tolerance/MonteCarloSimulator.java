package org.stackup.tolerance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stackup.dto.tolerance.HistogramBin;
import org.stackup.dto.tolerance.MonteCarloResult;
import org.stackup.dto.tolerance.Percentiles;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Monte Carlo 叠加仿真：对每个样本逐环节抽样并按方向求和，最后做排序/统计。
 * <p>
 * 抽样规则：
 * <ul>
 *   <li>均匀分布：在 {@code [nominal - minus, nominal + plus]} 上均匀抽样。</li>
 *   <li>正态分布：均值 {@code nominal + (plus - minus) / 2}（非对称公差带平移中心），
 *       标准差 {@code (plus + minus) / (2 * sigma)}，用 Box-Muller 变换生成。</li>
 * </ul>
 * <p>
 * 并行策略：样本生成按 worker 分段，每段使用 {@link RandomSource#split()} 派生的独立随机流，
 * 写入同一个缓冲区的不相交区间；全部完成后再做一次顺序统计（排序/分位数/直方图）。
 * 给定种子与 worker 数时结果可复现。
 */
public final class MonteCarloSimulator {

    private static final Logger log = LoggerFactory.getLogger(MonteCarloSimulator.class);

    public static final int DEFAULT_SAMPLES = 10_000;

    private static final double[] PERCENTILE_LEVELS = {0.001, 0.01, 0.05, 0.5, 0.95, 0.99, 0.999};

    /**
     * 仿真设置。
     *
     * @param histogramBins 直方图分箱数
     * @param workers       并行采样的 worker 数（1 表示单线程）
     */
    public record Settings(int histogramBins, int workers) {

        public Settings {
            if (histogramBins < 1) {
                throw new IllegalArgumentException("histogramBins 必须为正整数：" + histogramBins);
            }
            if (workers < 1) {
                throw new IllegalArgumentException("workers 必须为正整数：" + workers);
            }
        }

        public static Settings defaults() {
            return new Settings(50, 1);
        }
    }

    private final Settings settings;

    public MonteCarloSimulator(Settings settings) {
        this.settings = (settings == null) ? Settings.defaults() : settings;
    }

    public Settings settings() {
        return settings;
    }

    public MonteCarloResult simulate(List<ChainLink> links, int samples, TargetSpec targetSpec, RandomSource random) {
        if (samples < 1) {
            throw new IllegalArgumentException("Monte Carlo 样本数必须为正整数：" + samples);
        }
        LinkSampler[] samplers = new LinkSampler[links.size()];
        for (int i = 0; i < samplers.length; i++) {
            samplers[i] = LinkSampler.of(links.get(i));
        }

        double[] results = new double[samples];
        int chunks = Math.min(settings.workers(), samples);
        if (chunks <= 1) {
            fill(results, 0, samples, samplers, new GaussianSource(random));
        } else {
            // 随机流在进入并行段之前按顺序派生，保证可复现
            GaussianSource[] sources = new GaussianSource[chunks];
            for (int c = 0; c < chunks; c++) {
                sources[c] = new GaussianSource(random.split());
            }
            int base = samples / chunks;
            int remainder = samples % chunks;
            IntStream.range(0, chunks).parallel().forEach(c -> {
                int from = c * base + Math.min(c, remainder);
                int to = from + base + (c < remainder ? 1 : 0);
                fill(results, from, to, samplers, sources[c]);
            });
        }
        log.debug("Monte Carlo 采样完成：samples={}, links={}, workers={}", samples, links.size(), chunks);

        return summarize(results, targetSpec);
    }

    private static void fill(double[] out, int from, int to, LinkSampler[] samplers, GaussianSource source) {
        for (int s = from; s < to; s++) {
            double total = 0;
            for (LinkSampler sampler : samplers) {
                total += sampler.sign * sampler.draw(source);
            }
            out[s] = total;
        }
    }

    private MonteCarloResult summarize(double[] results, TargetSpec targetSpec) {
        int samples = results.length;
        Arrays.sort(results);

        double sum = 0;
        for (double x : results) {
            sum += x;
        }
        double mean = sum / samples;
        double squares = 0;
        for (double x : results) {
            double d = x - mean;
            squares += d * d;
        }
        double stdDev = Math.sqrt(squares / samples);
        double min = results[0];
        double max = results[samples - 1];

        double cpk = (targetSpec == null) ? 1.0 : cpk(mean, stdDev, targetSpec);

        double[] p = new double[PERCENTILE_LEVELS.length];
        for (int i = 0; i < p.length; i++) {
            p[i] = results[percentileIndex(samples, PERCENTILE_LEVELS[i])];
        }
        Percentiles percentiles = new Percentiles(p[0], p[1], p[2], p[3], p[4], p[5], p[6]);

        return new MonteCarloResult(
                mean,
                stdDev,
                min,
                max,
                cpk,
                percentiles,
                histogram(results, min, max, settings.histogramBins()),
                samples
        );
    }

    /**
     * 最近秩：{@code floor(samples * p)}，截断到 {@code samples - 1}。
     */
    static int percentileIndex(int samples, double level) {
        int index = (int) Math.floor(samples * level);
        return Math.max(0, Math.min(index, samples - 1));
    }

    /**
     * {@code min(CPU, CPL)}；标准差为 0 时，均值在规格内返回 +Infinity，否则返回 -Infinity。
     */
    static double cpk(double mean, double stdDev, TargetSpec spec) {
        double upper = spec.upperLimit();
        double lower = spec.lowerLimit();
        if (!(stdDev > 0)) {
            return (mean >= lower && mean <= upper) ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
        }
        double cpu = (upper - mean) / (3 * stdDev);
        double cpl = (mean - lower) / (3 * stdDev);
        return Math.min(cpu, cpl);
    }

    /**
     * 在 {@code [min, max]} 上做等宽分箱；等于 max 的样本归入最后一箱。
     * 所有样本相同（宽度为 0）时全部计入最后一箱。
     */
    static List<HistogramBin> histogram(double[] sorted, double min, double max, int bins) {
        int samples = sorted.length;
        double binWidth = (max - min) / bins;
        int[] counts = new int[bins];
        for (double x : sorted) {
            int index;
            if (binWidth > 0) {
                index = (int) ((x - min) / binWidth);
                index = Math.max(0, Math.min(index, bins - 1));
            } else {
                index = bins - 1;
            }
            counts[index]++;
        }

        List<HistogramBin> histogram = new ArrayList<>(bins);
        for (int i = 0; i < bins; i++) {
            double binMin = min + i * binWidth;
            histogram.add(new HistogramBin(binMin, binMin + binWidth, counts[i], 100.0 * counts[i] / samples));
        }
        return histogram;
    }

    /**
     * 预先计算好的单环节抽样参数。
     */
    private static final class LinkSampler {
        private final double sign;
        private final boolean uniform;
        private final double low;
        private final double width;
        private final double mean;
        private final double std;

        private LinkSampler(double sign, boolean uniform, double low, double width, double mean, double std) {
            this.sign = sign;
            this.uniform = uniform;
            this.low = low;
            this.width = width;
            this.mean = mean;
            this.std = std;
        }

        static LinkSampler of(ChainLink link) {
            double plus = link.plusTolerance();
            double minus = link.minusTolerance();
            return new LinkSampler(
                    link.sign(),
                    link.distribution() == DistributionType.UNIFORM,
                    link.nominal() - minus,
                    plus + minus,
                    link.nominal() + (plus - minus) / 2,
                    (plus + minus) / (2 * link.sigma())
            );
        }

        double draw(GaussianSource source) {
            if (uniform) {
                return low + source.uniform() * width;
            }
            return mean + std * source.standardNormal();
        }
    }

    /**
     * Box-Muller：两次均匀抽样得到两个独立的标准正态值，第二个缓存到下一次使用。
     */
    private static final class GaussianSource {
        private final RandomSource random;
        private boolean hasSpare;
        private double spare;

        GaussianSource(RandomSource random) {
            this.random = random;
        }

        double uniform() {
            return random.nextDouble();
        }

        double standardNormal() {
            if (hasSpare) {
                hasSpare = false;
                return spare;
            }
            // u1 取 (0, 1]，避免 log(0)
            double u1 = 1.0 - random.nextDouble();
            double u2 = random.nextDouble();
            double r = Math.sqrt(-2.0 * Math.log(u1));
            double theta = 2.0 * Math.PI * u2;
            spare = r * Math.sin(theta);
            hasSpare = true;
            return r * Math.cos(theta);
        }
    }
}
