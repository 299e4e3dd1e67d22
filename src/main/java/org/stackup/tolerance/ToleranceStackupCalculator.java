package org.stackup.tolerance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stackup.dto.tolerance.LinkContribution;
import org.stackup.dto.tolerance.MonteCarloResult;
import org.stackup.dto.tolerance.RssResult;
import org.stackup.dto.tolerance.ToleranceResult;
import org.stackup.dto.tolerance.WorstCaseResult;

import java.util.List;

/**
 * 公差叠加编排：组合极值法、RSS、Monte Carlo 与贡献度分析，并按需对照目标规格。
 * <p>
 * 规格判定策略：{@code meetsSpec}/{@code margin} 只基于 RSS 区间计算（偏向统计公差的风险取向），
 * 不参考极值法区间；负的 margin 表示超差。
 */
public class ToleranceStackupCalculator {

    private static final Logger log = LoggerFactory.getLogger(ToleranceStackupCalculator.class);

    /**
     * 计算选项。
     *
     * @param runMonteCarlo     是否运行 Monte Carlo
     * @param monteCarloSamples 样本数
     * @param targetSpec        目标规格（可为空）
     * @param random            随机源（为空时使用非确定性随机源）
     */
    public record Options(
            boolean runMonteCarlo,
            int monteCarloSamples,
            TargetSpec targetSpec,
            RandomSource random
    ) {
        public static Options defaults() {
            return new Options(true, MonteCarloSimulator.DEFAULT_SAMPLES, null, null);
        }

        public Options withTargetSpec(TargetSpec spec) {
            return new Options(runMonteCarlo, monteCarloSamples, spec, random);
        }

        public Options withRandom(RandomSource source) {
            return new Options(runMonteCarlo, monteCarloSamples, targetSpec, source);
        }

        public Options withoutMonteCarlo() {
            return new Options(false, monteCarloSamples, targetSpec, random);
        }
    }

    private final MonteCarloSimulator simulator;

    public ToleranceStackupCalculator(MonteCarloSimulator simulator) {
        this.simulator = simulator;
    }

    public ToleranceStackupCalculator() {
        this(new MonteCarloSimulator(MonteCarloSimulator.Settings.defaults()));
    }

    public ToleranceResult calculate(List<ChainLink> links, Options options) {
        Options resolved = (options == null) ? Options.defaults() : options;
        ChainValidator.requireValid(links);
        ChainValidator.requireValid(resolved.targetSpec());

        double totalNominal = 0;
        for (ChainLink link : links) {
            totalNominal += link.signedNominal();
        }

        WorstCaseResult worstCase = WorstCaseAnalyzer.analyze(links);
        RssAnalyzer.Analysis rssAnalysis = RssAnalyzer.analyze(links);
        RssResult rss = rssAnalysis.result();

        MonteCarloResult monteCarlo = null;
        if (resolved.runMonteCarlo()) {
            RandomSource random = (resolved.random() == null) ? RandomSource.unseeded() : resolved.random();
            monteCarlo = simulator.simulate(links, resolved.monteCarloSamples(), resolved.targetSpec(), random);
        }

        List<LinkContribution> contributions = ContributionAnalyzer.analyze(links, rssAnalysis.variances());

        TargetSpec spec = resolved.targetSpec();
        Boolean meetsSpec = null;
        Double margin = null;
        if (spec != null) {
            double upper = spec.upperLimit();
            double lower = spec.lowerLimit();
            meetsSpec = rss.min() >= lower && rss.max() <= upper;
            margin = Math.min(rss.min() - lower, upper - rss.max());
        }

        log.debug("公差叠加计算完成：links={}, totalNominal={}, wc=±{}, rss=±{}, monteCarlo={}",
                links.size(), totalNominal, worstCase.tolerance(), rss.tolerance(), monteCarlo != null);

        return new ToleranceResult(
                totalNominal,
                links.size(),
                worstCase,
                rss,
                monteCarlo,
                contributions,
                spec,
                meetsSpec,
                margin
        );
    }

    /**
     * 计算并把结果写回链（返回新链实例）。
     */
    public ToleranceChain calculate(ToleranceChain chain, Options options) {
        return chain.withResult(calculate(chain.links(), options));
    }
}
