package org.stackup.tolerance;

import org.stackup.dto.tolerance.WorstCaseResult;

import java.util.List;

/**
 * 极值法叠加：假设所有环节同时取最不利值（区间算术）。
 */
public final class WorstCaseAnalyzer {

    private WorstCaseAnalyzer() {
    }

    /**
     * 正向环节贡献 {@code [nominal - minus, nominal + plus]}；
     * 负向环节取反后上下限互换：减去最大可能值得到总量下限。
     * 空链返回全 0。
     */
    public static WorstCaseResult analyze(List<ChainLink> links) {
        double totalMin = 0;
        double totalMax = 0;

        for (ChainLink link : links) {
            if (link.direction() == ContributionDirection.NEGATIVE) {
                totalMin -= link.nominal() + link.plusTolerance();
                totalMax -= link.nominal() - link.minusTolerance();
            } else {
                totalMin += link.nominal() - link.minusTolerance();
                totalMax += link.nominal() + link.plusTolerance();
            }
        }

        return new WorstCaseResult(totalMin, totalMax, (totalMax - totalMin) / 2, totalMax - totalMin);
    }
}
