package org.stackup.dto.tolerance;

import org.stackup.tolerance.TargetSpec;

import java.util.List;

/**
 * 一次完整公差叠加计算的结果（值对象，每次计算重新生成）。
 *
 * @param totalNominal  带符号名义值之和
 * @param linkCount     环节数量
 * @param worstCase     极值法结果
 * @param rss           统计法结果
 * @param monteCarlo    Monte Carlo 结果（未运行时为 null）
 * @param contributions 各环节方差贡献（保持输入顺序）
 * @param targetSpec    目标规格（未给定时为 null）
 * @param meetsSpec     RSS 区间是否落在目标规格内（未给定规格时为 null）
 * @param margin        距规格限的最小余量，负值表示超差（未给定规格时为 null）
 */
public record ToleranceResult(
        double totalNominal,
        int linkCount,
        WorstCaseResult worstCase,
        RssResult rss,
        MonteCarloResult monteCarlo,
        List<LinkContribution> contributions,
        TargetSpec targetSpec,
        Boolean meetsSpec,
        Double margin
) {
}
