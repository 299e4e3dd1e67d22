package org.stackup.tolerance;

import org.stackup.dto.tolerance.LinkContribution;
import org.stackup.dto.tolerance.ToleranceResult;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * 从已算好的结果派生文字结论（纯函数，无副作用）。
 */
public final class StackupInsights {

    static final double RSS_SAVINGS_THRESHOLD_PERCENT = 20.0;
    static final double DOMINANT_CONTRIBUTOR_PERCENT = 40.0;
    static final double CPK_NOT_CAPABLE = 1.0;
    static final double CPK_CAPABLE = 1.33;

    private StackupInsights() {
    }

    public static List<String> generate(ToleranceResult result) {
        List<String> insights = new ArrayList<>();
        if (result == null) {
            return insights;
        }

        double wcTol = result.worstCase().tolerance();
        double rssTol = result.rss().tolerance();
        if (wcTol > 0) {
            double savings = (wcTol - rssTol) / wcTol * 100;
            if (savings > RSS_SAVINGS_THRESHOLD_PERCENT) {
                insights.add(String.format(Locale.ROOT,
                        "RSS 公差比极值法收紧 %.0f%%，采用统计公差有望降低加工成本。", savings));
            }
        }

        LinkContribution top = result.contributions().stream()
                .max(Comparator.comparingDouble(LinkContribution::percentOfTotal))
                .orElse(null);
        if (top != null && top.percentOfTotal() > DOMINANT_CONTRIBUTOR_PERCENT) {
            insights.add(String.format(Locale.ROOT,
                    "\"%s\" 贡献了 %.0f%% 的总方差，收紧该环节公差效果最明显。", top.linkName(), top.percentOfTotal()));
        }

        if (result.monteCarlo() != null) {
            double cpk = result.monteCarlo().cpk();
            if (cpk < CPK_NOT_CAPABLE) {
                insights.add(String.format(Locale.ROOT,
                        "Cpk = %.2f 低于 1.0，过程可能无法满足规格，建议收紧公差。", cpk));
            } else if (cpk >= CPK_CAPABLE) {
                insights.add(String.format(Locale.ROOT,
                        "Cpk = %.2f，过程能力充足，距规格限有较好余量。", cpk));
            }
        }

        if (result.targetSpec() != null && Boolean.FALSE.equals(result.meetsSpec())) {
            insights.add("当前叠加结果不满足目标规格，可考虑放宽规格或收紧各环节公差。");
        }
        return insights;
    }
}
