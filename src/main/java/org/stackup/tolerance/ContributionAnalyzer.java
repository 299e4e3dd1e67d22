package org.stackup.tolerance;

import org.stackup.dto.tolerance.LinkContribution;

import java.util.ArrayList;
import java.util.List;

/**
 * 贡献度分析：把 RSS 总方差按环节拆分，结果保持输入顺序。
 */
public final class ContributionAnalyzer {

    private ContributionAnalyzer() {
    }

    public static List<LinkContribution> analyze(List<ChainLink> links, double[] variances) {
        if (variances.length != links.size()) {
            throw new IllegalArgumentException("方差数量与环节数量不一致：" + variances.length + " != " + links.size());
        }
        double totalVariance = 0;
        for (double v : variances) {
            totalVariance += v;
        }

        List<LinkContribution> result = new ArrayList<>(links.size());
        for (int i = 0; i < links.size(); i++) {
            ChainLink link = links.get(i);
            result.add(new LinkContribution(
                    link.id(),
                    link.name(),
                    link.signedNominal(),
                    link.totalTolerance(),
                    variances[i],
                    totalVariance > 0 ? 100.0 * variances[i] / totalVariance : 0.0
            ));
        }
        return result;
    }
}
