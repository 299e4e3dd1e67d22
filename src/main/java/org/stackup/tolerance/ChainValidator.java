package org.stackup.tolerance;

import java.util.ArrayList;
import java.util.List;

/**
 * 数值前置条件校验。
 * <p>
 * 分析器本身是纯函数、不做校验；调用入口（{@link ToleranceStackupCalculator}）在计算前统一调用本类，
 * 把非法输入变成明确的 {@link IllegalArgumentException}，而不是让 NaN 在结果中静默传播。
 * 空链不是错误。
 */
public final class ChainValidator {

    private ChainValidator() {
    }

    /**
     * 返回所有违规描述（为空表示通过）。
     */
    public static List<String> violations(List<ChainLink> links) {
        List<String> problems = new ArrayList<>();
        if (links == null) {
            problems.add("links 不能为空（可以是空列表）");
            return problems;
        }
        for (int i = 0; i < links.size(); i++) {
            ChainLink link = links.get(i);
            String label = "links[" + i + "]" + (link != null && link.id() != null ? "(" + link.id() + ")" : "");
            if (link == null) {
                problems.add(label + "：环节不能为 null");
                continue;
            }
            if (!Double.isFinite(link.nominal())) {
                problems.add(label + "：nominal 必须是有限数值");
            }
            if (!Double.isFinite(link.plusTolerance()) || link.plusTolerance() < 0) {
                problems.add(label + "：plusTolerance 必须是非负有限数值");
            }
            if (!Double.isFinite(link.minusTolerance()) || link.minusTolerance() < 0) {
                problems.add(label + "：minusTolerance 必须是非负有限数值");
            }
            if (!Double.isFinite(link.sigma()) || link.sigma() <= 0) {
                problems.add(label + "：sigma 必须是正的有限数值");
            }
            if (link.direction() == null) {
                problems.add(label + "：direction 不能为空");
            }
            if (link.distribution() == null) {
                problems.add(label + "：distribution 不能为空");
            }
        }
        return problems;
    }

    public static void requireValid(List<ChainLink> links) {
        List<String> problems = violations(links);
        if (!problems.isEmpty()) {
            throw new IllegalArgumentException("公差链参数不合法：" + String.join("；", problems));
        }
    }

    public static void requireValid(TargetSpec spec) {
        if (spec == null) {
            return;
        }
        if (!Double.isFinite(spec.nominal())
                || !Double.isFinite(spec.plusTolerance()) || spec.plusTolerance() < 0
                || !Double.isFinite(spec.minusTolerance()) || spec.minusTolerance() < 0) {
            throw new IllegalArgumentException("目标规格不合法：nominal 必须有限，plus/minus 必须是非负有限数值");
        }
    }
}
