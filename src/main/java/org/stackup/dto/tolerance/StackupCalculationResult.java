package org.stackup.dto.tolerance;

import java.util.List;

/**
 * {@code stackup_calculate} 的返回结果。
 *
 * @param result   叠加计算结果
 * @param insights 面向设计者的结论/建议
 * @param warnings 非致命提示（例如样本数被截断）
 */
public record StackupCalculationResult(
        ToleranceResult result,
        List<String> insights,
        List<String> warnings
) {
}
