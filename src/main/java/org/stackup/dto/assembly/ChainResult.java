package org.stackup.dto.assembly;

import org.stackup.tolerance.ToleranceChain;

import java.util.List;

/**
 * {@code chain_auto_generate} / {@code chain_calculate} 的返回结果。
 *
 * @param graphId  装配图 id
 * @param chain    公差链（计算后带 result）
 * @param insights 结论/建议（仅计算后）
 * @param warnings 非致命提示
 */
public record ChainResult(
        String graphId,
        ToleranceChain chain,
        List<String> insights,
        List<String> warnings
) {
}
