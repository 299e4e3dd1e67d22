package org.stackup.dto.tolerance;

import org.stackup.tolerance.StandardFits;

import java.util.List;

/**
 * {@code stackup_list_standard_fits} 的返回结果。
 *
 * @param fits 配合列表（按查询过滤后）
 */
public record StandardFitsResult(List<StandardFits.Fit> fits) {
}
