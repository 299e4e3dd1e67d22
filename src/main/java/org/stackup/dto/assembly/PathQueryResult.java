package org.stackup.dto.assembly;

import java.util.List;

/**
 * {@code assembly_find_path} 的返回结果。
 *
 * @param graphId     装配图 id
 * @param startPartId 起点零件
 * @param endPartId   终点零件
 * @param found       是否连通
 * @param path        零件序列（不连通时为空列表）
 * @param interfaces  相邻零件间使用的界面 id（比 path 少一个）
 */
public record PathQueryResult(
        String graphId,
        String startPartId,
        String endPartId,
        boolean found,
        List<String> path,
        List<String> interfaces
) {
}
