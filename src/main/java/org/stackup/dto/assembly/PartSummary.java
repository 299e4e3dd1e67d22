package org.stackup.dto.assembly;

import org.stackup.geometry.Vec3;

import java.util.List;

/**
 * 装配图中单个零件的摘要。
 *
 * @param id        零件 id
 * @param name      名称
 * @param faceCount 面数
 * @param color     分配的渲染颜色（RGB，0–1）
 * @param neighbors 相邻零件 id
 * @param junction  是否为连接点零件
 */
public record PartSummary(
        String id,
        String name,
        int faceCount,
        Vec3 color,
        List<String> neighbors,
        boolean junction
) {
}
