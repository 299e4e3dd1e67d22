package org.stackup.dto.assembly;

import org.stackup.assembly.AssemblyBounds;

import java.util.List;

/**
 * {@code assembly_load} / {@code assembly_open} 的返回结果。
 *
 * @param graphId        会话中的装配图 id（后续工具调用使用）
 * @param rootId         文档所在根目录（仅 assembly_open）
 * @param path           文档路径（仅 assembly_open）
 * @param parts          零件摘要
 * @param interfaceCount 配合界面数
 * @param chainIds       已有公差链 id
 * @param bounds         装配包围盒（世界坐标）
 * @param warnings       非致命提示
 */
public record AssemblyLoadResult(
        String graphId,
        String rootId,
        String path,
        List<PartSummary> parts,
        int interfaceCount,
        List<String> chainIds,
        AssemblyBounds bounds,
        List<String> warnings
) {
}
