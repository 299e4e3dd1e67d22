package org.stackup.persist;

import org.stackup.assembly.AssemblyPart;
import org.stackup.assembly.MatingInterface;
import org.stackup.tolerance.ToleranceChain;

import java.util.List;

/**
 * 装配图的持久化形态。
 *
 * @param schemaVersion 文档版本
 * @param parts         零件（按插入顺序）
 * @param interfaces    配合界面
 * @param chains        公差链
 * @param partAdjacency 零件邻接表
 */
public record GraphDocument(
        int schemaVersion,
        List<KeyedEntry<AssemblyPart>> parts,
        List<KeyedEntry<MatingInterface>> interfaces,
        List<KeyedEntry<ToleranceChain>> chains,
        List<KeyedEntry<List<String>>> partAdjacency
) {
}
