package org.stackup.dto.assembly;

/**
 * {@code assembly_save} 的返回结果。
 *
 * @param graphId       保存的装配图 id
 * @param rootId        根目录标识
 * @param path          相对 root 的路径（统一使用 / 分隔）
 * @param schemaVersion 文档版本
 * @param bytesWritten  写入字节数
 */
public record DocumentSaveResult(
        String graphId,
        String rootId,
        String path,
        int schemaVersion,
        long bytesWritten
) {
}
