package org.stackup.assembly;

/**
 * 配合界面一侧的引用：零件 + 面全局 id。
 */
public record FaceRef(String partId, String faceId) {
}
