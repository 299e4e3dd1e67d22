package org.stackup.tolerance;

/**
 * 公差链起止基准。
 *
 * @param partId      零件 id
 * @param faceId      面的全局 id（{@code <partId>-face-<faceId>}）
 * @param description 说明
 */
public record DatumReference(
        String partId,
        String faceId,
        String description
) {
}
