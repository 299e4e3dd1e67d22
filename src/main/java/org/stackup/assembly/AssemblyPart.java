package org.stackup.assembly;

import org.stackup.geometry.Vec3;

import java.util.List;

/**
 * 装配中的单个零件。面数据内嵌在零件内，不与其他零件共享。
 *
 * @param id           零件 id
 * @param name         名称
 * @param stepEntityId 来源 STEP 实体 id
 * @param transform    4x4 列主序仿射变换（object -> world）
 * @param boundingBox  局部包围盒（可为空）
 * @param faces        面摘要
 * @param color        渲染颜色（RGB，0–1；可为空，建图时自动分配）
 */
public record AssemblyPart(
        String id,
        String name,
        long stepEntityId,
        double[] transform,
        PartBoundingBox boundingBox,
        List<PartFace> faces,
        Vec3 color
) {

    public AssemblyPart {
        faces = (faces == null) ? List.of() : List.copyOf(faces);
    }

    public PartBoundingBox boundingBoxOrUnit() {
        return boundingBox == null ? PartBoundingBox.UNIT : boundingBox;
    }

    public AssemblyPart withColor(Vec3 newColor) {
        return new AssemblyPart(id, name, stepEntityId, transform, boundingBox, faces, newColor);
    }
}
