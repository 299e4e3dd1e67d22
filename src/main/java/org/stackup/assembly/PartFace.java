package org.stackup.assembly;

import org.stackup.geometry.Vec3;

/**
 * 面的几何摘要（局部坐标系；只读）。
 *
 * @param id       面在零件内的编号
 * @param globalId 全局 id：{@code <partId>-face-<id>}
 * @param faceType 面分类
 * @param normal   单位法向
 * @param center   面中心
 * @param area     面积（mm²）
 * @param radius   半径（仅曲面；可为空）
 * @param axis     轴线方向（仅曲面；可为空）
 */
public record PartFace(
        int id,
        String globalId,
        FaceType faceType,
        Vec3 normal,
        Vec3 center,
        double area,
        Double radius,
        Vec3 axis
) {

    public static String globalId(String partId, int faceId) {
        return partId + "-face-" + faceId;
    }

    public static PartFace of(String partId, int id, FaceType faceType, Vec3 normal, Vec3 center, double area, Double radius, Vec3 axis) {
        return new PartFace(id, globalId(partId, id), faceType, normal, center, area, radius, axis);
    }

    public static PartFace planar(String partId, int id, Vec3 normal, Vec3 center, double area) {
        return of(partId, id, FaceType.PLANAR, normal, center, area, null, null);
    }

    public static PartFace cylindrical(String partId, int id, Vec3 normal, Vec3 center, double area, double radius, Vec3 axis) {
        return of(partId, id, FaceType.CYLINDRICAL, normal, center, area, radius, axis);
    }
}
