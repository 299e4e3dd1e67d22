package org.stackup.assembly;

import org.stackup.geometry.Transforms;
import org.stackup.geometry.Vec3;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 装配图构建与查询。
 * <p>
 * 路径查询为无权 BFS：返回第一条（即最短）路径；多条等长路径之间按邻接表插入顺序取舍，
 * 两零件间存在多个界面时取插入顺序中的第一个。这种取舍只保证确定性，不代表几何意义。
 */
public final class AssemblyGraphBuilder {

    private AssemblyGraphBuilder() {
    }

    /**
     * 路径查询结果。
     *
     * @param path       依次经过的零件 id（含起点与终点）
     * @param interfaces 依次经过的界面 id（比 path 少一个）
     */
    public record PathResult(List<String> path, List<String> interfaces) {
    }

    /**
     * 构建装配图：每个界面同时插入 A->B 与 B->A 两条邻接（去重）；缺少颜色的零件按顺序分配渲染色。
     */
    public static AssemblyGraph build(List<AssemblyPart> parts, List<MatingInterface> interfaces) {
        Map<String, AssemblyPart> partMap = new LinkedHashMap<>();
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        List<Vec3> colors = PartColors.generate(parts.size(), 0.0);
        for (int i = 0; i < parts.size(); i++) {
            AssemblyPart part = parts.get(i);
            if (part.color() == null) {
                part = part.withColor(colors.get(i));
            }
            partMap.put(part.id(), part);
            adjacency.put(part.id(), new ArrayList<>());
        }

        Map<String, MatingInterface> interfaceMap = new LinkedHashMap<>();
        for (MatingInterface iface : interfaces) {
            interfaceMap.put(iface.id(), iface);
            String a = iface.partA().partId();
            String b = iface.partB().partId();
            List<String> adjA = adjacency.computeIfAbsent(a, k -> new ArrayList<>());
            if (!adjA.contains(b)) {
                adjA.add(b);
            }
            List<String> adjB = adjacency.computeIfAbsent(b, k -> new ArrayList<>());
            if (!adjB.contains(a)) {
                adjB.add(a);
            }
        }

        return new AssemblyGraph(partMap, interfaceMap, Map.of(), adjacency);
    }

    /**
     * BFS 查找两零件之间的路径；不连通时返回 null。起点等于终点时返回只含起点的路径。
     */
    public static PathResult findPath(AssemblyGraph graph, String startPartId, String endPartId) {
        Set<String> visited = new HashSet<>();
        Deque<PathResult> queue = new ArrayDeque<>();
        queue.add(new PathResult(List.of(startPartId), List.of()));

        while (!queue.isEmpty()) {
            PathResult current = queue.poll();
            String partId = current.path().get(current.path().size() - 1);
            if (partId.equals(endPartId)) {
                return current;
            }
            if (!visited.add(partId)) {
                continue;
            }

            for (String next : graph.neighbors(partId)) {
                if (visited.contains(next)) {
                    continue;
                }
                MatingInterface iface = findInterfaceBetween(graph, partId, next);
                if (iface == null) {
                    continue;
                }
                List<String> path = new ArrayList<>(current.path());
                path.add(next);
                List<String> ifaces = new ArrayList<>(current.interfaces());
                ifaces.add(iface.id());
                queue.add(new PathResult(path, ifaces));
            }
        }
        return null;
    }

    public static MatingInterface findInterfaceBetween(AssemblyGraph graph, String partIdA, String partIdB) {
        for (MatingInterface iface : graph.interfaces().values()) {
            if (iface.connects(partIdA, partIdB)) {
                return iface;
            }
        }
        return null;
    }

    public static List<MatingInterface> getPartInterfaces(AssemblyGraph graph, String partId) {
        List<MatingInterface> result = new ArrayList<>();
        for (MatingInterface iface : graph.interfaces().values()) {
            if (iface.involves(partId)) {
                result.add(iface);
            }
        }
        return result;
    }

    public static boolean isJunctionPart(AssemblyGraph graph, String partId) {
        return getPartInterfaces(graph, partId).size() > 1;
    }

    public static List<AssemblyPart> getJunctionParts(AssemblyGraph graph) {
        List<AssemblyPart> result = new ArrayList<>();
        for (AssemblyPart part : graph.parts().values()) {
            if (isJunctionPart(graph, part.id())) {
                result.add(part);
            }
        }
        return result;
    }

    /**
     * 把每个零件包围盒的 8 个角点按其变换映射到世界坐标，再取分量最小/最大值。
     * 没有零件时返回单位盒。
     */
    public static AssemblyBounds calculateAssemblyBounds(List<AssemblyPart> parts) {
        if (parts == null || parts.isEmpty()) {
            return new AssemblyBounds(Vec3.ZERO, new Vec3(1, 1, 1));
        }
        double minX = Double.POSITIVE_INFINITY;
        double minY = Double.POSITIVE_INFINITY;
        double minZ = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY;
        double maxY = Double.NEGATIVE_INFINITY;
        double maxZ = Double.NEGATIVE_INFINITY;

        for (AssemblyPart part : parts) {
            double[] m = Transforms.isValid(part.transform()) ? part.transform() : Transforms.identity();
            for (Vec3 corner : part.boundingBoxOrUnit().corners()) {
                Vec3 w = Transforms.transformPoint(corner, m);
                minX = Math.min(minX, w.x());
                minY = Math.min(minY, w.y());
                minZ = Math.min(minZ, w.z());
                maxX = Math.max(maxX, w.x());
                maxY = Math.max(maxY, w.y());
                maxZ = Math.max(maxZ, w.z());
            }
        }
        return new AssemblyBounds(new Vec3(minX, minY, minZ), new Vec3(maxX, maxY, maxZ));
    }
}
