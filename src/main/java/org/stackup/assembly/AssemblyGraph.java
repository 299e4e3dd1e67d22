package org.stackup.assembly;

import org.stackup.tolerance.ToleranceChain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 装配图：零件、配合界面、公差链与零件邻接表。
 * <p>
 * 不变量：邻接关系对称（B 因某界面与 A 相邻，则 A 也与 B 相邻）。
 * 图在装配加载时整体构建，重新加载时整体重建，不做增量更新；添加公差链会得到新的图实例。
 * 所有 Map 保持插入顺序。
 */
public record AssemblyGraph(
        Map<String, AssemblyPart> parts,
        Map<String, MatingInterface> interfaces,
        Map<String, ToleranceChain> chains,
        Map<String, List<String>> partAdjacency
) {

    public AssemblyGraph {
        parts = Collections.unmodifiableMap(new LinkedHashMap<>(parts));
        interfaces = Collections.unmodifiableMap(new LinkedHashMap<>(interfaces));
        chains = Collections.unmodifiableMap(new LinkedHashMap<>(chains));
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : partAdjacency.entrySet()) {
            adjacency.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        partAdjacency = Collections.unmodifiableMap(adjacency);
    }

    public static AssemblyGraph empty() {
        return new AssemblyGraph(Map.of(), Map.of(), Map.of(), Map.of());
    }

    public List<String> neighbors(String partId) {
        return partAdjacency.getOrDefault(partId, List.of());
    }

    public AssemblyGraph withChain(ToleranceChain chain) {
        Map<String, ToleranceChain> updated = new LinkedHashMap<>(chains);
        updated.put(chain.id(), chain);
        return new AssemblyGraph(parts, interfaces, updated, partAdjacency);
    }

    public List<MatingInterface> interfaceList() {
        return new ArrayList<>(interfaces.values());
    }
}
