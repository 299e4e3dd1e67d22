package org.stackup.tolerance;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.stackup.dto.tolerance.ToleranceResult;
import org.stackup.geometry.Vec3;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 公差链：有序环节 + 测量方向 + 可选起止基准 + 缓存的计算结果。
 * <p>
 * 说明：
 * <ul>
 *   <li>{@code direction} 仅作说明用途；分析器只按名义轴上的带符号标量计算。</li>
 *   <li>环节顺序只影响展示，分析结果对环节排列不变。</li>
 *   <li>任何编辑都会生成新的链实例，并清空缓存结果（旧结果已失效）。</li>
 * </ul>
 */
public record ToleranceChain(
        String id,
        String name,
        String description,
        Vec3 direction,
        List<ChainLink> links,
        DatumReference startDatum,
        DatumReference endDatum,
        ToleranceResult result
) {

    public ToleranceChain {
        links = (links == null) ? List.of() : List.copyOf(links);
        direction = (direction == null) ? Vec3.UNIT_X : direction;
    }

    public static ToleranceChain create(String id, String name) {
        return new ToleranceChain(id, name, null, Vec3.UNIT_X, List.of(), null, null, null);
    }

    /**
     * 至少两个环节才构成一条可分析的链。
     */
    @JsonIgnore
    public boolean isComplete() {
        return links.size() >= 2;
    }

    @JsonIgnore
    public boolean isCalculated() {
        return result != null;
    }

    public ToleranceChain withLinks(List<ChainLink> newLinks) {
        return new ToleranceChain(id, name, description, direction, newLinks, startDatum, endDatum, null);
    }

    public ToleranceChain addLink(ChainLink link) {
        List<ChainLink> updated = new ArrayList<>(links);
        updated.add(link);
        return withLinks(updated);
    }

    public ToleranceChain replaceLink(ChainLink link) {
        List<ChainLink> updated = new ArrayList<>(links.size());
        boolean found = false;
        for (ChainLink existing : links) {
            if (Objects.equals(existing.id(), link.id())) {
                updated.add(link);
                found = true;
            } else {
                updated.add(existing);
            }
        }
        if (!found) {
            throw new IllegalArgumentException("公差链中不存在环节：" + link.id());
        }
        return withLinks(updated);
    }

    public ToleranceChain removeLink(String linkId) {
        List<ChainLink> updated = new ArrayList<>(links);
        updated.removeIf(l -> Objects.equals(l.id(), linkId));
        return withLinks(updated);
    }

    public ToleranceChain withDatums(DatumReference start, DatumReference end) {
        return new ToleranceChain(id, name, description, direction, links, start, end, result);
    }

    public ToleranceChain withResult(ToleranceResult newResult) {
        return new ToleranceChain(id, name, description, direction, links, startDatum, endDatum, newResult);
    }
}
