package org.stackup.assembly;

import org.stackup.tolerance.ChainLink;
import org.stackup.tolerance.ContributionDirection;
import org.stackup.tolerance.DatumReference;
import org.stackup.tolerance.DistributionType;
import org.stackup.tolerance.LinkType;
import org.stackup.tolerance.ToleranceChain;

import java.util.ArrayList;
import java.util.List;

/**
 * 从识别出的几何自动生成公差链。
 * <p>
 * 零件尺寸环节取包围盒最大边长作为名义值（假设叠加方向沿最大尺寸），默认公差为名义值的 0.1%，
 * 方向按顺序正负交替；界面间隙环节以识别距离为名义值（距离为 0 时取 0.05），公差取界面类型的建议值。
 * 生成的链只是起点，调用方通常还要逐项修正。
 */
public final class ChainAutoGenerator {

    static final double DEFAULT_RELATIVE_TOLERANCE = 0.001;
    static final double DEFAULT_PART_DIMENSION = 50.0;
    static final double DEFAULT_GAP = 0.05;
    static final int OVERVIEW_INTERFACE_LIMIT = 3;

    private ChainAutoGenerator() {
    }

    /**
     * 沿两零件间的最短路径生成链：零件尺寸与界面间隙交替排列，起止基准取路径两端零件在首/末界面上的面。
     * 两零件不连通时返回 null。
     */
    public static ToleranceChain fromPath(AssemblyGraph graph, String chainId, String name, String startPartId, String endPartId) {
        AssemblyGraphBuilder.PathResult path = AssemblyGraphBuilder.findPath(graph, startPartId, endPartId);
        if (path == null) {
            return null;
        }

        List<ChainLink> links = new ArrayList<>();
        for (int i = 0; i < path.path().size(); i++) {
            String partId = path.path().get(i);
            links.add(partLink(i, graph.parts().get(partId), partId));
            if (i < path.interfaces().size()) {
                MatingInterface iface = graph.interfaces().get(path.interfaces().get(i));
                FaceRef side = iface.sideOf(partId);
                links.add(gapLink(i, iface, side == null ? null : side.faceId()));
            }
        }

        DatumReference start = datum(graph, startPartId, path.interfaces().isEmpty() ? null : path.interfaces().get(0), "起始基准");
        DatumReference end = datum(graph, endPartId,
                path.interfaces().isEmpty() ? null : path.interfaces().get(path.interfaces().size() - 1), "终止基准");

        return ToleranceChain.create(chainId, name)
                .withLinks(links)
                .withDatums(start, end);
    }

    /**
     * 概览链：装配中每个零件一个尺寸环节，再追加得分最高的前 3 个界面间隙。
     */
    public static ToleranceChain overview(AssemblyGraph graph, String chainId, String name) {
        List<ChainLink> links = new ArrayList<>();
        int index = 0;
        for (AssemblyPart part : graph.parts().values()) {
            links.add(partLink(index++, part, part.id()));
        }
        int gaps = 0;
        for (MatingInterface iface : graph.interfaces().values()) {
            if (gaps >= OVERVIEW_INTERFACE_LIMIT) {
                break;
            }
            if (iface.interfaceType() == InterfaceType.UNKNOWN) {
                continue;
            }
            links.add(gapLink(gaps++, iface, null));
        }
        return ToleranceChain.create(chainId, name).withLinks(links);
    }

    private static ChainLink partLink(int index, AssemblyPart part, String partId) {
        double nominal = (part == null || part.boundingBox() == null) ? DEFAULT_PART_DIMENSION : part.boundingBox().maxDimension();
        String partName = (part == null || part.name() == null) ? partId : part.name();
        double tol = nominal * DEFAULT_RELATIVE_TOLERANCE;
        return ChainLink.create("link-part-" + index, LinkType.PART_DIMENSION, partName + " 长度", nominal)
                .withTolerances(tol, tol)
                .withDirection(index % 2 == 0 ? ContributionDirection.POSITIVE : ContributionDirection.NEGATIVE)
                .withSource(partId, null, null);
    }

    private static ChainLink gapLink(int index, MatingInterface iface, String faceId) {
        double nominal = iface.proximity() > 0 ? iface.proximity() : DEFAULT_GAP;
        double tol = iface.defaultTolerance();
        return ChainLink.create("link-iface-" + index, LinkType.INTERFACE_GAP, "界面间隙 " + (index + 1), nominal)
                .withTolerances(tol, tol)
                .withDistribution(iface.defaultDistribution() == null ? DistributionType.NORMAL : iface.defaultDistribution(), ChainLink.DEFAULT_SIGMA)
                .withSource(null, iface.id(), faceId);
    }

    private static DatumReference datum(AssemblyGraph graph, String partId, String interfaceId, String label) {
        AssemblyPart part = graph.parts().get(partId);
        String faceId = null;
        if (interfaceId != null) {
            FaceRef side = graph.interfaces().get(interfaceId).sideOf(partId);
            faceId = side == null ? null : side.faceId();
        }
        String partName = (part == null || part.name() == null) ? partId : part.name();
        return new DatumReference(partId, faceId, label + "：" + partName);
    }
}
