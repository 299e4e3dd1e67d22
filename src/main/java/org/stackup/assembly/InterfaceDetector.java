package org.stackup.assembly;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stackup.geometry.Transforms;
import org.stackup.geometry.Vec3;
import org.stackup.tolerance.DistributionType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * 配合界面识别器：对装配中每一对零件做面-面几何比较，找出、分类并打分候选接触。
 * <p>
 * 流程（每一对无序零件）：
 * <ol>
 *   <li>把两零件的面变换到世界坐标（中心按点变换，法向按方向变换后重新归一化）。</li>
 *   <li>只保留平面/圆柱面；面中心距离超过粗筛距离的跳过。</li>
 *   <li>准入：两平面且法向相对（点积小于 {@code -candidateOpposingAlignment}），或两圆柱面（不论法向符号）。</li>
 *   <li>分类；{@link InterfaceType#UNKNOWN} 与接触面积不足 {@code minContactArea} 的候选直接丢弃。</li>
 *   <li>按 {@code |alignment| / (1 + distance / scoreDistanceScale)} 降序（稳定排序），每对最多保留
 *       {@code maxInterfacesPerPair} 个。</li>
 * </ol>
 * <p>
 * 粗筛距离为 {@code max(proximityThreshold * proximityScale, 0.5 * 对角线A, 0.5 * 对角线B)}：
 * 面中心距离对不同尺寸零件不是好的绝对接近度指标，因此阈值按比例放大而非直接使用。
 * <p>
 * 复杂度 O(P² · F²)，适用于几十个零件/面的装配；大型装配不在设计范围内。
 */
public final class InterfaceDetector {

    private static final Logger log = LoggerFactory.getLogger(InterfaceDetector.class);

    /**
     * 零件缺少包围盒时使用的对角线长度（mm）。
     */
    private static final double DEFAULT_DIAGONAL = 100.0;

    private InterfaceDetector() {
    }

    /**
     * 识别参数。所有经验常量都在这里具名、可覆盖。
     *
     * @param proximityThreshold         接近度阈值（按 {@code proximityScale} 放大后用作粗筛距离下限）
     * @param normalThreshold            法向对齐阈值；当前分类只使用下面两个对齐常量，该值仅透传保留
     * @param minContactArea             最小接触面积（mm²）
     * @param candidateOpposingAlignment 平面候选准入：点积需小于其相反数
     * @param faceToFaceAlignment        判定 face_to_face：点积需小于其相反数
     * @param pinRadiusTolerance         判定 pin_in_hole：两圆柱半径差上限（mm）
     * @param proximityScale             粗筛距离放大倍数
     * @param scoreDistanceScale         打分时的距离尺度（mm）
     * @param maxInterfacesPerPair       每对零件最多保留的界面数
     * @param faceContactArea            face_to_face 的估算接触面积（mm²）
     * @param defaultCylinderRadius      圆柱配合缺少半径时使用的半径（mm）
     * @param fallbackContactArea        其他类型的估算接触面积（mm²）
     * @param parallel                   是否并行评估零件对
     */
    public record DetectionParams(
            double proximityThreshold,
            double normalThreshold,
            double minContactArea,
            double candidateOpposingAlignment,
            double faceToFaceAlignment,
            double pinRadiusTolerance,
            double proximityScale,
            double scoreDistanceScale,
            int maxInterfacesPerPair,
            double faceContactArea,
            double defaultCylinderRadius,
            double fallbackContactArea,
            boolean parallel
    ) {
        public static DetectionParams defaults() {
            return new DetectionParams(
                    2.0,
                    0.95,
                    1.0,
                    0.8,
                    0.9,
                    0.5,
                    50.0,
                    10.0,
                    10,
                    10.0,
                    5.0,
                    1.0,
                    false
            );
        }

        /**
         * 覆盖调用方最常调整的三个阈值（null 表示保持原值）。
         */
        public DetectionParams withThresholds(Double proximity, Double normal, Double minArea) {
            return new DetectionParams(
                    proximity == null ? proximityThreshold : proximity,
                    normal == null ? normalThreshold : normal,
                    minArea == null ? minContactArea : minArea,
                    candidateOpposingAlignment,
                    faceToFaceAlignment,
                    pinRadiusTolerance,
                    proximityScale,
                    scoreDistanceScale,
                    maxInterfacesPerPair,
                    faceContactArea,
                    defaultCylinderRadius,
                    fallbackContactArea,
                    parallel
            );
        }
    }

    /**
     * 识别结果。
     *
     * @param interfaces    保留下来的界面（按零件对顺序，对内按得分降序）
     * @param junctionParts 出现在多于一个界面中的零件（按首次出现顺序）
     */
    public record Detection(List<MatingInterface> interfaces, List<String> junctionParts) {
    }

    public static Detection detect(List<AssemblyPart> parts, DetectionParams params) {
        DetectionParams p = (params == null) ? DetectionParams.defaults() : params;
        if (parts == null || parts.size() < 2) {
            return new Detection(List.of(), List.of());
        }

        List<List<WorldFace>> worldFaces = new ArrayList<>(parts.size());
        for (AssemblyPart part : parts) {
            worldFaces.add(toWorld(part));
        }

        List<int[]> pairs = new ArrayList<>();
        for (int i = 0; i < parts.size(); i++) {
            for (int j = i + 1; j < parts.size(); j++) {
                pairs.add(new int[]{i, j});
            }
        }

        // 各零件对互相独立；collect 保持遭遇顺序，并行与串行的输出一致
        IntStream indices = IntStream.range(0, pairs.size());
        Stream<List<Candidate>> perPair = (p.parallel() ? indices.parallel() : indices).mapToObj(k -> {
            int[] pair = pairs.get(k);
            return evaluatePair(parts.get(pair[0]), worldFaces.get(pair[0]), parts.get(pair[1]), worldFaces.get(pair[1]), p);
        });
        List<List<Candidate>> results = perPair.collect(Collectors.toList());

        List<MatingInterface> interfaces = new ArrayList<>();
        Map<String, Integer> countPerPart = new LinkedHashMap<>();
        int nextId = 0;
        for (List<Candidate> pairResult : results) {
            for (Candidate c : pairResult) {
                interfaces.add(c.toInterface("interface-" + nextId++));
                countPerPart.merge(c.a().partId(), 1, Integer::sum);
                countPerPart.merge(c.b().partId(), 1, Integer::sum);
            }
        }

        List<String> junctionParts = countPerPart.entrySet().stream()
                .filter(e -> e.getValue() > 1)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());

        log.debug("配合界面识别完成：parts={}, pairs={}, interfaces={}, junctions={}",
                parts.size(), pairs.size(), interfaces.size(), junctionParts.size());
        return new Detection(interfaces, junctionParts);
    }

    private static List<Candidate> evaluatePair(AssemblyPart partA, List<WorldFace> facesA, AssemblyPart partB, List<WorldFace> facesB, DetectionParams p) {
        double maxProximity = Math.max(
                p.proximityThreshold() * p.proximityScale(),
                Math.max(diagonal(partA) * 0.5, diagonal(partB) * 0.5)
        );

        List<Candidate> candidates = new ArrayList<>();
        for (WorldFace faceA : facesA) {
            if (!isMatingSurface(faceA.type())) {
                continue;
            }
            for (WorldFace faceB : facesB) {
                if (!isMatingSurface(faceB.type())) {
                    continue;
                }

                double distance = faceA.center().distanceTo(faceB.center());
                if (distance > maxProximity) {
                    continue;
                }

                double alignment = faceA.normal().dot(faceB.normal());
                boolean opposingPlanes = faceA.type() == FaceType.PLANAR && faceB.type() == FaceType.PLANAR
                        && alignment < -p.candidateOpposingAlignment();
                boolean cylinders = faceA.type() == FaceType.CYLINDRICAL && faceB.type() == FaceType.CYLINDRICAL;
                if (!opposingPlanes && !cylinders) {
                    continue;
                }

                InterfaceType type = classify(faceA, faceB, alignment, p);
                if (type == InterfaceType.UNKNOWN) {
                    continue;
                }

                double contactArea = estimateContactArea(faceA, faceB, type, p);
                if (contactArea < p.minContactArea()) {
                    continue;
                }

                double score = Math.abs(alignment) * (1.0 / (1.0 + distance / p.scoreDistanceScale()));
                candidates.add(new Candidate(
                        new FaceRef(partA.id(), faceA.globalId()),
                        new FaceRef(partB.id(), faceB.globalId()),
                        type,
                        distance,
                        Math.abs(alignment),
                        contactArea,
                        faceA.center().midpoint(faceB.center()),
                        score
                ));
            }
        }

        // List.sort 是稳定排序：同分候选保持面遍历顺序
        candidates.sort(Comparator.comparingDouble(Candidate::score).reversed());
        if (candidates.size() > p.maxInterfacesPerPair()) {
            return new ArrayList<>(candidates.subList(0, Math.max(0, p.maxInterfacesPerPair())));
        }
        return candidates;
    }

    static InterfaceType classify(WorldFace a, WorldFace b, double alignment, DetectionParams p) {
        if (a.type() == FaceType.PLANAR && b.type() == FaceType.PLANAR && alignment < -p.faceToFaceAlignment()) {
            return InterfaceType.FACE_TO_FACE;
        }
        if (a.type() == FaceType.CYLINDRICAL && b.type() == FaceType.CYLINDRICAL
                && a.radius() != null && b.radius() != null
                && Math.abs(a.radius() - b.radius()) < p.pinRadiusTolerance()) {
            return InterfaceType.PIN_IN_HOLE;
        }
        boolean mixed = (a.type() == FaceType.CYLINDRICAL && b.type() == FaceType.PLANAR)
                || (a.type() == FaceType.PLANAR && b.type() == FaceType.CYLINDRICAL);
        if (mixed) {
            return InterfaceType.SHAFT_IN_BORE;
        }
        return InterfaceType.UNKNOWN;
    }

    /**
     * 估算（非测量）接触面积。
     */
    static double estimateContactArea(WorldFace a, WorldFace b, InterfaceType type, DetectionParams p) {
        return switch (type) {
            case FACE_TO_FACE -> p.faceContactArea();
            case PIN_IN_HOLE, SHAFT_IN_BORE -> {
                double r = (a.radius() != null) ? a.radius() : (b.radius() != null ? b.radius() : p.defaultCylinderRadius());
                yield Math.PI * r * r;
            }
            default -> p.fallbackContactArea();
        };
    }

    private static boolean isMatingSurface(FaceType type) {
        return type == FaceType.PLANAR || type == FaceType.CYLINDRICAL;
    }

    private static double diagonal(AssemblyPart part) {
        return part.boundingBox() == null ? DEFAULT_DIAGONAL : part.boundingBox().diagonal();
    }

    private static List<WorldFace> toWorld(AssemblyPart part) {
        double[] m = Transforms.isValid(part.transform()) ? part.transform() : Transforms.identity();
        List<WorldFace> result = new ArrayList<>(part.faces().size());
        for (PartFace face : part.faces()) {
            result.add(new WorldFace(
                    face.globalId(),
                    face.faceType(),
                    Transforms.transformPoint(face.center(), m),
                    Transforms.transformDirection(face.normal(), m),
                    face.radius()
            ));
        }
        return result;
    }

    /**
     * 世界坐标下的面。
     */
    record WorldFace(String globalId, FaceType type, Vec3 center, Vec3 normal, Double radius) {
    }

    private record Candidate(
            FaceRef a,
            FaceRef b,
            InterfaceType type,
            double distance,
            double alignment,
            double contactArea,
            Vec3 contactPoint,
            double score
    ) {
        MatingInterface toInterface(String id) {
            return new MatingInterface(
                    id,
                    a,
                    b,
                    type,
                    distance,
                    alignment,
                    contactArea,
                    type.suggestedTolerance(),
                    DistributionType.NORMAL,
                    contactPoint
            );
        }
    }
}
