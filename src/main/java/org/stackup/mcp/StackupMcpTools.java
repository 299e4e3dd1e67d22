package org.stackup.mcp;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;
import org.stackup.assembly.AssemblyGraph;
import org.stackup.assembly.AssemblyGraphBuilder;
import org.stackup.assembly.AssemblyPart;
import org.stackup.assembly.ChainAutoGenerator;
import org.stackup.assembly.InterfaceDetector;
import org.stackup.config.StackupProperties;
import org.stackup.dto.assembly.AssemblyLoadResult;
import org.stackup.dto.assembly.ChainResult;
import org.stackup.dto.assembly.DocumentSaveResult;
import org.stackup.dto.assembly.InterfaceDetectionResult;
import org.stackup.dto.assembly.PartSummary;
import org.stackup.dto.assembly.PathQueryResult;
import org.stackup.dto.tolerance.StackupCalculationResult;
import org.stackup.dto.tolerance.StandardFitsResult;
import org.stackup.dto.tolerance.ToleranceResult;
import org.stackup.json.StackupJsonParser;
import org.stackup.persist.StackupDocumentCodec;
import org.stackup.session.AssemblySessionStore;
import org.stackup.tolerance.ChainLink;
import org.stackup.tolerance.RandomSource;
import org.stackup.tolerance.StackupInsights;
import org.stackup.tolerance.StandardFits;
import org.stackup.tolerance.TargetSpec;
import org.stackup.tolerance.ToleranceChain;
import org.stackup.tolerance.ToleranceStackupCalculator;
import org.stackup.workspace.WorkspacePathResolver;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 公差叠加 / 装配配合界面 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>独立的公差链计算（{@code stackup_calculate}）与标准配合查询（{@code stackup_list_standard_fits}）。</li>
 *   <li>配合界面识别（{@code assembly_detect_interfaces}，无状态）。</li>
 *   <li>装配图会话：{@code assembly_load} 建图后返回 graphId，再做路径查询、公差链生成与计算。</li>
 *   <li>装配图文档读写（{@code assembly_save} / {@code assembly_open}），仅限 {@code app.stackup.roots} 白名单内。</li>
 * </ul>
 * <p>
 * 参数中的零件/环节以 JSON 字符串传入，统一由 {@link StackupJsonParser} 解析；格式错误会一次性列出全部问题。
 */
@Component
public class StackupMcpTools {

    private static final Logger log = LoggerFactory.getLogger(StackupMcpTools.class);

    private static final String MODE_PATH = "path";
    private static final String MODE_OVERVIEW = "overview";

    private final StackupProperties properties;
    private final ToleranceStackupCalculator calculator;
    private final AssemblySessionStore sessionStore;
    private final WorkspacePathResolver pathResolver;
    private final StackupDocumentCodec documentCodec;

    public StackupMcpTools(
            StackupProperties properties,
            ToleranceStackupCalculator calculator,
            AssemblySessionStore sessionStore,
            WorkspacePathResolver pathResolver,
            StackupDocumentCodec documentCodec
    ) {
        this.properties = properties;
        this.calculator = calculator;
        this.sessionStore = sessionStore;
        this.pathResolver = pathResolver;
        this.documentCodec = documentCodec;
    }

    @Tool(
            name = "stackup_calculate",
            description = "计算一维公差叠加：worst-case、RSS、Monte Carlo（可选）与各环节贡献度；可传目标规格判断是否满足。"
    )
    /**
     * 独立计算一条公差链（不依赖装配图会话）。
     * <p>
     * 目标规格三个参数需同时给出；只给 targetNominal 时视为参数错误。
     */
    public StackupCalculationResult calculateStackup(
            @ToolParam(description = "环节 JSON 数组，例如 [{\"id\":\"a\",\"name\":\"壳体\",\"nominal\":25,\"plusTolerance\":0.1,\"minusTolerance\":0.1,\"direction\":\"positive\",\"distribution\":\"normal\",\"sigma\":3}]") String linksJson,
            @ToolParam(required = false, description = "目标规格名义值") Double targetNominal,
            @ToolParam(required = false, description = "目标规格上偏差（非负）") Double targetPlusTolerance,
            @ToolParam(required = false, description = "目标规格下偏差（非负）") Double targetMinusTolerance,
            @ToolParam(required = false, description = "是否运行 Monte Carlo（默认 true）") Boolean runMonteCarlo,
            @ToolParam(required = false, description = "Monte Carlo 样本数（默认 app.stackup.monte-carlo-default-samples）") Integer samples,
            @ToolParam(required = false, description = "随机种子（给定时结果可复现）") Long seed
    ) {
        List<ChainLink> links = StackupJsonParser.parseLinks(linksJson).orElseThrow("linksJson");
        List<String> warnings = new ArrayList<>();
        ToleranceStackupCalculator.Options options = resolveOptions(
                targetNominal, targetPlusTolerance, targetMinusTolerance, runMonteCarlo, samples, seed, warnings);

        log.info("stackup_calculate：links={}, monteCarlo={}, samples={}", links.size(), options.runMonteCarlo(), options.monteCarloSamples());
        ToleranceResult result = calculator.calculate(links, options);
        return new StackupCalculationResult(result, StackupInsights.generate(result), warnings.isEmpty() ? null : warnings);
    }

    @Tool(
            name = "stackup_list_standard_fits",
            description = "列出常用 ISO 孔轴配合（H7/g6 等）的孔/轴偏差（mm）；可按配合代号查询单个。"
    )
    public StandardFitsResult listStandardFits(
            @ToolParam(required = false, description = "配合代号，例如 H7/g6（大小写与斜杠不敏感）；为空返回全部") String designation
    ) {
        if (designation == null || designation.isBlank()) {
            return new StandardFitsResult(StandardFits.all());
        }
        StandardFits.Fit fit = StandardFits.find(designation)
                .orElseThrow(() -> new IllegalArgumentException("未知的配合代号：" + designation));
        return new StandardFitsResult(List.of(fit));
    }

    @Tool(
            name = "assembly_detect_interfaces",
            description = "对装配零件做面-面几何比较，识别配合界面（face_to_face / pin_in_hole / shaft_in_bore），不保存会话。"
    )
    public InterfaceDetectionResult detectInterfaces(
            @ToolParam(description = "零件 JSON 数组（id/name/transform[16]/boundingBox/faces[]）") String partsJson,
            @ToolParam(required = false, description = "接近度阈值（mm，默认 app.stackup.proximity-threshold）") Double proximityThreshold,
            @ToolParam(required = false, description = "法向对齐阈值（默认 app.stackup.normal-threshold）") Double normalThreshold,
            @ToolParam(required = false, description = "最小接触面积（mm²，默认 app.stackup.min-contact-area）") Double minContactArea
    ) {
        List<AssemblyPart> parts = StackupJsonParser.parseParts(partsJson).orElseThrow("partsJson");
        InterfaceDetector.DetectionParams params = properties.toDetectionParams()
                .withThresholds(proximityThreshold, normalThreshold, minContactArea);

        log.info("assembly_detect_interfaces：parts={}", parts.size());
        InterfaceDetector.Detection detection = InterfaceDetector.detect(parts, params);

        List<String> warnings = new ArrayList<>();
        if (parts.size() < 2) {
            warnings.add("零件少于 2 个，无需识别配合界面。");
        }
        return new InterfaceDetectionResult(
                parts.size(),
                detection.interfaces(),
                detection.junctionParts(),
                warnings.isEmpty() ? null : warnings
        );
    }

    @Tool(
            name = "assembly_load",
            description = "加载装配：识别配合界面并构建装配图，返回 graphId（供路径查询、公差链生成与计算使用）。"
    )
    public AssemblyLoadResult loadAssembly(
            @ToolParam(description = "零件 JSON 数组（id/name/transform[16]/boundingBox/faces[]）") String partsJson,
            @ToolParam(required = false, description = "接近度阈值（mm）") Double proximityThreshold,
            @ToolParam(required = false, description = "法向对齐阈值") Double normalThreshold,
            @ToolParam(required = false, description = "最小接触面积（mm²）") Double minContactArea
    ) {
        List<AssemblyPart> parts = StackupJsonParser.parseParts(partsJson).orElseThrow("partsJson");
        InterfaceDetector.DetectionParams params = properties.toDetectionParams()
                .withThresholds(proximityThreshold, normalThreshold, minContactArea);

        InterfaceDetector.Detection detection = InterfaceDetector.detect(parts, params);
        AssemblyGraph graph = AssemblyGraphBuilder.build(parts, detection.interfaces());
        String graphId = sessionStore.put(graph);

        log.info("assembly_load：graphId={}, parts={}, interfaces={}", graphId, parts.size(), graph.interfaces().size());
        List<String> warnings = new ArrayList<>();
        if (graph.interfaces().isEmpty()) {
            warnings.add("未识别到配合界面；可尝试调大 proximityThreshold 或调小 minContactArea。");
        }
        return toLoadResult(graphId, null, null, graph, warnings);
    }

    @Tool(
            name = "assembly_find_path",
            description = "在装配图中查找两零件之间的最短零件路径（BFS），返回零件序列与经过的界面。"
    )
    public PathQueryResult findPath(
            @ToolParam(description = "graphId（assembly_load / assembly_open 返回）") String graphId,
            @ToolParam(description = "起点零件 id") String startPartId,
            @ToolParam(description = "终点零件 id") String endPartId
    ) {
        AssemblyGraph graph = sessionStore.require(graphId);
        requirePart(graph, startPartId);
        requirePart(graph, endPartId);

        AssemblyGraphBuilder.PathResult path = AssemblyGraphBuilder.findPath(graph, startPartId, endPartId);
        if (path == null) {
            return new PathQueryResult(graphId, startPartId, endPartId, false, List.of(), List.of());
        }
        return new PathQueryResult(graphId, startPartId, endPartId, true, path.path(), path.interfaces());
    }

    @Tool(
            name = "chain_auto_generate",
            description = "根据装配图自动生成公差链：mode=path 沿两零件最短路径生成；mode=overview 覆盖全部零件。生成的链保存到装配图中。"
    )
    /**
     * 自动生成公差链（未计算）。
     * <p>
     * path 模式下零件尺寸取包围盒最大边长、公差取名义值的 ±0.1%，界面间隙取识别出的接近度与建议公差；
     * 方向从正向开始交替。生成后请按实际图纸修正再调用 {@code chain_calculate}。
     */
    public ChainResult autoGenerateChain(
            @ToolParam(description = "graphId") String graphId,
            @ToolParam(required = false, description = "生成模式：path（默认）或 overview") String mode,
            @ToolParam(required = false, description = "起点零件 id（path 模式必填）") String startPartId,
            @ToolParam(required = false, description = "终点零件 id（path 模式必填）") String endPartId,
            @ToolParam(required = false, description = "链 id（为空自动生成 chain-<序号>）") String chainId,
            @ToolParam(required = false, description = "链名称") String name
    ) {
        AssemblyGraph graph = sessionStore.require(graphId);
        String resolvedMode = (mode == null || mode.isBlank()) ? MODE_PATH : mode.trim().toLowerCase(Locale.ROOT);
        String resolvedId = (chainId == null || chainId.isBlank()) ? "chain-" + (graph.chains().size() + 1) : chainId;

        ToleranceChain chain;
        if (MODE_PATH.equals(resolvedMode)) {
            requirePart(graph, startPartId);
            requirePart(graph, endPartId);
            String resolvedName = (name == null || name.isBlank())
                    ? graph.parts().get(startPartId).name() + " → " + graph.parts().get(endPartId).name()
                    : name;
            chain = ChainAutoGenerator.fromPath(graph, resolvedId, resolvedName, startPartId, endPartId);
            if (chain == null) {
                throw new IllegalArgumentException("零件之间不连通：" + startPartId + " -> " + endPartId);
            }
        } else if (MODE_OVERVIEW.equals(resolvedMode)) {
            chain = ChainAutoGenerator.overview(graph, resolvedId, (name == null || name.isBlank()) ? "装配概览" : name);
        } else {
            throw new IllegalArgumentException("不支持的 mode：" + mode + "（可选 path / overview）");
        }

        List<String> warnings = new ArrayList<>();
        if (graph.chains().containsKey(resolvedId)) {
            warnings.add("已覆盖同 id 的公差链：" + resolvedId);
        }
        if (!chain.isComplete()) {
            warnings.add("生成的链少于 2 个环节，计算结果意义有限。");
        }
        sessionStore.replace(graphId, graph.withChain(chain));

        log.info("chain_auto_generate：graphId={}, mode={}, chainId={}, links={}", graphId, resolvedMode, resolvedId, chain.links().size());
        return new ChainResult(graphId, chain, null, warnings.isEmpty() ? null : warnings);
    }

    @Tool(
            name = "chain_calculate",
            description = "计算装配图中已有公差链（可先用 linksJson 整体替换环节），结果写回装配图。"
    )
    public ChainResult calculateChain(
            @ToolParam(description = "graphId") String graphId,
            @ToolParam(description = "链 id") String chainId,
            @ToolParam(required = false, description = "替换用的环节 JSON 数组（格式同 stackup_calculate）；为空则使用链中现有环节") String linksJson,
            @ToolParam(required = false, description = "目标规格名义值") Double targetNominal,
            @ToolParam(required = false, description = "目标规格上偏差（非负）") Double targetPlusTolerance,
            @ToolParam(required = false, description = "目标规格下偏差（非负）") Double targetMinusTolerance,
            @ToolParam(required = false, description = "是否运行 Monte Carlo（默认 true）") Boolean runMonteCarlo,
            @ToolParam(required = false, description = "Monte Carlo 样本数") Integer samples,
            @ToolParam(required = false, description = "随机种子（给定时结果可复现）") Long seed
    ) {
        AssemblyGraph graph = sessionStore.require(graphId);
        ToleranceChain chain = graph.chains().get(chainId);
        if (chain == null) {
            throw new IllegalArgumentException("公差链不存在：" + chainId);
        }
        if (linksJson != null && !linksJson.isBlank()) {
            chain = chain.withLinks(StackupJsonParser.parseLinks(linksJson).orElseThrow("linksJson"));
        }

        List<String> warnings = new ArrayList<>();
        ToleranceStackupCalculator.Options options = resolveOptions(
                targetNominal, targetPlusTolerance, targetMinusTolerance, runMonteCarlo, samples, seed, warnings);
        ToleranceChain calculated = calculator.calculate(chain, options);
        sessionStore.replace(graphId, graph.withChain(calculated));

        log.info("chain_calculate：graphId={}, chainId={}, links={}", graphId, chainId, calculated.links().size());
        return new ChainResult(graphId, calculated, StackupInsights.generate(calculated.result()), warnings.isEmpty() ? null : warnings);
    }

    @Tool(
            name = "assembly_save",
            description = "把装配图（零件、界面、公差链）保存为 JSON 文档（仅限 app.stackup.roots 白名单内）。"
    )
    public DocumentSaveResult saveAssembly(
            @ToolParam(description = "graphId") String graphId,
            @ToolParam(required = false, description = "rootId（为空默认 root0）") String rootId,
            @ToolParam(description = "文件路径（相对 rootId 或绝对路径），例如 assemblies/gearbox.json") String path,
            @ToolParam(required = false, description = "目标已存在时是否覆盖（默认 false）") Boolean overwrite
    ) {
        if (!properties.isAllowWrite()) {
            throw new IllegalStateException("服务端未开启写入（app.stackup.allow-write=false）");
        }
        AssemblyGraph graph = sessionStore.require(graphId);
        WorkspacePathResolver.ResolvedPath resolved = pathResolver.resolveForWrite(rootId, path);

        long bytes;
        try {
            bytes = documentCodec.saveGraph(resolved.absolutePath(), graph, Boolean.TRUE.equals(overwrite));
        } catch (IOException e) {
            throw new IllegalStateException("保存装配文档失败：" + resolved.displayPath(), e);
        }
        log.info("assembly_save：graphId={}, path={}, bytes={}", graphId, resolved.displayPath(), bytes);
        return new DocumentSaveResult(
                graphId,
                resolved.rootId(),
                normalizeDisplayPath(resolved.displayPath()),
                StackupDocumentCodec.SCHEMA_VERSION,
                bytes
        );
    }

    @Tool(
            name = "assembly_open",
            description = "打开 assembly_save 保存的装配文档，重新放入会话并返回新的 graphId。"
    )
    public AssemblyLoadResult openAssembly(
            @ToolParam(required = false, description = "rootId（为空默认 root0）") String rootId,
            @ToolParam(description = "文件路径（相对 rootId 或绝对路径）") String path
    ) {
        WorkspacePathResolver.ResolvedPath resolved = pathResolver.resolveForRead(rootId, path);
        AssemblyGraph graph;
        try {
            graph = documentCodec.loadGraph(resolved.absolutePath());
        } catch (IOException e) {
            throw new IllegalStateException("读取装配文档失败：" + resolved.displayPath(), e);
        }
        String graphId = sessionStore.put(graph);

        log.info("assembly_open：graphId={}, path={}, parts={}", graphId, resolved.displayPath(), graph.parts().size());
        return toLoadResult(graphId, resolved.rootId(), normalizeDisplayPath(resolved.displayPath()), graph, new ArrayList<>());
    }

    private ToleranceStackupCalculator.Options resolveOptions(
            Double targetNominal,
            Double targetPlusTolerance,
            Double targetMinusTolerance,
            Boolean runMonteCarlo,
            Integer samples,
            Long seed,
            List<String> warnings
    ) {
        TargetSpec spec = resolveTargetSpec(targetNominal, targetPlusTolerance, targetMinusTolerance);

        int resolvedSamples = (samples == null) ? properties.getMonteCarloDefaultSamples() : samples;
        if (resolvedSamples < 1) {
            throw new IllegalArgumentException("samples 必须为正整数：" + resolvedSamples);
        }
        if (resolvedSamples > properties.getMonteCarloMaxSamples()) {
            warnings.add("samples 超过上限，已截断为 " + properties.getMonteCarloMaxSamples());
            resolvedSamples = properties.getMonteCarloMaxSamples();
        }

        Long resolvedSeed = (seed != null) ? seed : properties.getMonteCarloSeed();
        RandomSource random = (resolvedSeed == null) ? RandomSource.unseeded() : RandomSource.seeded(resolvedSeed);

        return new ToleranceStackupCalculator.Options(
                runMonteCarlo == null || runMonteCarlo,
                resolvedSamples,
                spec,
                random
        );
    }

    static TargetSpec resolveTargetSpec(Double nominal, Double plus, Double minus) {
        if (nominal == null && plus == null && minus == null) {
            return null;
        }
        if (nominal == null || plus == null || minus == null) {
            throw new IllegalArgumentException("目标规格需同时提供 targetNominal、targetPlusTolerance、targetMinusTolerance");
        }
        return new TargetSpec(nominal, plus, minus);
    }

    private static void requirePart(AssemblyGraph graph, String partId) {
        if (partId == null || partId.isBlank()) {
            throw new IllegalArgumentException("零件 id 不能为空");
        }
        if (!graph.parts().containsKey(partId)) {
            throw new IllegalArgumentException("零件不存在：" + partId);
        }
    }

    private static AssemblyLoadResult toLoadResult(String graphId, String rootId, String path, AssemblyGraph graph, List<String> warnings) {
        Set<String> junctions = AssemblyGraphBuilder.getJunctionParts(graph).stream()
                .map(AssemblyPart::id)
                .collect(Collectors.toSet());
        List<PartSummary> parts = new ArrayList<>(graph.parts().size());
        for (AssemblyPart part : graph.parts().values()) {
            parts.add(new PartSummary(
                    part.id(),
                    part.name(),
                    part.faces().size(),
                    part.color(),
                    graph.neighbors(part.id()),
                    junctions.contains(part.id())
            ));
        }
        return new AssemblyLoadResult(
                graphId,
                rootId,
                path,
                parts,
                graph.interfaces().size(),
                new ArrayList<>(graph.chains().keySet()),
                AssemblyGraphBuilder.calculateAssemblyBounds(new ArrayList<>(graph.parts().values())),
                warnings.isEmpty() ? null : warnings
        );
    }

    private static String normalizeDisplayPath(String path) {
        if (path == null) {
            return null;
        }
        return path.replace('\\', '/');
    }
}
