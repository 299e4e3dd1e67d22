package org.stackup.mcp;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stackup.assembly.InterfaceType;
import org.stackup.config.StackupProperties;
import org.stackup.dto.assembly.AssemblyLoadResult;
import org.stackup.dto.assembly.ChainResult;
import org.stackup.dto.assembly.DocumentSaveResult;
import org.stackup.dto.assembly.InterfaceDetectionResult;
import org.stackup.dto.assembly.PartSummary;
import org.stackup.dto.assembly.PathQueryResult;
import org.stackup.dto.tolerance.StackupCalculationResult;
import org.stackup.persist.StackupDocumentCodec;
import org.stackup.session.AssemblySessionStore;
import org.stackup.tolerance.MonteCarloSimulator;
import org.stackup.tolerance.ToleranceStackupCalculator;
import org.stackup.workspace.WorkspacePathResolver;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StackupMcpToolsTest {

    private static final String LINKS = """
            [
              {"id": "housing", "name": "壳体", "nominal": 25, "plusTolerance": 0.1, "minusTolerance": 0.1},
              {"id": "shim", "name": "垫片", "nominal": 0.5, "plusTolerance": 0.05, "minusTolerance": 0.05, "direction": "negative"},
              {"id": "shaft", "name": "轴", "nominal": 30, "plusTolerance": 0.15, "minusTolerance": 0.15}
            ]
            """;

    /**
     * 三个单位立方体沿 x 轴排列，相邻面重合；d 远离其他零件。
     */
    private static final String PARTS = """
            [
              {"id": "a", "name": "底座", "boundingBox": {"min": [0,0,0], "max": [1,1,1]},
               "faces": [{"id": 1, "faceType": "planar", "normal": [1,0,0], "center": [1,0.5,0.5], "area": 1}]},
              {"id": "b", "name": "隔套", "transform": [1,0,0,0, 0,1,0,0, 0,0,1,0, 1,0,0,1],
               "boundingBox": {"min": [0,0,0], "max": [1,1,1]},
               "faces": [{"id": 1, "faceType": "planar", "normal": [-1,0,0], "center": [0,0.5,0.5], "area": 1},
                         {"id": 2, "faceType": "planar", "normal": [1,0,0], "center": [1,0.5,0.5], "area": 1}]},
              {"id": "c", "name": "端盖", "transform": [1,0,0,0, 0,1,0,0, 0,0,1,0, 2,0,0,1],
               "boundingBox": {"min": [0,0,0], "max": [1,1,1]},
               "faces": [{"id": 1, "faceType": "planar", "normal": [-1,0,0], "center": [0,0.5,0.5], "area": 1}]},
              {"id": "d", "name": "铭牌", "transform": [1,0,0,0, 0,1,0,0, 0,0,1,0, 0,500,0,1],
               "boundingBox": {"min": [0,0,0], "max": [1,1,1]}}
            ]
            """;

    @TempDir
    Path workspace;

    private StackupMcpTools tools;

    @BeforeEach
    void setUp() {
        StackupProperties properties = new StackupProperties();
        properties.setRoots(List.of(workspace.toString()));
        properties.setMonteCarloDefaultSamples(2_000);
        properties.setMonteCarloMaxSamples(5_000);
        // 粗筛距离退化为对角线一半，a 与 c 不再成对
        properties.setProximityThreshold(0.001);

        tools = new StackupMcpTools(
                properties,
                new ToleranceStackupCalculator(new MonteCarloSimulator(MonteCarloSimulator.Settings.defaults())),
                new AssemblySessionStore(Duration.ofMinutes(5), 8),
                new WorkspacePathResolver(properties),
                new StackupDocumentCodec()
        );
    }

    @Test
    void calculateStackup_returnsResultInsightsAndTruncationWarning() {
        StackupCalculationResult result = tools.calculateStackup(LINKS, 54.5, 0.25, 0.25, true, 50_000, 7L);

        assertThat(result.result().totalNominal()).isCloseTo(54.5, within(1e-9));
        assertThat(result.result().monteCarlo().sampleSize()).isEqualTo(5_000);
        assertThat(result.result().meetsSpec()).isTrue();
        assertThat(result.insights()).isNotEmpty();
        assertThat(result.warnings()).singleElement().asString().contains("截断");
    }

    @Test
    void calculateStackup_isReproducibleWithSeed() {
        StackupCalculationResult first = tools.calculateStackup(LINKS, null, null, null, null, null, 42L);
        StackupCalculationResult second = tools.calculateStackup(LINKS, null, null, null, null, null, 42L);

        assertThat(first.result().monteCarlo()).isEqualTo(second.result().monteCarlo());
        assertThat(first.warnings()).isNull();
    }

    @Test
    void calculateStackup_rejectsPartialTargetSpecAndBadJson() {
        assertThatThrownBy(() -> tools.calculateStackup(LINKS, 54.5, null, null, false, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("targetNominal");
        assertThatThrownBy(() -> tools.calculateStackup("[{\"nominal\": 1}]", null, null, null, false, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("links[0].plusTolerance");
        assertThatThrownBy(() -> tools.calculateStackup(LINKS, null, null, null, true, 0, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("samples");
    }

    @Test
    void listStandardFits_filtersByDesignation() {
        assertThat(tools.listStandardFits(null).fits()).hasSize(7);
        assertThat(tools.listStandardFits("h7/s6").fits()).singleElement()
                .satisfies(fit -> assertThat(fit.designation()).isEqualTo("H7/s6"));
        assertThatThrownBy(() -> tools.listStandardFits("X1/y2")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void detectInterfaces_findsBothJointsWithoutSession() {
        InterfaceDetectionResult result = tools.detectInterfaces(PARTS, null, null, null);

        assertThat(result.partCount()).isEqualTo(4);
        assertThat(result.interfaces()).hasSize(2);
        assertThat(result.interfaces()).allMatch(i -> i.interfaceType() == InterfaceType.FACE_TO_FACE);
        assertThat(result.junctionParts()).containsExactly("b");
    }

    @Test
    void assemblyWorkflow_loadPathGenerateCalculateSaveOpen() throws Exception {
        AssemblyLoadResult loaded = tools.loadAssembly(PARTS, null, null, null);
        String graphId = loaded.graphId();

        assertThat(loaded.parts()).extracting(PartSummary::id).containsExactly("a", "b", "c", "d");
        assertThat(loaded.parts()).filteredOn(PartSummary::junction).extracting(PartSummary::id).containsExactly("b");
        assertThat(loaded.parts()).allMatch(p -> p.color() != null);
        assertThat(loaded.interfaceCount()).isEqualTo(2);
        assertThat(loaded.bounds().max().y()).isEqualTo(501.0);

        PathQueryResult path = tools.findPath(graphId, "a", "c");
        assertThat(path.found()).isTrue();
        assertThat(path.path()).containsExactly("a", "b", "c");
        assertThat(tools.findPath(graphId, "a", "d").found()).isFalse();
        assertThatThrownBy(() -> tools.findPath(graphId, "a", "zz")).isInstanceOf(IllegalArgumentException.class);

        ChainResult generated = tools.autoGenerateChain(graphId, null, "a", "c", null, null);
        assertThat(generated.chain().id()).isEqualTo("chain-1");
        assertThat(generated.chain().name()).isEqualTo("底座 → 端盖");
        assertThat(generated.chain().links()).hasSize(5);
        assertThatThrownBy(() -> tools.autoGenerateChain(graphId, "path", "a", "d", null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("不连通");

        ChainResult calculated = tools.calculateChain(graphId, "chain-1", null, null, null, null, true, 1_000, 3L);
        assertThat(calculated.chain().isCalculated()).isTrue();
        assertThat(calculated.chain().result().linkCount()).isEqualTo(5);
        assertThat(calculated.insights()).isNotNull();

        DocumentSaveResult saved = tools.saveAssembly(graphId, null, "out/gearbox.json", null);
        assertThat(saved.path()).isEqualTo("out/gearbox.json");
        assertThat(saved.bytesWritten()).isEqualTo(Files.size(workspace.resolve("out/gearbox.json")));
        assertThatThrownBy(() -> tools.saveAssembly(graphId, null, "../escape.json", true))
                .isInstanceOf(IllegalArgumentException.class);

        AssemblyLoadResult reopened = tools.openAssembly(null, "out/gearbox.json");
        assertThat(reopened.graphId()).isNotEqualTo(graphId);
        assertThat(reopened.rootId()).isEqualTo("root0");
        assertThat(reopened.chainIds()).containsExactly("chain-1");
        assertThat(reopened.parts()).extracting(PartSummary::id).containsExactly("a", "b", "c", "d");
    }

    @Test
    void overviewChain_coversAllParts() {
        String graphId = tools.loadAssembly(PARTS, null, null, null).graphId();

        ChainResult overview = tools.autoGenerateChain(graphId, "overview", null, null, "ov", null);

        assertThat(overview.chain().name()).isEqualTo("装配概览");
        assertThat(overview.chain().links()).hasSize(6);
        assertThatThrownBy(() -> tools.autoGenerateChain(graphId, "spiral", null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void calculateChain_replacesLinksAndRequiresKnownChain() {
        String graphId = tools.loadAssembly(PARTS, null, null, null).graphId();
        tools.autoGenerateChain(graphId, "path", "a", "b", "ab", "底座-隔套");

        ChainResult result = tools.calculateChain(graphId, "ab", LINKS, null, null, null, false, null, null);

        assertThat(result.chain().links()).hasSize(3);
        assertThat(result.chain().result().monteCarlo()).isNull();
        assertThatThrownBy(() -> tools.calculateChain(graphId, "nope", null, null, null, null, false, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> tools.calculateChain("no-such-graph", "ab", null, null, null, null, false, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("graphId");
    }
}
