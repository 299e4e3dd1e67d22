package org.stackup.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import org.stackup.assembly.InterfaceDetector;

import java.time.Duration;
import java.util.List;

/**
 * 公差叠加 MCP Server 的业务配置（{@code app.stackup.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>配合界面识别用到的经验常量全部在这里具名，可按装配尺度覆盖。</li>
 *   <li>Monte Carlo 的样本上限、分箱数与并行 worker 数控制单次计算的耗时与内存。</li>
 *   <li>{@link #roots} 限定 {@code assembly_save}/{@code assembly_open} 能访问的目录。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.stackup")
public class StackupProperties {

    /**
     * 允许读写装配文档的根目录白名单（自动分配 rootId：root0、root1...）。
     */
    @NotNull
    private List<String> roots = List.of(".");

    /**
     * 是否允许 {@code assembly_save} 写文件。
     */
    private boolean allowWrite = true;

    /**
     * 是否允许访问符号链接（默认不允许，防止路径逃逸）。
     */
    private boolean allowSymlink = false;

    /**
     * 接近度阈值（mm）。乘以 {@link #proximityScale} 后作为粗筛距离下限。
     */
    @DecimalMin("0.0")
    private double proximityThreshold = 2.0;

    /**
     * 法向对齐阈值。当前分类逻辑不使用，仅透传。
     */
    @DecimalMin("0.0")
    private double normalThreshold = 0.95;

    /**
     * 最小接触面积（mm²），低于该值的候选丢弃。
     */
    @DecimalMin("0.0")
    private double minContactArea = 1.0;

    @DecimalMin("0.0")
    private double candidateOpposingAlignment = 0.8;

    @DecimalMin("0.0")
    private double faceToFaceAlignment = 0.9;

    /**
     * pin_in_hole 判定的半径差上限（mm）。
     */
    @DecimalMin("0.0")
    private double pinRadiusTolerance = 0.5;

    @DecimalMin("0.0")
    private double proximityScale = 50.0;

    @DecimalMin(value = "0.0", inclusive = false)
    private double scoreDistanceScale = 10.0;

    @Min(1)
    @Max(1_000)
    private int maxInterfacesPerPair = 10;

    @DecimalMin("0.0")
    private double faceContactArea = 10.0;

    @DecimalMin("0.0")
    private double defaultCylinderRadius = 5.0;

    @DecimalMin("0.0")
    private double fallbackContactArea = 1.0;

    /**
     * 是否并行评估零件对（结果与串行一致）。
     */
    private boolean detectionParallel = false;

    /**
     * Monte Carlo 默认样本数。
     */
    @Min(1)
    @Max(10_000_000)
    private int monteCarloDefaultSamples = 10_000;

    /**
     * 单次请求允许的最大样本数（上限保护）。
     */
    @Min(1)
    @Max(10_000_000)
    private int monteCarloMaxSamples = 1_000_000;

    @Min(1)
    @Max(10_000)
    private int histogramBins = 50;

    /**
     * Monte Carlo 并行采样 worker 数（1 表示单线程）。
     */
    @Min(1)
    @Max(256)
    private int monteCarloWorkers = 1;

    /**
     * 固定随机种子（为空时每次计算使用不同随机流；请求参数里的 seed 优先）。
     */
    private Long monteCarloSeed;

    /**
     * 已加载装配图的会话有效期（最后一次访问起算）。
     */
    @NotNull
    private Duration sessionTtl = Duration.ofMinutes(30);

    @Min(1)
    @Max(10_000)
    private int sessionMaxGraphs = 64;

    public List<String> getRoots() {
        return roots;
    }

    public void setRoots(List<String> roots) {
        this.roots = roots;
    }

    public boolean isAllowWrite() {
        return allowWrite;
    }

    public void setAllowWrite(boolean allowWrite) {
        this.allowWrite = allowWrite;
    }

    public boolean isAllowSymlink() {
        return allowSymlink;
    }

    public void setAllowSymlink(boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
    }

    public double getProximityThreshold() {
        return proximityThreshold;
    }

    public void setProximityThreshold(double proximityThreshold) {
        this.proximityThreshold = proximityThreshold;
    }

    public double getNormalThreshold() {
        return normalThreshold;
    }

    public void setNormalThreshold(double normalThreshold) {
        this.normalThreshold = normalThreshold;
    }

    public double getMinContactArea() {
        return minContactArea;
    }

    public void setMinContactArea(double minContactArea) {
        this.minContactArea = minContactArea;
    }

    public double getCandidateOpposingAlignment() {
        return candidateOpposingAlignment;
    }

    public void setCandidateOpposingAlignment(double candidateOpposingAlignment) {
        this.candidateOpposingAlignment = candidateOpposingAlignment;
    }

    public double getFaceToFaceAlignment() {
        return faceToFaceAlignment;
    }

    public void setFaceToFaceAlignment(double faceToFaceAlignment) {
        this.faceToFaceAlignment = faceToFaceAlignment;
    }

    public double getPinRadiusTolerance() {
        return pinRadiusTolerance;
    }

    public void setPinRadiusTolerance(double pinRadiusTolerance) {
        this.pinRadiusTolerance = pinRadiusTolerance;
    }

    public double getProximityScale() {
        return proximityScale;
    }

    public void setProximityScale(double proximityScale) {
        this.proximityScale = proximityScale;
    }

    public double getScoreDistanceScale() {
        return scoreDistanceScale;
    }

    public void setScoreDistanceScale(double scoreDistanceScale) {
        this.scoreDistanceScale = scoreDistanceScale;
    }

    public int getMaxInterfacesPerPair() {
        return maxInterfacesPerPair;
    }

    public void setMaxInterfacesPerPair(int maxInterfacesPerPair) {
        this.maxInterfacesPerPair = maxInterfacesPerPair;
    }

    public double getFaceContactArea() {
        return faceContactArea;
    }

    public void setFaceContactArea(double faceContactArea) {
        this.faceContactArea = faceContactArea;
    }

    public double getDefaultCylinderRadius() {
        return defaultCylinderRadius;
    }

    public void setDefaultCylinderRadius(double defaultCylinderRadius) {
        this.defaultCylinderRadius = defaultCylinderRadius;
    }

    public double getFallbackContactArea() {
        return fallbackContactArea;
    }

    public void setFallbackContactArea(double fallbackContactArea) {
        this.fallbackContactArea = fallbackContactArea;
    }

    public boolean isDetectionParallel() {
        return detectionParallel;
    }

    public void setDetectionParallel(boolean detectionParallel) {
        this.detectionParallel = detectionParallel;
    }

    public int getMonteCarloDefaultSamples() {
        return monteCarloDefaultSamples;
    }

    public void setMonteCarloDefaultSamples(int monteCarloDefaultSamples) {
        this.monteCarloDefaultSamples = monteCarloDefaultSamples;
    }

    public int getMonteCarloMaxSamples() {
        return monteCarloMaxSamples;
    }

    public void setMonteCarloMaxSamples(int monteCarloMaxSamples) {
        this.monteCarloMaxSamples = monteCarloMaxSamples;
    }

    public int getHistogramBins() {
        return histogramBins;
    }

    public void setHistogramBins(int histogramBins) {
        this.histogramBins = histogramBins;
    }

    public int getMonteCarloWorkers() {
        return monteCarloWorkers;
    }

    public void setMonteCarloWorkers(int monteCarloWorkers) {
        this.monteCarloWorkers = monteCarloWorkers;
    }

    public Long getMonteCarloSeed() {
        return monteCarloSeed;
    }

    public void setMonteCarloSeed(Long monteCarloSeed) {
        this.monteCarloSeed = monteCarloSeed;
    }

    public Duration getSessionTtl() {
        return sessionTtl;
    }

    public void setSessionTtl(Duration sessionTtl) {
        this.sessionTtl = sessionTtl;
    }

    public int getSessionMaxGraphs() {
        return sessionMaxGraphs;
    }

    public void setSessionMaxGraphs(int sessionMaxGraphs) {
        this.sessionMaxGraphs = sessionMaxGraphs;
    }

    /**
     * 转换为识别器参数。
     */
    public InterfaceDetector.DetectionParams toDetectionParams() {
        return new InterfaceDetector.DetectionParams(
                proximityThreshold,
                normalThreshold,
                minContactArea,
                candidateOpposingAlignment,
                faceToFaceAlignment,
                pinRadiusTolerance,
                proximityScale,
                scoreDistanceScale,
                maxInterfacesPerPair,
                faceContactArea,
                defaultCylinderRadius,
                fallbackContactArea,
                detectionParallel
        );
    }
}
