package org.stackup.tolerance;

/**
 * 公差链中的一个环节（一个带符号、带公差的尺寸或间隙）。
 * <p>
 * 约定：
 * <ul>
 *   <li>{@code plusTolerance}/{@code minusTolerance} 均以非负幅值存储。</li>
 *   <li>{@code sigma} 表示给定公差覆盖的标准差倍数（默认 3），仅影响正态分布环节。</li>
 *   <li>记录不可变；编辑通过 {@code with*} 生成新实例。</li>
 * </ul>
 *
 * @param id             环节 id
 * @param type           语义类型
 * @param name           显示名称
 * @param partId         来源零件（可为空）
 * @param interfaceId    来源配合界面（可为空）
 * @param faceId         来源面（可为空）
 * @param nominal        名义值（mm，带符号）
 * @param plusTolerance  上偏差
 * @param minusTolerance 下偏差
 * @param direction      贡献方向
 * @param distribution   分布假设
 * @param sigma          公差对应的标准差倍数
 */
public record ChainLink(
        String id,
        LinkType type,
        String name,
        String partId,
        String interfaceId,
        String faceId,
        double nominal,
        double plusTolerance,
        double minusTolerance,
        ContributionDirection direction,
        DistributionType distribution,
        double sigma
) {

    public static final double DEFAULT_TOLERANCE = 0.1;
    public static final double DEFAULT_SIGMA = 3.0;

    /**
     * 按默认值创建环节：±0.1、正向、正态分布、3σ。
     */
    public static ChainLink create(String id, LinkType type, String name, double nominal) {
        return new ChainLink(
                id,
                type,
                name,
                null,
                null,
                null,
                nominal,
                DEFAULT_TOLERANCE,
                DEFAULT_TOLERANCE,
                ContributionDirection.POSITIVE,
                DistributionType.NORMAL,
                DEFAULT_SIGMA
        );
    }

    public double sign() {
        return direction == ContributionDirection.NEGATIVE ? -1.0 : 1.0;
    }

    public double signedNominal() {
        return sign() * nominal;
    }

    public double totalTolerance() {
        return plusTolerance + minusTolerance;
    }

    public ChainLink withNominal(double value) {
        return new ChainLink(id, type, name, partId, interfaceId, faceId, value, plusTolerance, minusTolerance, direction, distribution, sigma);
    }

    public ChainLink withTolerances(double plus, double minus) {
        return new ChainLink(id, type, name, partId, interfaceId, faceId, nominal, plus, minus, direction, distribution, sigma);
    }

    public ChainLink withDirection(ContributionDirection value) {
        return new ChainLink(id, type, name, partId, interfaceId, faceId, nominal, plusTolerance, minusTolerance, value, distribution, sigma);
    }

    public ChainLink withDistribution(DistributionType value, double newSigma) {
        return new ChainLink(id, type, name, partId, interfaceId, faceId, nominal, plusTolerance, minusTolerance, direction, value, newSigma);
    }

    public ChainLink withSource(String newPartId, String newInterfaceId, String newFaceId) {
        return new ChainLink(id, type, name, newPartId, newInterfaceId, newFaceId, nominal, plusTolerance, minusTolerance, direction, distribution, sigma);
    }
}
