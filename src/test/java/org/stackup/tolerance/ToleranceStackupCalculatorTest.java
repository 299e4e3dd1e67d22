package org.stackup.tolerance;

import org.junit.jupiter.api.Test;
import org.stackup.dto.tolerance.ToleranceResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ToleranceStackupCalculatorTest {

    private final ToleranceStackupCalculator calculator = new ToleranceStackupCalculator();

    @Test
    void calculate_combinesAllAnalyses() {
        ToleranceResult result = calculator.calculate(
                StackupFixtures.housingShimShaft(),
                ToleranceStackupCalculator.Options.defaults().withRandom(RandomSource.seeded(5))
        );

        assertThat(result.totalNominal()).isCloseTo(54.5, within(1e-9));
        assertThat(result.linkCount()).isEqualTo(3);
        assertThat(result.worstCase().tolerance()).isCloseTo(0.3, within(1e-9));
        assertThat(result.rss().tolerance()).isCloseTo(0.1871, within(1e-4));
        assertThat(result.monteCarlo()).isNotNull();
        assertThat(result.monteCarlo().sampleSize()).isEqualTo(MonteCarloSimulator.DEFAULT_SAMPLES);
        assertThat(result.contributions()).hasSize(3);
        assertThat(result.targetSpec()).isNull();
        assertThat(result.meetsSpec()).isNull();
        assertThat(result.margin()).isNull();
    }

    @Test
    void calculate_rssBoundsNestInsideWorstCase() {
        ToleranceResult result = calculator.calculate(
                StackupFixtures.housingShimShaft(),
                ToleranceStackupCalculator.Options.defaults().withoutMonteCarlo()
        );

        assertThat(result.worstCase().min()).isLessThanOrEqualTo(result.rss().min());
        assertThat(result.rss().min()).isLessThanOrEqualTo(result.totalNominal());
        assertThat(result.totalNominal()).isLessThanOrEqualTo(result.rss().max());
        assertThat(result.rss().max()).isLessThanOrEqualTo(result.worstCase().max());
        assertThat(result.monteCarlo()).isNull();
    }

    @Test
    void calculate_isInvariantUnderLinkReordering() {
        List<ChainLink> shuffled = new ArrayList<>(StackupFixtures.housingShimShaft());
        Collections.reverse(shuffled);
        ToleranceStackupCalculator.Options options = ToleranceStackupCalculator.Options.defaults().withoutMonteCarlo();

        ToleranceResult original = calculator.calculate(StackupFixtures.housingShimShaft(), options);
        ToleranceResult reordered = calculator.calculate(shuffled, options);

        assertThat(reordered.totalNominal()).isCloseTo(original.totalNominal(), within(1e-12));
        assertThat(reordered.worstCase().min()).isCloseTo(original.worstCase().min(), within(1e-12));
        assertThat(reordered.worstCase().max()).isCloseTo(original.worstCase().max(), within(1e-12));
        assertThat(reordered.rss().tolerance()).isCloseTo(original.rss().tolerance(), within(1e-12));
    }

    @Test
    void calculate_marginUsesRssBounds() {
        TargetSpec spec = new TargetSpec(54.5, 0.25, 0.25);

        ToleranceResult result = calculator.calculate(
                StackupFixtures.housingShimShaft(),
                ToleranceStackupCalculator.Options.defaults().withTargetSpec(spec).withRandom(RandomSource.seeded(11))
        );

        // worst-case ±0.3 超出规格，但 RSS ±0.187 在规格内
        assertThat(result.meetsSpec()).isTrue();
        assertThat(result.margin()).isCloseTo(0.25 - result.rss().tolerance(), within(1e-9));
        assertThat(result.monteCarlo().cpk()).isGreaterThan(1.0);
    }

    @Test
    void calculate_reportsSpecViolation() {
        TargetSpec spec = new TargetSpec(54.5, 0.1, 0.1);

        ToleranceResult result = calculator.calculate(
                StackupFixtures.housingShimShaft(),
                ToleranceStackupCalculator.Options.defaults().withTargetSpec(spec).withoutMonteCarlo()
        );

        assertThat(result.meetsSpec()).isFalse();
        assertThat(result.margin()).isNegative();
    }

    @Test
    void calculate_emptyChainIsZeroNotError() {
        ToleranceResult result = calculator.calculate(List.of(), ToleranceStackupCalculator.Options.defaults().withoutMonteCarlo());

        assertThat(result.totalNominal()).isZero();
        assertThat(result.linkCount()).isZero();
        assertThat(result.contributions()).isEmpty();
    }

    @Test
    void calculate_rejectsNegativeToleranceAndNonPositiveSigma() {
        List<ChainLink> links = List.of(
                StackupFixtures.link("neg", 10, -0.1, 0.1, ContributionDirection.POSITIVE),
                StackupFixtures.link("sig", 10, 0.1, 0.1, ContributionDirection.POSITIVE).withDistribution(DistributionType.NORMAL, 0)
        );

        assertThatThrownBy(() -> calculator.calculate(links, ToleranceStackupCalculator.Options.defaults()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("plusTolerance")
                .hasMessageContaining("sigma");
    }

    @Test
    void calculate_rejectsNonFiniteNominal() {
        List<ChainLink> links = List.of(StackupFixtures.link("nan", Double.NaN, 0.1, 0.1, ContributionDirection.POSITIVE));

        assertThatThrownBy(() -> calculator.calculate(links, ToleranceStackupCalculator.Options.defaults()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nominal");
    }

    @Test
    void calculate_chainStoresResultAndEditClearsIt() {
        ToleranceChain chain = ToleranceChain.create("c1", "测试链").withLinks(StackupFixtures.housingShimShaft());

        ToleranceChain calculated = calculator.calculate(chain, ToleranceStackupCalculator.Options.defaults().withoutMonteCarlo());

        assertThat(calculated.isCalculated()).isTrue();
        assertThat(calculated.isComplete()).isTrue();
        assertThat(calculated.removeLink("shim").isCalculated()).isFalse();
    }
}
