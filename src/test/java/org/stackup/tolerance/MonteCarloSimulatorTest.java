package org.stackup.tolerance;

import org.junit.jupiter.api.Test;
import org.stackup.dto.tolerance.HistogramBin;
import org.stackup.dto.tolerance.MonteCarloResult;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class MonteCarloSimulatorTest {

    private final MonteCarloSimulator simulator = new MonteCarloSimulator(MonteCarloSimulator.Settings.defaults());

    @Test
    void simulate_convergesToRssCenterAndSigma() {
        List<ChainLink> links = StackupFixtures.housingShimShaft();
        double rssSigma = RssAnalyzer.analyze(links).result().sigma();

        MonteCarloResult result = simulator.simulate(links, 200_000, null, RandomSource.seeded(42));

        assertThat(result.sampleSize()).isEqualTo(200_000);
        assertThat(result.mean()).isCloseTo(54.5, within(0.002));
        assertThat(result.stdDev()).isCloseTo(rssSigma, within(rssSigma * 0.02));
        assertThat(result.min()).isLessThanOrEqualTo(result.percentiles().p0_1());
        assertThat(result.percentiles().p50()).isCloseTo(54.5, within(0.005));
        assertThat(result.max()).isGreaterThanOrEqualTo(result.percentiles().p99_9());
        assertThat(result.cpk()).isEqualTo(1.0);
    }

    @Test
    void simulate_uniformLinkStaysWithinBand() {
        ChainLink link = StackupFixtures.link("u", 10, 0.2, 0.1, ContributionDirection.POSITIVE)
                .withDistribution(DistributionType.UNIFORM, 3);

        MonteCarloResult result = simulator.simulate(List.of(link), 20_000, null, RandomSource.seeded(7));

        assertThat(result.min()).isGreaterThanOrEqualTo(9.9);
        assertThat(result.max()).isLessThanOrEqualTo(10.2);
        assertThat(result.mean()).isCloseTo(10.05, within(0.005));
    }

    @Test
    void simulate_histogramPercentagesSumToHundred() {
        MonteCarloResult result = simulator.simulate(StackupFixtures.housingShimShaft(), 5_000, null, RandomSource.seeded(1));

        assertThat(result.histogram()).hasSize(50);
        assertThat(result.histogram().stream().mapToInt(HistogramBin::count).sum()).isEqualTo(5_000);
        assertThat(result.histogram().stream().mapToDouble(HistogramBin::percentage).sum()).isCloseTo(100.0, within(1e-9));
    }

    @Test
    void simulate_isReproducibleForSameSeedAndWorkerCount() {
        MonteCarloSimulator parallel = new MonteCarloSimulator(new MonteCarloSimulator.Settings(50, 4));
        List<ChainLink> links = StackupFixtures.housingShimShaft();

        MonteCarloResult first = parallel.simulate(links, 10_001, null, RandomSource.seeded(99));
        MonteCarloResult second = parallel.simulate(links, 10_001, null, RandomSource.seeded(99));

        assertThat(first).isEqualTo(second);
        assertThat(first.mean()).isCloseTo(54.5, within(0.01));
    }

    @Test
    void simulate_zeroToleranceChainHasSingleBinAndInfiniteCpk() {
        ChainLink exact = StackupFixtures.link("exact", 10, 0, 0, ContributionDirection.POSITIVE);

        MonteCarloResult inside = simulator.simulate(List.of(exact), 100, new TargetSpec(10, 0.1, 0.1), RandomSource.seeded(3));
        MonteCarloResult outside = simulator.simulate(List.of(exact), 100, new TargetSpec(20, 0.1, 0.1), RandomSource.seeded(3));

        assertThat(inside.stdDev()).isZero();
        assertThat(inside.cpk()).isEqualTo(Double.POSITIVE_INFINITY);
        assertThat(outside.cpk()).isEqualTo(Double.NEGATIVE_INFINITY);
        assertThat(inside.histogram().get(49).count()).isEqualTo(100);
    }

    @Test
    void cpk_takesNearerSpecLimit() {
        double cpk = MonteCarloSimulator.cpk(10.1, 0.1, new TargetSpec(10, 0.5, 0.5));

        assertThat(cpk).isCloseTo((10.5 - 10.1) / 0.3, within(1e-12));
    }

    @Test
    void percentileIndex_clampsToLastSample() {
        assertThat(MonteCarloSimulator.percentileIndex(10, 0.999)).isEqualTo(9);
        assertThat(MonteCarloSimulator.percentileIndex(10, 0.5)).isEqualTo(5);
        assertThat(MonteCarloSimulator.percentileIndex(1, 0.001)).isZero();
    }

    @Test
    void simulate_rejectsNonPositiveSamples() {
        assertThatThrownBy(() -> simulator.simulate(StackupFixtures.housingShimShaft(), 0, null, RandomSource.seeded(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
