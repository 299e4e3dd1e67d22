package org.stackup.tolerance;

import org.junit.jupiter.api.Test;
import org.stackup.dto.tolerance.RssResult;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RssAnalyzerTest {

    @Test
    void analyze_threeLinkChainMatchesHandCalculation() {
        RssAnalyzer.Analysis analysis = RssAnalyzer.analyze(StackupFixtures.housingShimShaft());
        RssResult rss = analysis.result();

        double expected = 3 * Math.sqrt(Math.pow(0.2 / 6, 2) + Math.pow(0.1 / 6, 2) + Math.pow(0.3 / 6, 2));
        assertThat(rss.tolerance()).isCloseTo(expected, within(1e-12));
        assertThat(rss.tolerance()).isCloseTo(0.1871, within(1e-4));
        assertThat(rss.min()).isCloseTo(54.5 - expected, within(1e-9));
        assertThat(rss.max()).isCloseTo(54.5 + expected, within(1e-9));
        assertThat(rss.processCapability()).isEqualTo(1.0);
        assertThat(analysis.variances()).hasSize(3);
        assertThat(analysis.totalVariance()).isCloseTo(rss.sigma() * rss.sigma(), within(1e-12));
    }

    @Test
    void analyze_singleLinkToleranceIsThreeSigma() {
        ChainLink link = StackupFixtures.link("a", 10, 0.2, 0.2, ContributionDirection.POSITIVE)
                .withDistribution(DistributionType.NORMAL, 4);

        RssResult rss = RssAnalyzer.analyze(List.of(link)).result();

        assertThat(rss.sigma()).isCloseTo(0.4 / 8, within(1e-12));
        assertThat(rss.tolerance()).isCloseTo(3 * 0.4 / 8, within(1e-12));
    }

    @Test
    void variance_uniformUsesFullWidthOverTwelve() {
        ChainLink link = StackupFixtures.link("u", 5, 0.3, 0.3, ContributionDirection.POSITIVE)
                .withDistribution(DistributionType.UNIFORM, 3);

        assertThat(RssAnalyzer.variance(link)).isCloseTo(0.36 / 12, within(1e-12));
    }

    @Test
    void analyze_emptyChainIsZero() {
        RssResult rss = RssAnalyzer.analyze(List.of()).result();

        assertThat(rss.tolerance()).isZero();
        assertThat(rss.min()).isZero();
        assertThat(rss.max()).isZero();
    }
}
