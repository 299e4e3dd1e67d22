package org.stackup.tolerance;

import org.junit.jupiter.api.Test;
import org.stackup.dto.tolerance.ToleranceResult;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StackupInsightsTest {

    private final ToleranceStackupCalculator calculator = new ToleranceStackupCalculator();

    @Test
    void generate_reportsRssSavingsAndDominantContributor() {
        ToleranceResult result = calculator.calculate(
                StackupFixtures.housingShimShaft(),
                ToleranceStackupCalculator.Options.defaults().withoutMonteCarlo()
        );

        List<String> insights = StackupInsights.generate(result);

        // RSS 0.187 vs 极值 0.3：收紧约 38%；shaft 占 64% 方差
        assertThat(insights).anyMatch(s -> s.contains("RSS") && s.contains("38%"));
        assertThat(insights).anyMatch(s -> s.contains("\"shaft\""));
    }

    @Test
    void generate_flagsLowCpkAndSpecViolation() {
        ToleranceResult result = calculator.calculate(
                StackupFixtures.housingShimShaft(),
                ToleranceStackupCalculator.Options.defaults()
                        .withTargetSpec(new TargetSpec(54.5, 0.1, 0.1))
                        .withRandom(RandomSource.seeded(3))
        );

        List<String> insights = StackupInsights.generate(result);

        assertThat(insights).anyMatch(s -> s.startsWith("Cpk =") && s.contains("低于 1.0"));
        assertThat(insights).anyMatch(s -> s.contains("不满足目标规格"));
    }

    @Test
    void generate_emptyChainHasNoInsights() {
        ToleranceResult result = calculator.calculate(List.of(), ToleranceStackupCalculator.Options.defaults().withoutMonteCarlo());

        assertThat(StackupInsights.generate(result)).isEmpty();
        assertThat(StackupInsights.generate(null)).isEmpty();
    }
}
