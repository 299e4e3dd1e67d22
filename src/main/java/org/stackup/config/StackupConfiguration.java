package org.stackup.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.stackup.persist.StackupDocumentCodec;
import org.stackup.session.AssemblySessionStore;
import org.stackup.tolerance.MonteCarloSimulator;
import org.stackup.tolerance.ToleranceStackupCalculator;
import org.stackup.workspace.WorkspacePathResolver;

/**
 * 公差叠加服务的 Bean 装配：把 {@link StackupProperties} 转成各组件的显式参数，核心包不依赖 Spring。
 */
@Configuration(proxyBeanMethods = false)
public class StackupConfiguration {

    @Bean
    public MonteCarloSimulator monteCarloSimulator(StackupProperties properties) {
        return new MonteCarloSimulator(new MonteCarloSimulator.Settings(
                properties.getHistogramBins(),
                properties.getMonteCarloWorkers()
        ));
    }

    @Bean
    public ToleranceStackupCalculator toleranceStackupCalculator(MonteCarloSimulator simulator) {
        return new ToleranceStackupCalculator(simulator);
    }

    @Bean
    public AssemblySessionStore assemblySessionStore(StackupProperties properties) {
        return new AssemblySessionStore(properties.getSessionTtl(), properties.getSessionMaxGraphs());
    }

    @Bean
    public WorkspacePathResolver workspacePathResolver(StackupProperties properties) {
        return new WorkspacePathResolver(properties);
    }

    @Bean
    public StackupDocumentCodec stackupDocumentCodec() {
        return new StackupDocumentCodec();
    }
}
