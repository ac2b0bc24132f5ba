package io.lattice.spring.boot.autoconfigure;

import io.lattice.core.GlobalObjectRegistry;
import io.lattice.core.LatticeConfiguration;
import io.lattice.core.SharedObjectRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration exposing the object registry as an injectable bean.
 */
@AutoConfiguration
@ConditionalOnClass(SharedObjectRegistry.class)
@EnableConfigurationProperties(LatticeProperties.class)
public class LatticeAutoConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(LatticeAutoConfiguration.class);

    /**
     * Creates the auto-configuration instance.
     */
    public LatticeAutoConfiguration() {
    }

    /**
     * Creates the registry configuration from bound properties.
     *
     * @param properties bound lattice properties
     * @return registry configuration
     */
    @Bean
    @ConditionalOnMissingBean
    public LatticeConfiguration latticeConfiguration(LatticeProperties properties) {
        return properties.toConfiguration();
    }

    /**
     * Creates the shared registry. When {@code lattice.install-global} is set, the
     * process-wide registry is used instead, created from this configuration if
     * nothing initialized it earlier. A registry initialized earlier keeps its own
     * configuration and the bound {@code lattice.*} sizing and locking are not applied to it.
     *
     * @param configuration registry configuration
     * @param properties    bound lattice properties
     * @return shared object registry
     */
    @Bean
    @ConditionalOnMissingBean
    public SharedObjectRegistry sharedObjectRegistry(LatticeConfiguration configuration,
            LatticeProperties properties) {
        if (properties.isInstallGlobal()) {
            if (GlobalObjectRegistry.isInitialized()) {
                LOGGER.debug("Reusing the already initialized global object registry; {} is not applied", configuration);
            }
            return GlobalObjectRegistry.init(configuration);
        }
        return new SharedObjectRegistry(configuration);
    }
}
