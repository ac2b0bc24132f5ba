package io.lattice.spring.boot.autoconfigure;

import io.lattice.core.LatticeConfiguration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Object registry tuning properties bound from {@code lattice.*}.
 */
@Data
@ConfigurationProperties("lattice")
public class LatticeProperties {
    private int initialCapacity = 64;
    private boolean fairLocking = false;
    private int treeDumpIndent = 2;
    /**
     * Also install the registry bean as the process-wide registry. If that registry was
     * initialized before the context started, it is reused as is and the other properties
     * do not apply to it.
     */
    private boolean installGlobal = true;

    /**
     * Creates the immutable registry configuration from these bound properties.
     *
     * @return registry configuration
     */
    public LatticeConfiguration toConfiguration() {
        return LatticeConfiguration.builder()
                .initialCapacity(initialCapacity)
                .fairLocking(fairLocking)
                .treeDumpIndent(treeDumpIndent)
                .build();
    }
}
