package io.lattice.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LatticeConfigurationTest {

    @Test
    void shouldCreateConfigurationWithDefaults() {
        LatticeConfiguration config = LatticeConfiguration.builder().build();

        assertThat(config.initialCapacity()).isEqualTo(64);
        assertThat(config.fairLocking()).isFalse();
        assertThat(config.treeDumpIndent()).isEqualTo(2);
        assertThat(LatticeConfiguration.defaults().initialCapacity()).isEqualTo(64);
    }

    @Test
    void shouldCreateConfigurationWithCustomValues() {
        LatticeConfiguration config = LatticeConfiguration.builder()
                .initialCapacity(4096)
                .fairLocking(true)
                .treeDumpIndent(0)
                .build();

        assertThat(config.initialCapacity()).isEqualTo(4096);
        assertThat(config.fairLocking()).isTrue();
        assertThat(config.treeDumpIndent()).isZero();
    }

    @Test
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> LatticeConfiguration.builder().initialCapacity(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("initialCapacity");
        assertThatThrownBy(() -> LatticeConfiguration.builder().treeDumpIndent(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("treeDumpIndent");
    }
}
