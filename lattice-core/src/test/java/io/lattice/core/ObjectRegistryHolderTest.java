package io.lattice.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ObjectRegistryHolderTest {

    @Test
    void getBeforeInitFails() {
        var holder = new ObjectRegistryHolder();

        assertThat(holder.isInitialized()).isFalse();
        assertThatThrownBy(holder::get)
                .isInstanceOfSatisfying(ObjectException.class,
                        e -> assertThat(e.error()).isEqualTo(ObjectError.REGISTRY_NOT_INITIALIZED));
    }

    @Test
    void initIsIdempotent() {
        var holder = new ObjectRegistryHolder();

        SharedObjectRegistry first = holder.init();
        SharedObjectRegistry second = holder.init(LatticeConfiguration.builder().initialCapacity(8).build());

        assertThat(second).isSameAs(first);
        assertThat(holder.get()).isSameAs(first);
        assertThat(holder.isInitialized()).isTrue();
    }

    @Test
    void installOnlyWhenEmpty() {
        var holder = new ObjectRegistryHolder();
        var external = new SharedObjectRegistry();

        assertThat(holder.install(external)).isSameAs(external);
        assertThat(holder.install(new SharedObjectRegistry())).isSameAs(external);
        assertThat(holder.init()).isSameAs(external);
    }

    @Test
    void globalRegistryIsWriteOnce() {
        SharedObjectRegistry registry = GlobalObjectRegistry.init();

        assertThat(GlobalObjectRegistry.init()).isSameAs(registry);
        assertThat(GlobalObjectRegistry.get()).isSameAs(registry);
        assertThat(GlobalObjectRegistry.isInitialized()).isTrue();
    }
}
