package io.lattice.core;

import io.lattice.kernel.ObjectId;
import io.lattice.testutil.TestObjects.Label;
import io.lattice.testutil.TestObjects.Panel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ObjectBaseTest {

    private SharedObjectRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SharedObjectRegistry();
    }

    @Test
    void constructionRegistersAndCloseDestroys() {
        ObjectId id;
        try (var panel = new Panel(registry)) {
            id = panel.objectId();
            assertThat(registry.contains(id)).isTrue();
            assertThat(registry.typeId(id)).isEqualTo(Panel.class);
        }

        assertThat(registry.contains(id)).isFalse();
    }

    @Test
    void closeIsIdempotentAndToleratesCascade() {
        var parent = new Panel(registry);
        var child = new Label(registry, "child", "text");
        child.base().setParent(parent.objectId());

        parent.close();
        assertThat(child.base().isAlive()).isFalse();

        child.close();
        child.close();
        parent.close();
        assertThat(registry.objectCount()).isZero();
    }

    @Test
    void helpersDelegateToRegistry() {
        var parent = new Panel(registry);
        var alpha = new Label(registry, "alpha", "A");
        var beta = new Label(registry, "beta", "B");
        alpha.base().setParent(parent.objectId());
        beta.base().setParent(parent.objectId());

        assertThat(alpha.base().name()).isEqualTo("alpha");
        assertThat(alpha.base().parent()).contains(parent.objectId());
        assertThat(parent.base().children()).containsExactly(alpha.objectId(), beta.objectId());
        assertThat(parent.base().findChildByName("beta")).contains(beta.objectId());
        assertThat(beta.base().siblingIndex()).hasValue(1);
        assertThat(alpha.base().nextSibling()).contains(beta.objectId());
        assertThat(beta.base().previousSibling()).contains(alpha.objectId());
        assertThat(alpha.base().siblings()).containsExactly(beta.objectId());
        assertThat(alpha.base().ancestors()).containsExactly(parent.objectId());

        beta.base().lower();
        assertThat(parent.base().children()).containsExactly(beta.objectId(), alpha.objectId());
        beta.base().raise();
        beta.base().stackUnder(alpha.objectId());
        assertThat(parent.base().depthFirstPreorder())
                .containsExactly(parent.objectId(), beta.objectId(), alpha.objectId());
        beta.base().stackAbove(alpha.objectId());
        assertThat(parent.base().breadthFirst())
                .containsExactly(parent.objectId(), alpha.objectId(), beta.objectId());
        assertThat(parent.base().depthFirstPostorder()).endsWith(parent.objectId());

        alpha.base().setProperty("counter", 100);
        assertThat(alpha.base().property("counter", Integer.class)).contains(100);
    }

    @Test
    void gettersFallBackToDefaultsOnceDestroyed() {
        var panel = new Panel(registry);
        panel.base().setName("gone");
        panel.close();

        assertThat(panel.base().name()).isEmpty();
        assertThat(panel.base().children()).isEmpty();
        assertThat(panel.base().parent()).isEmpty();
        assertThat(panel.base().siblingIndex()).isEmpty();
        assertThat(panel.base().property("k", String.class)).isEmpty();
        assertThat(panel.base().depthFirstPreorder()).isEmpty();
        panel.base().setName("ignored");
    }

    @Test
    void mutatorsPropagateErrors() {
        var a = new Panel(registry);
        var b = new Panel(registry);
        b.base().setParent(a.objectId());

        assertThatThrownBy(() -> a.base().setParent(b.objectId()))
                .isInstanceOfSatisfying(ObjectException.class, e -> assertThat(e.error()).isEqualTo(ObjectError.CIRCULAR_PARENTAGE));
        b.close();
        assertThatThrownBy(() -> b.base().setProperty("k", 1))
                .isInstanceOfSatisfying(ObjectException.class, e -> assertThat(e.error()).isEqualTo(ObjectError.INVALID_OBJECT_ID));
    }

    @Test
    void convenienceConstructorUsesGlobalRegistry() {
        SharedObjectRegistry global = GlobalObjectRegistry.init();

        try (var base = ObjectBase.create(Panel.class)) {
            assertThat(base.registry()).isSameAs(global);
            assertThat(global.contains(base.id())).isTrue();
        }
    }

    @Test
    void convenienceConstructorFailsFastWithoutRegistry() {
        var holder = new ObjectRegistryHolder();

        assertThatThrownBy(() -> ObjectBase.create(holder, Panel.class))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Object registry not initialized")
                .cause()
                .isInstanceOfSatisfying(ObjectException.class,
                        e -> assertThat(e.error()).isEqualTo(ObjectError.REGISTRY_NOT_INITIALIZED));

        SharedObjectRegistry initialized = holder.init();
        try (var base = ObjectBase.create(holder, Panel.class)) {
            assertThat(base.registry()).isSameAs(initialized);
        }
    }

    @Test
    void castChecksConcreteType() {
        var label = new Label(registry, "l", "hello");
        LatticeObject object = label;

        assertThat(LatticeObject.cast(object, Label.class)).map(Label::text).contains("hello");
        assertThat(LatticeObject.cast(object, Panel.class)).isEmpty();
        assertThat(LatticeObject.cast(null, Panel.class)).isEmpty();
    }
}
