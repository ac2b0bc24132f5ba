package io.lattice.testutil;

import io.lattice.core.LatticeObject;
import io.lattice.core.ObjectBase;
import io.lattice.core.SharedObjectRegistry;
import io.lattice.kernel.ObjectId;

/**
 * Concrete object kinds used as type tags in tests.
 */
public final class TestObjects {

    private TestObjects() {
    }

    public static final class Panel implements LatticeObject, AutoCloseable {
        private final ObjectBase base;

        public Panel(SharedObjectRegistry registry) {
            this.base = new ObjectBase(registry, Panel.class);
        }

        public ObjectBase base() {
            return base;
        }

        @Override
        public ObjectId objectId() {
            return base.id();
        }

        @Override
        public void close() {
            base.close();
        }
    }

    public static final class Label implements LatticeObject, AutoCloseable {
        private final ObjectBase base;
        private final String text;

        public Label(SharedObjectRegistry registry, String name, String text) {
            this.base = new ObjectBase(registry, Label.class);
            this.base.setName(name);
            this.text = text;
        }

        public ObjectBase base() {
            return base;
        }

        public String text() {
            return text;
        }

        @Override
        public ObjectId objectId() {
            return base.id();
        }

        @Override
        public void close() {
            base.close();
        }
    }
}
