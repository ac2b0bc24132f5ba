package io.lattice.core;

/**
 * A node's own visibility and enabled flags, before ancestors are taken into account.
 *
 * @param visible whether the node itself is shown
 * @param enabled whether the node itself accepts interaction
 */
public record WidgetState(boolean visible, boolean enabled) {

    public static final WidgetState DEFAULT = new WidgetState(true, true);

    public WidgetState withVisible(boolean visible) {
        return new WidgetState(visible, enabled);
    }

    public WidgetState withEnabled(boolean enabled) {
        return new WidgetState(visible, enabled);
    }
}
