package com.dotprint.core.printing;

import com.dotprint.core.colorscheme.ColorScheme;

import java.util.Objects;
import java.util.Optional;

/**
 * Mutable state carried through a single render.
 *
 * <p>Holds the active color scheme: rendering a color-scheme value records it here and
 * scheme-relative colors rendered afterwards read it to decide whether they can be
 * written in abbreviated form. There is no undo; the last scheme written stays active
 * until the next one replaces it, so output depends on the order values are rendered.
 *
 * <p>{@link DotRenderer} creates a fresh context per top-level render and drops it
 * afterwards. A context must not be shared between renders and is not thread-safe.
 */
public final class RenderContext {

    private ColorScheme activeColorScheme;

    /**
     * Returns the most recently rendered color scheme.
     *
     * @return the active scheme, or empty if no scheme has been rendered yet
     */
    public Optional<ColorScheme> activeColorScheme() {
        return Optional.ofNullable(activeColorScheme);
    }

    /**
     * Makes a color scheme the active one, replacing any previous scheme.
     *
     * @param scheme scheme just rendered
     */
    public void setColorScheme(ColorScheme scheme) {
        this.activeColorScheme = Objects.requireNonNull(scheme, "scheme must not be null");
    }

    /**
     * Checks whether colors of the given scheme may be written without qualification.
     *
     * <p>With no scheme rendered yet, only X11 colors qualify, since X11 is the scheme
     * Graphviz falls back to.
     *
     * @param scheme scheme a color belongs to
     * @return true if the scheme is in effect at this point of the render
     */
    public boolean isInEffect(ColorScheme scheme) {
        if (activeColorScheme == null) {
            return ColorScheme.x11().equals(scheme);
        }
        return activeColorScheme.equals(scheme);
    }
}
