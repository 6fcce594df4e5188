package com.dotprint.core.attributes;

/**
 * Which half of an arrow shape is drawn.
 */
public enum ArrowSide {
    /** Left half, {@code l} prefix */
    LEFT,

    /** Right half, {@code r} prefix */
    RIGHT,

    /** Both halves; the default */
    BOTH
}
