package com.dotprint.core.attributes;

/**
 * Whether an arrow shape is drawn filled or as an outline.
 */
public enum ArrowFill {
    /** Outline only; written as an {@code o} prefix */
    OPEN,

    /** Filled; the default, written as nothing */
    FILLED
}
