package com.dotprint.core.printing;

/**
 * A value that knows its own DOT representation.
 *
 * <p>Lists of such values use the default list forms of {@link PrintDot}; types whose
 * lists print differently provide their own {@code PrintDot} instead.
 */
public interface DotValue {

    /**
     * The unquoted representation.
     *
     * @return code printing this value
     */
    DotCode unqtDot();

    /**
     * The representation used as a complete value; defaults to {@link #unqtDot()}.
     *
     * @return code printing this value
     */
    default DotCode toDot() {
        return unqtDot();
    }
}
