package com.dotprint.core.printing;

/**
 * Adapts {@link DotValue} to {@link PrintDot}.
 */
final class DotValuePrinter implements PrintDot<DotValue> {

    static final DotValuePrinter INSTANCE = new DotValuePrinter();

    private DotValuePrinter() {
    }

    @Override
    public DotCode unqtDot(DotValue value) {
        return value.unqtDot();
    }

    @Override
    public DotCode toDot(DotValue value) {
        return value.toDot();
    }
}
