package io.lighting.quill.view;

/**
 * Loop control raised by {@code @{break}} and {@code @{continue}} and carried up to the enclosing loop.
 */
enum ControlSignal {
    NONE,
    BREAK,
    CONTINUE
}
