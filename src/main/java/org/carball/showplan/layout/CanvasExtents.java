package org.carball.showplan.layout;

/**
 * Size of the canvas needed to draw a laid out statement.
 */
public record CanvasExtents(double width, double height) {

    public static final CanvasExtents EMPTY = new CanvasExtents(0, 0);
}
