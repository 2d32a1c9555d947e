package model;

/**
 * Двумерная точка в пикселях изображения.
 */
public class Point2D extends Point {
    private static final long serialVersionUID = 1L;

    private final double x;
    private final double y;

    public Point2D(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public double getX() { return x; }
    public double getY() { return y; }

    public Point2D plus(double dx, double dy) {
        return new Point2D(x + dx, y + dy);
    }

    @Override
    public double[] toArray() {
        return new double[]{x, y};
    }

    @Override
    public String toString() {
        return String.format("Point2D{x=%.3f, y=%.3f}", x, y);
    }
}
