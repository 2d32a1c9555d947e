package model;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Базовый класс точки: неизменяемый набор координат фиксированной размерности.
 */
public abstract class Point implements Serializable {

    /**
     * Coordinates in a fresh array, safe to modify.
     */
    public abstract double[] toArray();

    /**
     * Euclidean distance to a point of the same dimension.
     */
    public double distanceTo(Point other) {
        double[] a = toArray();
        double[] b = other.toArray();
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                    "Dimension mismatch: " + a.length + " vs " + b.length);
        }
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    // Сравниваем по координатам и по конкретному классу (2D vs 3D)
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(toArray(), ((Point) o).toArray());
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(toArray());
    }

    @Override
    public abstract String toString();
}
