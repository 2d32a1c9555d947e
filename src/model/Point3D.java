package model;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

public class Point3D extends Point {
    private static final long serialVersionUID = 1L;

    private final double x;
    private final double y;
    private final double z;

    public Point3D(double x, double y, double z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    public double getX() { return x; }
    public double getY() { return y; }
    public double getZ() { return z; }

    public Vector3D toVector() {
        return new Vector3D(x, y, z);
    }

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(z);
    }

    @Override
    public double[] toArray() {
        return new double[]{x, y, z};
    }

    @Override
    public String toString() {
        return String.format("Point3D{x=%.6f, y=%.6f, z=%.6f}", x, y, z);
    }
}
