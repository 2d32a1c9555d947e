package geometry;

import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.io.Serializable;

/**
 * Rigid transform {@code wTc}: maps camera coordinates into the world frame.
 * The translation is the camera center expressed in world coordinates.
 */
public final class Pose3 implements Serializable {
    private static final long serialVersionUID = 1L;

    private static final double ORTHONORMALITY_THRESHOLD = 1e-6;

    private final double[][] rotation;
    private final Vector3D translation;

    public Pose3(double[][] rotation, Vector3D translation) {
        try {
            // only validates; commons-math rejects matrices too far from SO(3)
            new Rotation(rotation, ORTHONORMALITY_THRESHOLD);
        } catch (MathIllegalArgumentException e) {
            throw new IllegalArgumentException("Not a rotation matrix", e);
        }
        this.rotation = copy(rotation);
        this.translation = translation;
    }

    public static Pose3 identity() {
        return new Pose3(new double[][]{{1, 0, 0}, {0, 1, 0}, {0, 0, 1}}, Vector3D.ZERO);
    }

    /**
     * Camera at {@code eye} whose optical axis points at {@code target}.
     * The camera y axis points away from {@code up} (image rows grow downwards).
     */
    public static Pose3 lookAt(Vector3D eye, Vector3D target, Vector3D up) {
        Vector3D z = target.subtract(eye).normalize();
        Vector3D x = Vector3D.crossProduct(z, up).normalize();
        Vector3D y = Vector3D.crossProduct(z, x);
        double[][] r = {
                {x.getX(), y.getX(), z.getX()},
                {x.getY(), y.getY(), z.getY()},
                {x.getZ(), y.getZ(), z.getZ()}
        };
        return new Pose3(r, eye);
    }

    /**
     * World point into camera coordinates: {@code R^T (p - t)}.
     */
    public Vector3D transformTo(Vector3D world) {
        RealVector d = toRealVector(world.subtract(translation));
        return toVector3D(rotationMatrix().transpose().operate(d));
    }

    /**
     * Camera point into world coordinates: {@code R p + t}.
     */
    public Vector3D transformFrom(Vector3D local) {
        return toVector3D(rotationMatrix().operate(toRealVector(local))).add(translation);
    }

    public Pose3 inverse() {
        RealMatrix rt = rotationMatrix().transpose();
        Vector3D t = toVector3D(rt.operate(toRealVector(translation))).negate();
        return new Pose3(rt.getData(), t);
    }

    /**
     * {@code this * other}.
     */
    public Pose3 compose(Pose3 other) {
        RealMatrix r = rotationMatrix().multiply(other.rotationMatrix());
        Vector3D t = transformFrom(other.translation);
        return new Pose3(r.getData(), t);
    }

    /**
     * Relative pose {@code this^-1 * other}.
     */
    public Pose3 between(Pose3 other) {
        return inverse().compose(other);
    }

    public Vector3D translation() {
        return translation;
    }

    public double[][] rotation() {
        return copy(rotation);
    }

    RealMatrix rotationMatrix() {
        return new Array2DRowRealMatrix(rotation, true);
    }

    private static RealVector toRealVector(Vector3D v) {
        return new ArrayRealVector(new double[]{v.getX(), v.getY(), v.getZ()}, false);
    }

    private static Vector3D toVector3D(RealVector v) {
        return new Vector3D(v.getEntry(0), v.getEntry(1), v.getEntry(2));
    }

    private static double[][] copy(double[][] m) {
        if (m.length != 3) {
            throw new IllegalArgumentException("Rotation must be 3x3");
        }
        double[][] out = new double[3][];
        for (int i = 0; i < 3; i++) {
            if (m[i].length != 3) {
                throw new IllegalArgumentException("Rotation must be 3x3");
            }
            out[i] = m[i].clone();
        }
        return out;
    }

    @Override
    public String toString() {
        return "Pose3{t=" + translation + "}";
    }
}
