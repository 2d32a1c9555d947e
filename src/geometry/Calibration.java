package geometry;

import lombok.Value;
import model.Point2D;

import java.io.Serializable;

/**
 * Bundler-style intrinsics: one focal length, two radial distortion terms and
 * the principal point. Distortion is applied in normalized image coordinates:
 * {@code g = 1 + k1 r^2 + k2 r^4}.
 */
@Value
public class Calibration implements Serializable {
    private static final long serialVersionUID = 1L;

    private static final int MAX_UNDISTORT_ITERATIONS = 20;
    private static final double UNDISTORT_TOLERANCE = 1e-12;

    double focalLength;
    double k1;
    double k2;
    double u0;
    double v0;

    public Calibration(double focalLength, double k1, double k2, double u0, double v0) {
        if (!(focalLength > 0)) {
            throw new IllegalArgumentException("Focal length must be positive, got " + focalLength);
        }
        this.focalLength = focalLength;
        this.k1 = k1;
        this.k2 = k2;
        this.u0 = u0;
        this.v0 = v0;
    }

    /**
     * Calibration without lens distortion.
     */
    public static Calibration pinhole(double focalLength, double u0, double v0) {
        return new Calibration(focalLength, 0, 0, u0, v0);
    }

    /**
     * Normalized image coordinates to pixels.
     */
    public Point2D uncalibrate(double x, double y) {
        double g = radialFactor(x * x + y * y);
        return new Point2D(u0 + focalLength * g * x, v0 + focalLength * g * y);
    }

    /**
     * Pixels to undistorted normalized image coordinates. The distortion is
     * inverted by fixed-point iteration.
     */
    public Point2D calibrate(Point2D pixel) {
        double xd = (pixel.getX() - u0) / focalLength;
        double yd = (pixel.getY() - v0) / focalLength;
        if (k1 == 0 && k2 == 0) {
            return new Point2D(xd, yd);
        }
        double x = xd;
        double y = yd;
        for (int i = 0; i < MAX_UNDISTORT_ITERATIONS; i++) {
            double g = radialFactor(x * x + y * y);
            double nx = xd / g;
            double ny = yd / g;
            boolean converged = Math.abs(nx - x) < UNDISTORT_TOLERANCE && Math.abs(ny - y) < UNDISTORT_TOLERANCE;
            x = nx;
            y = ny;
            if (converged) break;
        }
        return new Point2D(x, y);
    }

    private double radialFactor(double r2) {
        return 1.0 + k1 * r2 + k2 * r2 * r2;
    }
}
