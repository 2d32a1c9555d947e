package geometry;

import lombok.NonNull;
import lombok.Value;
import lombok.experimental.Accessors;
import model.Point2D;
import model.Point3D;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import java.io.Serializable;

/**
 * Pinhole camera with Bundler calibration.
 */
@Value
@Accessors(fluent = true)
public class PinholeCamera implements Camera, Serializable {
    private static final long serialVersionUID = 1L;

    @NonNull Pose3 pose;
    @NonNull Calibration calibration;

    @Override
    public Projection project(Point3D point) {
        Vector3D pc = pose.transformTo(point.toVector());
        double z = pc.getZ();
        if (z == 0) {
            return Projection.failed(new Point2D(Double.NaN, Double.NaN));
        }
        Point2D pixel = calibration.uncalibrate(pc.getX() / z, pc.getY() / z);
        return z > 0 ? Projection.of(pixel) : Projection.failed(pixel);
    }
}
