package triangulation;

import geometry.Camera;
import geometry.CameraRegistry;
import geometry.Projection;
import model.Measurement;
import model.Point2D;
import model.Point3D;

import java.util.List;

/**
 * Reprojection error computation shared by the triangulation modes and the
 * curator.
 */
public final class ReprojectionUtils {

    private ReprojectionUtils() {
    }

    /**
     * Pixel distance between an observation and the projection of the point;
     * {@code +Infinity} if the point is not in front of the camera.
     */
    public static double reprojectionError(Camera camera, Point3D point, Point2D observed) {
        Projection projection = camera.project(point);
        if (!projection.isSuccess()) {
            return Double.POSITIVE_INFINITY;
        }
        double error = projection.getPixel().distanceTo(observed);
        return Double.isNaN(error) ? Double.POSITIVE_INFINITY : error;
    }

    /**
     * Errors of the point against every measurement. All measurement cameras
     * must be present in the registry.
     */
    public static ReprojectionErrors computePointReprojectionErrors(CameraRegistry cameras, Point3D point,
                                                                    List<Measurement> measurements) {
        double[] errors = new double[measurements.size()];
        for (int k = 0; k < measurements.size(); k++) {
            Measurement m = measurements.get(k);
            Camera camera = cameras.get(m.getCameraIndex());
            if (camera == null) {
                throw new IllegalArgumentException("Camera " + m.getCameraIndex() + " is not in the registry");
            }
            errors[k] = reprojectionError(camera, point, m.getUv());
        }
        return new ReprojectionErrors(errors);
    }
}
