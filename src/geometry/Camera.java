package geometry;

import model.Point3D;

/**
 * Calibrated camera with a known pose.
 */
public interface Camera {

    Projection project(Point3D point);

    /**
     * World-from-camera transform.
     */
    Pose3 pose();

    Calibration calibration();

    /**
     * Depth of a world point along the optical axis; non-positive means the
     * point lies behind the camera.
     */
    default double depth(Point3D point) {
        return pose().transformTo(point.toVector()).getZ();
    }
}
