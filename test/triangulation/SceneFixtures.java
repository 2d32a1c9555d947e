package triangulation;

import geometry.Calibration;
import geometry.Camera;
import geometry.CameraRegistry;
import geometry.PinholeCamera;
import geometry.Pose3;
import model.Measurement;
import model.Point2D;
import model.Point3D;
import model.Track2D;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Synthetic scene: cameras on a horizontal ring of radius 10, 30 degrees
 * apart, all looking at the origin.
 */
public final class SceneFixtures {

    public static final Point3D POINT = new Point3D(0.3, -0.2, 0.5);
    public static final Calibration PINHOLE = Calibration.pinhole(500, 320, 240);
    public static final Calibration DISTORTED = new Calibration(500, 0.05, -0.01, 320, 240);

    private static final double RING_RADIUS = 10.0;
    private static final Vector3D UP = new Vector3D(0, 1, 0);

    private SceneFixtures() {
    }

    public static PinholeCamera ringCamera(int i, Calibration calibration) {
        double theta = Math.toRadians(30.0 * i);
        Vector3D eye = new Vector3D(RING_RADIUS * Math.cos(theta), 0.5 * (i % 2), RING_RADIUS * Math.sin(theta));
        return new PinholeCamera(Pose3.lookAt(eye, Vector3D.ZERO, UP), calibration);
    }

    public static CameraRegistry ring(int numCameras) {
        return ring(numCameras, PINHOLE);
    }

    public static CameraRegistry ring(int numCameras, Calibration calibration) {
        Map<Integer, Camera> cameras = new LinkedHashMap<>();
        for (int i = 0; i < numCameras; i++) {
            cameras.put(i, ringCamera(i, calibration));
        }
        return CameraRegistry.of(cameras);
    }

    public static Point2D pixel(CameraRegistry cameras, int cameraIndex, Point3D point) {
        return cameras.get(cameraIndex).project(point).getPixel();
    }

    public static Measurement measurement(CameraRegistry cameras, int cameraIndex, Point3D point) {
        return new Measurement(cameraIndex, pixel(cameras, cameraIndex, point));
    }

    /**
     * Noiseless track of {@code point} seen by the given cameras.
     */
    public static Track2D track(int id, CameraRegistry cameras, Point3D point, int... cameraIndices) {
        List<Measurement> measurements = new ArrayList<>();
        for (int i : cameraIndices) {
            measurements.add(measurement(cameras, i, point));
        }
        return new Track2D(id, measurements);
    }

    /**
     * Same track with the pixel of the k-th measurement shifted.
     */
    public static Track2D withOffset(Track2D track, int k, double dx, double dy) {
        List<Measurement> measurements = new ArrayList<>(track.getMeasurements());
        Measurement m = measurements.get(k);
        measurements.set(k, new Measurement(m.getCameraIndex(), m.getUv().plus(dx, dy)));
        return new Track2D(track.getId(), measurements);
    }
}
