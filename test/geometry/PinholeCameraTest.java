package geometry;

import model.Point2D;
import model.Point3D;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class PinholeCameraTest {

    private final PinholeCamera camera =
            new PinholeCamera(Pose3.identity(), Calibration.pinhole(500, 320, 240));

    @Test
    void projectsPointInFront() {
        Projection projection = camera.project(new Point3D(0.2, -0.1, 2));
        assertTrue(projection.isSuccess());
        Point2D uv = projection.getPixel();
        assertEquals(370.0, uv.getX(), 1e-9);
        assertEquals(215.0, uv.getY(), 1e-9);
        assertEquals(2.0, camera.depth(new Point3D(0.2, -0.1, 2)), 1e-12);
    }

    @Test
    void pointBehindCameraFailsToProject() {
        Projection projection = camera.project(new Point3D(0.2, -0.1, -2));
        assertFalse(projection.isSuccess());
        assertTrue(camera.depth(new Point3D(0, 0, -2)) < 0);
    }

    @Test
    void pointInCameraPlaneHasNoPixel() {
        Projection projection = camera.project(new Point3D(1, 1, 0));
        assertFalse(projection.isSuccess());
        assertTrue(Double.isNaN(projection.getPixel().getX()));
    }

    @Test
    void registryIsReadOnlySnapshot() {
        PinholeCamera other = new PinholeCamera(
                Pose3.lookAt(new Vector3D(1, 0, 0), new Vector3D(0, 0, 5), new Vector3D(0, 1, 0)),
                Calibration.pinhole(500, 320, 240));
        CameraRegistry registry = CameraRegistry.of(Map.of(3, camera, 1, other));

        assertEquals(2, registry.size());
        assertTrue(registry.contains(3));
        assertFalse(registry.contains(2));
        assertNull(registry.get(2));
        assertSame(other, registry.get(1));
        assertThrows(UnsupportedOperationException.class, () -> registry.asMap().remove(3));
    }
}
