package triangulation;

import geometry.Camera;
import geometry.CameraRegistry;
import model.Point2D;
import model.Point3D;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.util.LocalizedFormats;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static triangulation.SceneFixtures.POINT;

public class PointRefinerTest {

    private final CameraRegistry registry = SceneFixtures.ring(3);
    private final List<Camera> cameras = List.of(registry.get(0), registry.get(1), registry.get(2));

    private List<Point2D> pixels() {
        List<Point2D> list = new ArrayList<>();
        for (int i = 0; i < 3; i++) list.add(SceneFixtures.pixel(registry, i, POINT));
        return list;
    }

    // optimizer that gives up the way LM does when its tolerances are too small
    private static LevenbergMarquardtOptimizer givingUp() {
        return new LevenbergMarquardtOptimizer() {
            @Override
            public LeastSquaresOptimizer.Optimum optimize(LeastSquaresProblem problem) {
                throw new ConvergenceException(LocalizedFormats.TOO_SMALL_COST_RELATIVE_TOLERANCE, 0.0);
            }
        };
    }

    @Test
    void movesAPerturbedPointBackOntoTheViews() {
        Point3D start = new Point3D(POINT.getX() + 0.02, POINT.getY() - 0.01, POINT.getZ() + 0.03);
        Point3D refined = new PointRefiner().refine(cameras, pixels(), start);
        assertTrue(refined.distanceTo(POINT) < start.distanceTo(POINT));
        assertEquals(0.0, refined.distanceTo(POINT), 1e-4);
    }

    @Test
    @DisplayName("an optimizer that stops on its tolerances keeps the linear estimate")
    void convergenceFailureKeepsInitialPoint() {
        Point3D start = new Point3D(0.31, -0.21, 0.52);
        PointRefiner refiner = new PointRefiner(PointRefiner.DEFAULT_MAX_EVALUATIONS,
                PointRefiner.DEFAULT_MAX_ITERATIONS, givingUp());

        Point3D refined = assertDoesNotThrow(() -> refiner.refine(cameras, pixels(), start));
        assertSame(start, refined);
    }

    @Test
    void triangulationSurvivesAGivingUpOptimizer() throws TriangulationException {
        PointRefiner refiner = new PointRefiner(PointRefiner.DEFAULT_MAX_EVALUATIONS,
                PointRefiner.DEFAULT_MAX_ITERATIONS, givingUp());
        Point3D point = new DltTriangulator(DltTriangulator.DEFAULT_RANK_TOLERANCE, refiner)
                .triangulate(cameras, pixels());
        Point3D linear = new DltTriangulator(DltTriangulator.DEFAULT_RANK_TOLERANCE, false)
                .triangulate(cameras, pixels());
        assertEquals(linear, point);
    }
}
