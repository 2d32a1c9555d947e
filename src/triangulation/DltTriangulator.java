package triangulation;

import geometry.Camera;
import geometry.Pose3;
import model.Point2D;
import model.Point3D;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import java.util.ArrayList;
import java.util.List;

/**
 * Linear (DLT) triangulation on undistorted normalized coordinates, optionally
 * followed by nonlinear refinement of the point, and a cheirality check on
 * every contributing camera.
 *
 * <p>Each view contributes two rows {@code x P3 - P1} and {@code y P3 - P2} of
 * the homogeneous system {@code A X = 0}, with {@code P = [R^T | -R^T t]} built
 * from the camera pose. The solution is the right singular vector of the
 * smallest singular value.
 */
public class DltTriangulator implements TriangulationPrimitive {

    public static final double DEFAULT_RANK_TOLERANCE = 1e-9;

    // Homogeneous coordinate below this means the point is at infinity
    private static final double MIN_HOMOGENEOUS_SCALE = 1e-12;

    private final double rankTolerance;
    private final PointRefiner refiner;

    public DltTriangulator() {
        this(DEFAULT_RANK_TOLERANCE, true);
    }

    public DltTriangulator(double rankTolerance, boolean optimize) {
        this(rankTolerance, optimize ? new PointRefiner() : null);
    }

    public DltTriangulator(double rankTolerance, PointRefiner refiner) {
        this.rankTolerance = rankTolerance;
        this.refiner = refiner;
    }

    @Override
    public Point3D triangulate(List<Camera> cameras, List<Point2D> measurements) throws TriangulationException {
        if (cameras.size() != measurements.size()) {
            throw new IllegalArgumentException("Got " + cameras.size() + " cameras but "
                    + measurements.size() + " measurements");
        }
        if (cameras.size() < 2) {
            throw new IllegalArgumentException("At least 2 views are required, got " + cameras.size());
        }

        Point3D point = solveLinear(cameras, measurements);
        if (refiner != null) {
            point = refiner.refine(cameras, measurements, point);
        }

        List<Integer> behind = new ArrayList<>();
        for (int i = 0; i < cameras.size(); i++) {
            if (!(cameras.get(i).depth(point) > 0)) {
                behind.add(i);
            }
        }
        if (!behind.isEmpty()) {
            throw new CheiralityException(behind);
        }
        return point;
    }

    private Point3D solveLinear(List<Camera> cameras, List<Point2D> measurements) throws TriangulationException {
        int n = cameras.size();
        RealMatrix a = new Array2DRowRealMatrix(2 * n, 4);
        for (int i = 0; i < n; i++) {
            Camera camera = cameras.get(i);
            double[][] p = projectionMatrix(camera.pose().inverse());
            Point2D xn = camera.calibration().calibrate(measurements.get(i));
            for (int c = 0; c < 4; c++) {
                a.setEntry(2 * i, c, xn.getX() * p[2][c] - p[0][c]);
                a.setEntry(2 * i + 1, c, xn.getY() * p[2][c] - p[1][c]);
            }
        }

        SingularValueDecomposition svd = new SingularValueDecomposition(a);
        double[] singular = svd.getSingularValues();
        int rank = 0;
        for (double s : singular) {
            if (s > rankTolerance) rank++;
        }
        if (rank < 3) {
            throw new TriangulationException("Under-constrained triangulation, rank " + rank);
        }

        // singular values are sorted in decreasing order
        RealVector x = svd.getV().getColumnVector(3);
        double w = x.getEntry(3);
        if (Math.abs(w) < MIN_HOMOGENEOUS_SCALE) {
            throw new TriangulationException("Triangulated point is at infinity");
        }
        return new Point3D(x.getEntry(0) / w, x.getEntry(1) / w, x.getEntry(2) / w);
    }

    /**
     * {@code [R | t]} of a camera-from-world transform.
     */
    private static double[][] projectionMatrix(Pose3 cTw) {
        double[][] r = cTw.rotation();
        double tx = cTw.translation().getX();
        double ty = cTw.translation().getY();
        double tz = cTw.translation().getZ();
        return new double[][]{
                {r[0][0], r[0][1], r[0][2], tx},
                {r[1][0], r[1][1], r[1][2], ty},
                {r[2][0], r[2][1], r[2][2], tz}
        };
    }
}
