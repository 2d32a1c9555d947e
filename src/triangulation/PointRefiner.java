package triangulation;

import geometry.Camera;
import model.Point2D;
import model.Point3D;
import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.MaxCountExceededException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.Pair;

import java.util.List;
import java.util.logging.Logger;

/**
 * Levenberg-Marquardt refinement of a single 3D point against fixed cameras,
 * minimizing pixel reprojection residuals.
 */
public class PointRefiner {
    private static final Logger LOGGER = Logger.getLogger(PointRefiner.class.getName());

    public static final int DEFAULT_MAX_EVALUATIONS = 200;
    public static final int DEFAULT_MAX_ITERATIONS = 100;

    // Residual used for a view where the point sits exactly in the camera plane
    private static final double INVALID_RESIDUAL = 1e6;
    private static final double JACOBIAN_STEP = 1e-6;

    private final int maxEvaluations;
    private final int maxIterations;
    private final LevenbergMarquardtOptimizer optimizer;

    public PointRefiner() {
        this(DEFAULT_MAX_EVALUATIONS, DEFAULT_MAX_ITERATIONS);
    }

    public PointRefiner(int maxEvaluations, int maxIterations) {
        this(maxEvaluations, maxIterations, new LevenbergMarquardtOptimizer());
    }

    PointRefiner(int maxEvaluations, int maxIterations, LevenbergMarquardtOptimizer optimizer) {
        this.maxEvaluations = maxEvaluations;
        this.maxIterations = maxIterations;
        this.optimizer = optimizer;
    }

    /**
     * Returns the refined point, or {@code initial} when the optimizer does not
     * converge, gives up on its tolerances or does not improve the cost.
     */
    public Point3D refine(List<Camera> cameras, List<Point2D> measurements, Point3D initial) {
        MultivariateJacobianFunction model = point -> {
            double[] x = point.toArray();
            double[] residuals = computeResiduals(cameras, measurements, x);
            RealMatrix jacobian = computeJacobian(cameras, measurements, x, residuals);
            return new Pair<>(new ArrayRealVector(residuals, false), jacobian);
        };

        double[] start = initial.toArray();
        LeastSquaresProblem problem = new LeastSquaresBuilder()
                .start(start)
                .model(model)
                .target(new double[2 * cameras.size()])
                .maxEvaluations(maxEvaluations)
                .maxIterations(maxIterations)
                .build();

        try {
            LeastSquaresOptimizer.Optimum optimum = optimizer.optimize(problem);
            double[] refined = optimum.getPoint().toArray();
            if (cost(cameras, measurements, refined) > cost(cameras, measurements, start)) {
                return initial;
            }
            Point3D result = new Point3D(refined[0], refined[1], refined[2]);
            return result.isFinite() ? result : initial;
        } catch (MaxCountExceededException ex) {
            LOGGER.fine("Point refinement did not converge within " + maxEvaluations
                    + " evaluations, keeping the linear estimate");
            return initial;
        } catch (ConvergenceException ex) {
            LOGGER.fine("Point refinement stopped: " + ex.getMessage() + ", keeping the linear estimate");
            return initial;
        }
    }

    private static double cost(List<Camera> cameras, List<Point2D> measurements, double[] x) {
        double sum = 0;
        for (double r : computeResiduals(cameras, measurements, x)) {
            sum += r * r;
        }
        return sum;
    }

    private static double[] computeResiduals(List<Camera> cameras, List<Point2D> measurements, double[] x) {
        Point3D point = new Point3D(x[0], x[1], x[2]);
        double[] res = new double[2 * cameras.size()];
        for (int i = 0; i < cameras.size(); i++) {
            Point2D uv = cameras.get(i).project(point).getPixel();
            Point2D obs = measurements.get(i);
            if (Double.isFinite(uv.getX()) && Double.isFinite(uv.getY())) {
                res[2 * i] = uv.getX() - obs.getX();
                res[2 * i + 1] = uv.getY() - obs.getY();
            } else {
                res[2 * i] = INVALID_RESIDUAL;
                res[2 * i + 1] = INVALID_RESIDUAL;
            }
        }
        return res;
    }

    // Forward differences, step scaled to the coordinate magnitude
    private static RealMatrix computeJacobian(List<Camera> cameras, List<Point2D> measurements,
                                              double[] x, double[] base) {
        RealMatrix jacobian = new Array2DRowRealMatrix(base.length, x.length);
        double[] p = x.clone();
        for (int k = 0; k < x.length; k++) {
            double eps = JACOBIAN_STEP * Math.max(1.0, Math.abs(x[k]));
            p[k] = x[k] + eps;
            double[] pert = computeResiduals(cameras, measurements, p);
            p[k] = x[k];
            for (int i = 0; i < base.length; i++) {
                jacobian.setEntry(i, k, (pert[i] - base[i]) / eps);
            }
        }
        return jacobian;
    }
}
