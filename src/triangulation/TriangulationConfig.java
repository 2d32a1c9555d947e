package triangulation;

import lombok.Builder;
import lombok.Value;

import java.util.Random;

/**
 * Settings of the per-track robust triangulation. Immutable; one instance is
 * shared by all tracks of a pass.
 */
@Value
@Builder(toBuilder = true)
public class TriangulationConfig {
    public static final double DEFAULT_REPROJECTION_ERROR_THRESHOLD = 10.0;
    public static final int DEFAULT_NUM_HYPOTHESES = 20;

    @Builder.Default
    TriangulationMode mode = TriangulationMode.NO_ROBUST;

    /** Maximum reprojection error of an inlier, in pixels. */
    @Builder.Default
    double reprojectionErrorThreshold = DEFAULT_REPROJECTION_ERROR_THRESHOLD;

    /** Upper bound on RANSAC hypotheses per track. */
    @Builder.Default
    int numHypotheses = DEFAULT_NUM_HYPOTHESES;

    /** Base seed for per-track random state; {@code null} means unseeded. */
    Long seed;

    /** Nonlinear refinement inside the triangulation primitive. */
    @Builder.Default
    boolean optimize = true;

    public static TriangulationConfig defaults() {
        return builder().build();
    }

    /**
     * @return this config
     * @throws ConfigurationException on a missing mode, a non-positive threshold
     *                                or a non-positive hypothesis budget for RANSAC
     */
    public TriangulationConfig validate() {
        if (mode == null) {
            throw new ConfigurationException("Triangulation mode is required");
        }
        if (!(reprojectionErrorThreshold > 0)) {
            throw new ConfigurationException("Reprojection error threshold must be positive, got "
                    + reprojectionErrorThreshold);
        }
        if (mode.isRansac() && numHypotheses <= 0) {
            throw new ConfigurationException("Number of RANSAC hypotheses must be positive, got " + numHypotheses);
        }
        return this;
    }

    /**
     * Random state for one track. With a seed the result depends only on
     * {@code (seed, trackId)}, so tracks can run on any thread in any order.
     */
    public Random randomFor(int trackId) {
        if (seed == null) {
            return new Random();
        }
        return new Random(mix(seed * 0x9E3779B97F4A7C15L + trackId));
    }

    // SplitMix64 finalizer
    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
