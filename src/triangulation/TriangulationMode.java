package triangulation;

/**
 * Outlier handling used when a track is triangulated.
 */
public enum TriangulationMode {
    /** Every measurement is an inlier; the whole track is accepted or rejected. */
    NO_ROBUST,
    /** RANSAC over measurement pairs drawn uniformly at random. */
    SAMPLE_UNIFORM,
    /** RANSAC over measurement pairs drawn with probability proportional to the camera baseline. */
    SAMPLE_BIASED_BY_BASELINE,
    /** RANSAC over the measurement pairs with the largest baselines, no randomness. */
    TOPK_BASELINE,
    /** Start from the most consistent triplet and greedily add measurements. */
    TRIPLET_GROWTH;

    public boolean isRansac() {
        return this == SAMPLE_UNIFORM || this == SAMPLE_BIASED_BY_BASELINE || this == TOPK_BASELINE;
    }

    public boolean isBaselineWeighted() {
        return this == SAMPLE_BIASED_BY_BASELINE || this == TOPK_BASELINE;
    }
}
