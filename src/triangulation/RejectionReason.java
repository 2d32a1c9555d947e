package triangulation;

/**
 * Why a track produced no landmark.
 */
public enum RejectionReason {
    NONE,
    /** Fewer than two measurements from estimated cameras. */
    UNDER_DETERMINED,
    /** Measurements do not come from pairwise distinct cameras. */
    DUPLICATE_CAMERAS,
    /** The linear system did not constrain a finite point. */
    DEGENERATE_GEOMETRY,
    /** The final point lies behind a camera. */
    CHEIRALITY,
    /** No hypothesis gathered enough inliers, or no seed triplet was good enough. */
    TOO_FEW_INLIERS,
    /** Reprojection error of the final point above threshold. */
    REPROJECTION,
    /** Landmark shorter than the minimum track length. */
    INSUFFICIENT_SUPPORT
}
