package triangulation;

import lombok.Getter;
import model.Landmark;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Outcome of triangulating one track.
 */
public final class TriangulationResult {
    private final Landmark landmark;
    private final double averageReprojectionError;
    @Getter
    private final boolean cheiralityFailure;
    @Getter
    private final RejectionReason rejectionReason;

    private TriangulationResult(Landmark landmark, double averageReprojectionError,
                                boolean cheiralityFailure, RejectionReason rejectionReason) {
        this.landmark = landmark;
        this.averageReprojectionError = averageReprojectionError;
        this.cheiralityFailure = cheiralityFailure;
        this.rejectionReason = rejectionReason;
    }

    public static TriangulationResult accepted(Landmark landmark, double averageReprojectionError) {
        return new TriangulationResult(landmark, averageReprojectionError, false, RejectionReason.NONE);
    }

    public static TriangulationResult rejected(RejectionReason reason) {
        return new TriangulationResult(null, Double.NaN, false, reason);
    }

    public static TriangulationResult cheiralityFailure() {
        return new TriangulationResult(null, Double.NaN, true, RejectionReason.CHEIRALITY);
    }

    public boolean isAccepted() {
        return landmark != null;
    }

    public Optional<Landmark> getLandmark() {
        return Optional.ofNullable(landmark);
    }

    public OptionalDouble getAverageReprojectionError() {
        return landmark == null ? OptionalDouble.empty() : OptionalDouble.of(averageReprojectionError);
    }

    @Override
    public String toString() {
        return isAccepted()
                ? "TriangulationResult{accepted, " + landmark + ", avgError=" + averageReprojectionError + "}"
                : "TriangulationResult{rejected, reason=" + rejectionReason + "}";
    }
}
