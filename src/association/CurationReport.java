package association;

import lombok.Getter;
import model.Landmark;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import triangulation.RejectionReason;
import triangulation.TriangulationResult;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Data-association metrics of one curation pass.
 */
@Getter
public final class CurationReport {
    private final int numInputTracks;
    private final int numAcceptedLandmarks;
    private final int numCheiralityFailures;
    private final Map<RejectionReason, Integer> rejections;
    private final double meanTrackLength;
    private final double medianTrackLength;
    private final double meanReprojectionError;
    private final double medianReprojectionError;

    private CurationReport(Builder builder) {
        this.numInputTracks = builder.numInputTracks;
        this.numAcceptedLandmarks = (int) builder.trackLengths.getN();
        this.numCheiralityFailures = builder.numCheiralityFailures;
        this.rejections = Collections.unmodifiableMap(new EnumMap<>(builder.rejections));
        this.meanTrackLength = builder.trackLengths.getMean();
        this.medianTrackLength = builder.trackLengths.getPercentile(50);
        this.meanReprojectionError = builder.reprojectionErrors.getMean();
        this.medianReprojectionError = builder.reprojectionErrors.getPercentile(50);
    }

    public int getRejections(RejectionReason reason) {
        return rejections.getOrDefault(reason, 0);
    }

    public int getNumRejectedTracks() {
        return numInputTracks - numAcceptedLandmarks;
    }

    @Override
    public String toString() {
        return String.format("Data association: %d/%d tracks accepted, %d cheirality failures, "
                        + "track length mean %.2f median %.1f, reprojection error mean %.3f median %.3f px, "
                        + "rejections %s",
                numAcceptedLandmarks, numInputTracks, numCheiralityFailures,
                meanTrackLength, medianTrackLength, meanReprojectionError, medianReprojectionError, rejections);
    }

    static Builder builder() {
        return new Builder();
    }

    static final class Builder {
        private int numInputTracks;
        private int numCheiralityFailures;
        private final Map<RejectionReason, Integer> rejections = new EnumMap<>(RejectionReason.class);
        private final DescriptiveStatistics trackLengths = new DescriptiveStatistics();
        private final DescriptiveStatistics reprojectionErrors = new DescriptiveStatistics();

        Builder track() {
            numInputTracks++;
            return this;
        }

        Builder rejected(TriangulationResult result) {
            if (result.isCheiralityFailure()) {
                numCheiralityFailures++;
            }
            return rejected(result.getRejectionReason());
        }

        Builder rejected(RejectionReason reason) {
            rejections.merge(reason, 1, Integer::sum);
            return this;
        }

        Builder accepted(Landmark landmark, double averageReprojectionError) {
            trackLengths.addValue(landmark.numberMeasurements());
            reprojectionErrors.addValue(averageReprojectionError);
            return this;
        }

        CurationReport build() {
            return new CurationReport(this);
        }
    }
}
