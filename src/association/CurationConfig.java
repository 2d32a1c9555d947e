package association;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import triangulation.ConfigurationException;
import triangulation.TriangulationConfig;

/**
 * Settings of a data-association pass over all tracks.
 */
@Value
@Builder(toBuilder = true)
public class CurationConfig {
    public static final int DEFAULT_MIN_TRACK_LENGTH = 2;

    @NonNull
    @Builder.Default
    TriangulationConfig triangulation = TriangulationConfig.defaults();

    /** Minimum number of supporting measurements of a kept landmark. */
    @Builder.Default
    int minTrackLength = DEFAULT_MIN_TRACK_LENGTH;

    /** Worker threads; 1 triangulates on the calling thread. */
    @Builder.Default
    int parallelism = 1;

    public static CurationConfig defaults() {
        return builder().build();
    }

    public CurationConfig validate() {
        triangulation.validate();
        if (minTrackLength < 2) {
            throw new ConfigurationException("Minimum track length must be at least 2, got " + minTrackLength);
        }
        if (parallelism < 1) {
            throw new ConfigurationException("Parallelism must be at least 1, got " + parallelism);
        }
        return this;
    }
}
