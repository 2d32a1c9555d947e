package association;

import geometry.CameraRegistry;
import lombok.Value;
import model.Landmark;

import java.util.List;

/**
 * Cameras and curated landmarks handed to bundle adjustment.
 */
@Value
public class SfmData {
    CameraRegistry cameras;
    List<Landmark> landmarks;
    CurationReport report;

    public int numberTracks() {
        return landmarks.size();
    }

    public Landmark track(int j) {
        return landmarks.get(j);
    }
}
