package model;

import lombok.Getter;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Feature track: ordered 2D measurements of one scene point in several images.
 * Immutable; subsets keep the id of the track they were taken from.
 */
public class Track2D implements Serializable {
    private static final long serialVersionUID = 1L;

    @Getter
    private final int id;
    @Getter
    private final List<Measurement> measurements;

    public Track2D(int id, List<Measurement> measurements) {
        this.id = id;
        this.measurements = Collections.unmodifiableList(new ArrayList<>(measurements));
    }

    public int size() {
        return measurements.size();
    }

    public Measurement measurement(int k) {
        return measurements.get(k);
    }

    public Track2D selectSubset(List<Integer> indices) {
        List<Measurement> subset = new ArrayList<>(indices.size());
        for (int k : indices) {
            subset.add(measurements.get(k));
        }
        return new Track2D(id, subset);
    }

    public Track2D selectSubset(int... indices) {
        List<Measurement> subset = new ArrayList<>(indices.length);
        for (int k : indices) {
            subset.add(measurements.get(k));
        }
        return new Track2D(id, subset);
    }

    /**
     * True when no two measurements come from the same camera.
     */
    public boolean hasUniqueCameras() {
        Set<Integer> seen = new HashSet<>();
        for (Measurement m : measurements) {
            if (!seen.add(m.getCameraIndex())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "Track2D{id=" + id + ", measurements=" + measurements + "}";
    }
}
