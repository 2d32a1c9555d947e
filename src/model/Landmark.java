package model;

import lombok.Getter;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Triangulated 3D point together with the measurements that support it.
 */
public class Landmark implements Serializable {
    private static final long serialVersionUID = 1L;

    @Getter
    private final Point3D point;
    @Getter
    private final List<Measurement> measurements;

    public Landmark(Point3D point, List<Measurement> measurements) {
        this.point = Objects.requireNonNull(point, "point");
        this.measurements = Collections.unmodifiableList(new ArrayList<>(measurements));
    }

    public int numberMeasurements() {
        return measurements.size();
    }

    public Set<Integer> cameraIndices() {
        Set<Integer> indices = new HashSet<>();
        for (Measurement m : measurements) {
            indices.add(m.getCameraIndex());
        }
        return indices;
    }

    public boolean hasUniqueCameras() {
        return cameraIndices().size() == measurements.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Landmark landmark = (Landmark) o;
        return Objects.equals(point, landmark.point) && Objects.equals(measurements, landmark.measurements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(point, measurements);
    }

    @Override
    public String toString() {
        return "Landmark{point=" + point + ", measurements=" + measurements.size() + "}";
    }
}
