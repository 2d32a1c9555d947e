package geometry;

import java.io.Serializable;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Read-only snapshot of the estimated cameras, keyed by image index. Images
 * whose pose could not be estimated are simply absent.
 */
public final class CameraRegistry implements Serializable {
    private static final long serialVersionUID = 1L;

    private final Map<Integer, Camera> cameras;

    private CameraRegistry(Map<Integer, Camera> cameras) {
        this.cameras = Collections.unmodifiableMap(new TreeMap<>(cameras));
    }

    public static CameraRegistry of(Map<Integer, ? extends Camera> cameras) {
        return new CameraRegistry(new TreeMap<Integer, Camera>(cameras));
    }

    /**
     * Camera for the given index, or {@code null} if it was not estimated.
     */
    public Camera get(int index) {
        return cameras.get(index);
    }

    public boolean contains(int index) {
        return cameras.containsKey(index);
    }

    public int size() {
        return cameras.size();
    }

    public Map<Integer, Camera> asMap() {
        return cameras;
    }

    @Override
    public String toString() {
        return "CameraRegistry{cameras=" + cameras.keySet() + "}";
    }
}
