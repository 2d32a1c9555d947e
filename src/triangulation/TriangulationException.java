package triangulation;

/**
 * A set of views from which no 3D point can be computed, e.g. a rank-deficient
 * linear system or a point at infinity.
 */
public class TriangulationException extends Exception {
    public TriangulationException(String message) {
        super(message);
    }
}
