package triangulation;

import java.util.Collections;
import java.util.List;

/**
 * The triangulated point lies behind at least one of the contributing cameras.
 */
public class CheiralityException extends TriangulationException {
    private final List<Integer> offendingViews;

    /**
     * @param offendingViews positions (in the camera list handed to the
     *                       primitive) of the cameras that see the point
     *                       behind them
     */
    public CheiralityException(List<Integer> offendingViews) {
        super("Triangulated point is behind camera(s) at positions " + offendingViews);
        this.offendingViews = Collections.unmodifiableList(offendingViews);
    }

    public List<Integer> getOffendingViews() {
        return offendingViews;
    }
}
