package triangulation;

import geometry.Camera;
import model.Point2D;
import model.Point3D;

import java.util.List;

/**
 * Multi-view point triangulation from known cameras.
 */
public interface TriangulationPrimitive {

    /**
     * @param cameras      at least two cameras
     * @param measurements one pixel per camera, same order
     * @throws CheiralityException    if the point ends up behind a camera
     * @throws TriangulationException if the views do not constrain a point
     */
    Point3D triangulate(List<Camera> cameras, List<Point2D> measurements) throws TriangulationException;
}
