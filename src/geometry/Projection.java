package geometry;

import lombok.Value;
import model.Point2D;

/**
 * Result of projecting a 3D point. {@code success} is false when the point is
 * not in front of the camera; the pixel is then still filled in where it can be
 * computed, but must not be trusted.
 */
@Value
public class Projection {
    Point2D pixel;
    boolean success;

    public static Projection of(Point2D pixel) {
        return new Projection(pixel, true);
    }

    public static Projection failed(Point2D pixel) {
        return new Projection(pixel, false);
    }
}
