package model;

import lombok.NonNull;
import lombok.Value;

import java.io.Serializable;

/**
 * Одно 2D-наблюдение точки: индекс камеры и пиксельные координаты.
 */
@Value
public class Measurement implements Serializable {
    private static final long serialVersionUID = 1L;

    int cameraIndex;
    @NonNull Point2D uv;
}
