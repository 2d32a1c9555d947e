package triangulation;

import java.util.Arrays;

/**
 * Per-measurement reprojection errors of one 3D point, in pixels. An error is
 * {@code +Infinity} where the point could not be projected.
 */
public final class ReprojectionErrors {
    private final double[] errors;

    ReprojectionErrors(double[] errors) {
        this.errors = errors;
    }

    public int size() {
        return errors.length;
    }

    public double get(int k) {
        return errors[k];
    }

    /**
     * Mean over all errors; NaN when there are none.
     */
    public double mean() {
        if (errors.length == 0) return Double.NaN;
        double sum = 0;
        for (double e : errors) sum += e;
        return sum / errors.length;
    }

    public boolean[] inlierMask(double threshold) {
        boolean[] mask = new boolean[errors.length];
        for (int k = 0; k < errors.length; k++) {
            mask[k] = errors[k] < threshold;
        }
        return mask;
    }

    public int countBelow(double threshold) {
        int count = 0;
        for (double e : errors) {
            if (e < threshold) count++;
        }
        return count;
    }

    /**
     * Mean over the errors strictly below the threshold; NaN when there are none.
     */
    public double meanBelow(double threshold) {
        double sum = 0;
        int count = 0;
        for (double e : errors) {
            if (e < threshold) {
                sum += e;
                count++;
            }
        }
        return count == 0 ? Double.NaN : sum / count;
    }

    public boolean allBelow(double threshold) {
        return countBelow(threshold) == errors.length;
    }

    @Override
    public String toString() {
        return "ReprojectionErrors" + Arrays.toString(errors);
    }
}
