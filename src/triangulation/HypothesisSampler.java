package triangulation;

import geometry.CameraRegistry;
import geometry.Pose3;
import model.Track2D;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Minimal-sample hypothesis generation for RANSAC triangulation: every
 * hypothesis is a pair of measurement indices.
 */
final class HypothesisSampler {
    private static final Logger LOGGER = Logger.getLogger(HypothesisSampler.class.getName());

    private HypothesisSampler() {
    }

    /**
     * All unordered index pairs {@code (k1, k2)}, {@code k1 < k2}, in
     * lexicographic order.
     */
    static List<int[]> generateMeasurementPairs(int numMeasurements) {
        List<int[]> pairs = new ArrayList<>();
        for (int k1 = 0; k1 < numMeasurements; k1++) {
            for (int k2 = k1 + 1; k2 < numMeasurements; k2++) {
                pairs.add(new int[]{k1, k2});
            }
        }
        return pairs;
    }

    /**
     * Sampling weight per pair: 1 for uniform sampling, otherwise the baseline
     * between the two camera centers.
     */
    static double[] pairWeights(TriangulationMode mode, Track2D track, List<int[]> pairs, CameraRegistry cameras) {
        double[] weights = new double[pairs.size()];
        for (int k = 0; k < pairs.size(); k++) {
            if (!mode.isBaselineWeighted()) {
                weights[k] = 1.0;
                continue;
            }
            int[] pair = pairs.get(k);
            Pose3 wTc1 = cameras.get(track.measurement(pair[0]).getCameraIndex()).pose();
            Pose3 wTc2 = cameras.get(track.measurement(pair[1]).getCameraIndex()).pose();
            weights[k] = wTc1.between(wTc2).translation().getNorm();
        }
        return weights;
    }

    /**
     * Picks {@code numHypotheses} distinct pair indices. Randomized modes draw
     * sequentially without replacement, so a larger budget with the same
     * random state extends the smaller sample rather than replacing it.
     *
     * @throws ConfigurationException if the weights do not sum to a positive value
     */
    static List<Integer> sampleHypotheses(TriangulationMode mode, double[] weights, int numHypotheses, Random rng) {
        double total = 0;
        for (double w : weights) total += w;
        if (!(total > 0)) {
            throw new ConfigurationException("Sum of hypothesis sampling weights must be positive, got " + total);
        }

        if (mode == TriangulationMode.TOPK_BASELINE) {
            return IntStream.range(0, weights.length).boxed()
                    .sorted(Comparator.<Integer>comparingDouble(k -> weights[k]).reversed()
                            .thenComparingInt(k -> k))
                    .limit(numHypotheses)
                    .collect(Collectors.toList());
        }

        double[] remaining = weights.clone();
        List<Integer> samples = new ArrayList<>(numHypotheses);
        for (int draw = 0; draw < numHypotheses; draw++) {
            double left = 0;
            for (double w : remaining) left += w;
            if (!(left > 0)) {
                LOGGER.fine("Only " + samples.size() + " pairs have non-zero weight, stopping sampling early");
                break;
            }
            double r = rng.nextDouble() * left;
            int chosen = -1;
            for (int k = 0; k < remaining.length; k++) {
                if (remaining[k] <= 0) continue;
                chosen = k;
                r -= remaining[k];
                if (r < 0) break;
            }
            samples.add(chosen);
            remaining[chosen] = 0;
        }
        return samples;
    }
}
