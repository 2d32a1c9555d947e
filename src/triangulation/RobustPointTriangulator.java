package triangulation;

import geometry.Camera;
import geometry.CameraRegistry;
import model.Landmark;
import model.Measurement;
import model.Point2D;
import model.Point3D;
import model.Track2D;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Initializes a landmark from one feature track, with or without RANSAC
 * inlier selection, according to the configured {@link TriangulationMode}.
 *
 * <p>Stateless apart from the read-only camera registry and config, so one
 * instance may be shared by worker threads; randomized modes take their random
 * state per call.
 */
public class RobustPointTriangulator {
    private static final Logger LOGGER = Logger.getLogger(RobustPointTriangulator.class.getName());

    // Only the relative quality of seed triplets matters
    private static final double UNBOUNDED_THRESHOLD = Double.MAX_VALUE;

    private final CameraRegistry cameras;
    private final TriangulationConfig config;
    private final TriangulationPrimitive primitive;

    public RobustPointTriangulator(CameraRegistry cameras, TriangulationConfig config) {
        this(cameras, config, new DltTriangulator(DltTriangulator.DEFAULT_RANK_TOLERANCE, config.isOptimize()));
    }

    public RobustPointTriangulator(CameraRegistry cameras, TriangulationConfig config,
                                   TriangulationPrimitive primitive) {
        this.cameras = cameras;
        this.config = config.validate();
        this.primitive = primitive;
    }

    /**
     * Triangulates with random state derived from the track id.
     */
    public TriangulationResult triangulate(Track2D track) {
        return triangulate(track, config.randomFor(track.getId()));
    }

    /**
     * @throws ConfigurationException if RANSAC sampling weights sum to zero
     */
    public TriangulationResult triangulate(Track2D track, Random rng) {
        Track2D usable = dropUnestimatedCameras(track);
        if (usable.size() < 2) {
            LOGGER.fine(() -> "Track " + track.getId() + " has " + usable.size()
                    + " usable measurement(s), cannot triangulate");
            return TriangulationResult.rejected(RejectionReason.UNDER_DETERMINED);
        }
        if (distinctCameras(usable) < 2) {
            LOGGER.fine(() -> "Track " + track.getId() + " is seen by a single camera");
            return TriangulationResult.rejected(RejectionReason.DUPLICATE_CAMERAS);
        }

        switch (config.getMode()) {
            case TRIPLET_GROWTH:
                return growFromMostConsistentTriplet(usable);
            case NO_ROBUST:
                return triangulateInliers(usable, config.getReprojectionErrorThreshold());
            default:
                boolean[] inliers = selectRansacInliers(usable, rng);
                return triangulateInliers(usable.selectSubset(indicesOf(inliers)), config.getReprojectionErrorThreshold());
        }
    }

    /**
     * Runs the RANSAC hypothesis loop and returns the inlier mask of the best
     * hypothesis: most inliers first, lowest mean inlier error second. At most
     * one measurement per camera is kept, the one with the lowest error. The
     * mask is all false when no hypothesis has an inlier.
     *
     * <p>Measurements from unestimated cameras must have been removed.
     */
    public boolean[] selectRansacInliers(Track2D track, Random rng) {
        TriangulationMode mode = config.getMode();
        double threshold = config.getReprojectionErrorThreshold();

        List<int[]> pairs = HypothesisSampler.generateMeasurementPairs(track.size());
        int numHypotheses = Math.min(config.getNumHypotheses(), pairs.size());
        double[] weights = HypothesisSampler.pairWeights(mode, track, pairs, cameras);
        List<Integer> samples = HypothesisSampler.sampleHypotheses(mode, weights, numHypotheses, rng);

        int bestVotes = 0;
        double bestError = Double.MAX_VALUE;
        ReprojectionErrors bestErrors = null;

        for (int sample : samples) {
            int[] pair = pairs.get(sample);
            Track2D hypothesis = track.selectSubset(pair);
            if (!hypothesis.hasUniqueCameras()) {
                continue;
            }

            Point3D point;
            try {
                point = primitive.triangulate(camerasOf(hypothesis), pixelsOf(hypothesis));
            } catch (CheiralityException e) {
                LOGGER.fine(() -> "Cheirality failure for hypothesis " + pair[0] + "," + pair[1]
                        + " of track " + track.getId() + ", likely an outlier; skipping it");
                continue;
            } catch (TriangulationException e) {
                LOGGER.fine(() -> "Degenerate hypothesis " + pair[0] + "," + pair[1]
                        + " of track " + track.getId() + ": " + e.getMessage());
                continue;
            }

            ReprojectionErrors errors =
                    ReprojectionUtils.computePointReprojectionErrors(cameras, point, track.getMeasurements());
            int votes = errors.countBelow(threshold);
            if (votes == 0) {
                continue;
            }
            double avgError = errors.meanBelow(threshold);
            if (votes > bestVotes || (votes == bestVotes && avgError < bestError)) {
                bestVotes = votes;
                bestError = avgError;
                bestErrors = errors;
            }
        }

        boolean[] mask = new boolean[track.size()];
        if (bestErrors == null) {
            return mask;
        }
        // one measurement per camera
        Map<Integer, Integer> bestPerCamera = new HashMap<>();
        for (int k = 0; k < track.size(); k++) {
            if (!(bestErrors.get(k) < threshold)) continue;
            int camera = track.measurement(k).getCameraIndex();
            Integer current = bestPerCamera.get(camera);
            if (current == null || bestErrors.get(k) < bestErrors.get(current)) {
                bestPerCamera.put(camera, k);
            }
        }
        for (int k : bestPerCamera.values()) {
            mask[k] = true;
        }
        return mask;
    }

    /**
     * Acceptance gate: triangulates the fixed measurement set and accepts it
     * only if every error is below the threshold.
     */
    private TriangulationResult triangulateInliers(Track2D inliers, double threshold) {
        if (inliers.size() < 2) {
            return TriangulationResult.rejected(RejectionReason.TOO_FEW_INLIERS);
        }
        if (!inliers.hasUniqueCameras()) {
            return TriangulationResult.rejected(RejectionReason.DUPLICATE_CAMERAS);
        }

        Point3D point;
        try {
            point = primitive.triangulate(camerasOf(inliers), pixelsOf(inliers));
        } catch (CheiralityException e) {
            return TriangulationResult.cheiralityFailure();
        } catch (TriangulationException e) {
            LOGGER.fine(() -> "Track " + inliers.getId() + " rejected: " + e.getMessage());
            return TriangulationResult.rejected(RejectionReason.DEGENERATE_GEOMETRY);
        }

        ReprojectionErrors errors =
                ReprojectionUtils.computePointReprojectionErrors(cameras, point, inliers.getMeasurements());
        if (!errors.allBelow(threshold)) {
            return TriangulationResult.rejected(RejectionReason.REPROJECTION);
        }
        return TriangulationResult.accepted(new Landmark(point, inliers.getMeasurements()), errors.mean());
    }

    /**
     * Greedy growth: start from the triplet with the lowest average error and
     * add measurements, best first, as long as the average error stays below
     * the threshold. Order dependent; the accepted set is not guaranteed to be
     * the largest consistent one.
     */
    private TriangulationResult growFromMostConsistentTriplet(Track2D track) {
        double threshold = config.getReprojectionErrorThreshold();

        if (track.size() == 2) {
            // с двумя измерениями расти некуда
            return triangulateInliers(track, threshold);
        }

        // 1) Ищем тройку с минимальной средней ошибкой
        double minAvgError = Double.POSITIVE_INFINITY;
        int[] bestTriplet = null;
        Point3D tripletPoint = null;
        int n = track.size();
        for (int k1 = 0; k1 < n; k1++) {
            for (int k2 = k1 + 1; k2 < n; k2++) {
                for (int k3 = k2 + 1; k3 < n; k3++) {
                    Track2D triplet = track.selectSubset(k1, k2, k3);
                    if (!triplet.hasUniqueCameras()) {
                        continue;
                    }
                    TriangulationResult result = triangulateInliers(triplet, UNBOUNDED_THRESHOLD);
                    if (!result.isAccepted()) {
                        continue;
                    }
                    double avgError = result.getAverageReprojectionError().getAsDouble();
                    // strict comparison keeps the lexicographically first triplet on ties
                    if (avgError < minAvgError) {
                        minAvgError = avgError;
                        bestTriplet = new int[]{k1, k2, k3};
                        tripletPoint = result.getLandmark().get().getPoint();
                    }
                }
            }
        }
        if (bestTriplet == null || minAvgError > threshold) {
            LOGGER.fine(() -> "Track " + track.getId() + " has no consistent seed triplet");
            return TriangulationResult.rejected(RejectionReason.TOO_FEW_INLIERS);
        }

        // 2) Сортируем все измерения по ошибке относительно точки тройки
        ReprojectionErrors errors =
                ReprojectionUtils.computePointReprojectionErrors(cameras, tripletPoint, track.getMeasurements());
        List<Integer> ordered = IntStream.range(0, n).boxed()
                .sorted(Comparator.comparingDouble(errors::get))
                .collect(Collectors.toList());

        // 3) Добавляем измерения, пока средняя ошибка ниже порога, не больше одного на камеру
        List<Measurement> accepted = new ArrayList<>();
        Set<Integer> acceptedCameras = new HashSet<>();
        for (int k : ordered) {
            Measurement candidate = track.measurement(k);
            if (accepted.isEmpty()) {
                accepted.add(candidate);
                acceptedCameras.add(candidate.getCameraIndex());
                continue;
            }
            if (acceptedCameras.contains(candidate.getCameraIndex())) {
                continue;
            }
            List<Measurement> grown = new ArrayList<>(accepted);
            grown.add(candidate);
            TriangulationResult result = triangulateInliers(new Track2D(track.getId(), grown), UNBOUNDED_THRESHOLD);
            if (result.isAccepted() && result.getAverageReprojectionError().getAsDouble() < threshold) {
                accepted = grown;
                acceptedCameras.add(candidate.getCameraIndex());
            }
        }

        TriangulationResult result = triangulateInliers(new Track2D(track.getId(), accepted), UNBOUNDED_THRESHOLD);
        if (result.isAccepted() && !(result.getAverageReprojectionError().getAsDouble() < threshold)) {
            return TriangulationResult.rejected(RejectionReason.REPROJECTION);
        }
        return result;
    }

    private Track2D dropUnestimatedCameras(Track2D track) {
        List<Measurement> kept = new ArrayList<>(track.size());
        for (Measurement m : track.getMeasurements()) {
            if (cameras.contains(m.getCameraIndex())) {
                kept.add(m);
            } else {
                LOGGER.warning("Unestimated camera " + m.getCameraIndex() + " in track " + track.getId()
                        + ", skipping its measurement");
            }
        }
        return kept.size() == track.size() ? track : new Track2D(track.getId(), kept);
    }

    private static int distinctCameras(Track2D track) {
        Set<Integer> seen = new HashSet<>();
        for (Measurement m : track.getMeasurements()) {
            seen.add(m.getCameraIndex());
        }
        return seen.size();
    }

    private List<Camera> camerasOf(Track2D track) {
        List<Camera> list = new ArrayList<>(track.size());
        for (Measurement m : track.getMeasurements()) {
            list.add(cameras.get(m.getCameraIndex()));
        }
        return list;
    }

    private static List<Point2D> pixelsOf(Track2D track) {
        List<Point2D> list = new ArrayList<>(track.size());
        for (Measurement m : track.getMeasurements()) {
            list.add(m.getUv());
        }
        return list;
    }

    private static List<Integer> indicesOf(boolean[] mask) {
        List<Integer> indices = new ArrayList<>();
        for (int k = 0; k < mask.length; k++) {
            if (mask[k]) indices.add(k);
        }
        return indices;
    }
}
