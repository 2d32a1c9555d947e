package association;

import geometry.CameraRegistry;
import model.Landmark;
import model.Track2D;
import triangulation.RejectionReason;
import triangulation.RobustPointTriangulator;
import triangulation.TriangulationResult;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Logger;

/**
 * Data association: triangulates every feature track and keeps the landmarks
 * with enough support. Tracks are independent of each other; with
 * {@code parallelism > 1} they are spread over a fixed thread pool and the
 * output keeps the input order.
 */
public class TrackCurator {
    private static final Logger LOGGER = Logger.getLogger(TrackCurator.class.getName());

    private final CurationConfig config;

    public TrackCurator(CurationConfig config) {
        this.config = config.validate();
    }

    /**
     * @param tracks  2D tracks, each consumed once
     * @param cameras estimated cameras; images without a pose are absent
     * @return all cameras plus the accepted landmarks, never null
     * @throws triangulation.ConfigurationException if the sampling setup is invalid for some track
     */
    public SfmData run(List<Track2D> tracks, CameraRegistry cameras) {
        RobustPointTriangulator triangulator = new RobustPointTriangulator(cameras, config.getTriangulation());
        List<TriangulationResult> results = triangulateAll(triangulator, tracks);

        CurationReport.Builder report = CurationReport.builder();
        List<Landmark> landmarks = new ArrayList<>();
        for (TriangulationResult result : results) {
            report.track();
            if (!result.isAccepted()) {
                report.rejected(result);
                continue;
            }
            Landmark landmark = result.getLandmark().get();
            if (landmark.numberMeasurements() >= config.getMinTrackLength()) {
                landmarks.add(landmark);
                report.accepted(landmark, result.getAverageReprojectionError().getAsDouble());
            } else {
                LOGGER.fine(String.format("Track length %d < %d discarded",
                        landmark.numberMeasurements(), config.getMinTrackLength()));
                report.rejected(RejectionReason.INSUFFICIENT_SUPPORT);
            }
        }

        CurationReport summary = report.build();
        LOGGER.info(summary.toString());
        return new SfmData(cameras, Collections.unmodifiableList(landmarks), summary);
    }

    private List<TriangulationResult> triangulateAll(RobustPointTriangulator triangulator, List<Track2D> tracks) {
        List<TriangulationResult> results = new ArrayList<>(tracks.size());
        if (config.getParallelism() == 1 || tracks.size() < 2) {
            for (Track2D track : tracks) {
                results.add(triangulator.triangulate(track));
            }
            return results;
        }

        ExecutorService pool = Executors.newFixedThreadPool(Math.min(config.getParallelism(), tracks.size()));
        try {
            List<Future<TriangulationResult>> futures = new ArrayList<>(tracks.size());
            for (Track2D track : tracks) {
                futures.add(pool.submit(() -> triangulator.triangulate(track)));
            }
            for (Future<TriangulationResult> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Track triangulation failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while triangulating tracks", e);
        } finally {
            pool.shutdownNow();
        }
    }
}
