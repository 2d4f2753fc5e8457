/* (C)2026 */
package com.ammann.pse.service;

import com.ammann.pse.config.PseThresholds;
import com.ammann.pse.model.RedFlashEvent;
import com.ammann.pse.model.RedSample;
import com.ammann.pse.sampling.FrameRates;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Detects saturated-red flashes in a red-channel sample sequence.
 *
 * <p>Works like {@link FlashEventDetector} with red-specific rules: deltas are weighted
 * by the red luminance weight, the detection threshold is a fraction of the general one,
 * only samples whose saturation exceeds the red saturation threshold count, and both the
 * duration lookahead and the merge tolerance are shorter.
 */
@ApplicationScoped
public class RedFlashEventDetector {

    private static final Logger LOG = Logger.getLogger(RedFlashEventDetector.class);

    private PseThresholds thresholds;
    private RedFlashEventMerger merger;

    @Inject
    public RedFlashEventDetector(PseThresholds thresholds) {
        this.thresholds = thresholds;
        this.merger = new RedFlashEventMerger(thresholds.redMergeTolerance());
    }

    /**
     * Detects and merges red flash events.
     *
     * @param samples   red samples in presentation order
     * @param frameRate nominal frame rate; {@code null} or non-positive selects the default
     * @return immutable list of merged, non-overlapping red flash events
     */
    public List<RedFlashEvent> detect(List<RedSample> samples, Double frameRate) {
        List<RedSample> ordered = SampleOrdering.ordered(samples, RedSample::timestamp);
        if (ordered.size() < 2) {
            return List.of();
        }

        double fps = FrameRates.orDefault(frameRate, thresholds.defaultFrameRate());
        List<RedFlashEvent> candidates = detectCandidates(ordered, fps);
        List<RedFlashEvent> merged = merger.merge(candidates);

        LOG.debugf("Red flash detection: %d samples at %.3f fps -> %d candidates -> %d red flashes",
                ordered.size(), fps, candidates.size(), merged.size());

        return merged;
    }

    public RedFlashEventMerger getMerger() { return merger; }

    /** Unmerged candidates over the red threshold with sufficient saturation. */
    List<RedFlashEvent> detectCandidates(List<RedSample> samples, double fps) {
        List<RedFlashEvent> candidates = new ArrayList<>();

        for (int i = 1; i < samples.size(); i++) {
            RedSample sample = samples.get(i);
            double current = sample.redIntensity();
            double previous = samples.get(i - 1).redIntensity();
            double weightedDelta = Math.abs(current - previous) * thresholds.redLuminanceWeight();

            if (!(weightedDelta > thresholds.redDetectionThreshold())) {
                continue;
            }
            // Low-saturation red does not count regardless of the delta
            if (!(sample.saturation() > thresholds.redSaturationThreshold())) {
                continue;
            }

            double peak = Math.max(current, previous);
            double intensity = peak > 0.0 ? weightedDelta / peak : 0.0;

            candidates.add(new RedFlashEvent(
                    sample.timestamp(),
                    intensity,
                    estimateDuration(samples, i, fps),
                    sample.saturation(),
                    current));
        }

        return candidates;
    }

    double estimateDuration(List<RedSample> samples, int index, double fps) {
        double base = samples.get(index).redIntensity();
        int limit = Math.min(samples.size(), index + thresholds.redLookaheadFrames());
        int frames = 1;

        for (int i = index + 1; i < limit; i++) {
            double weightedDelta = Math.abs(samples.get(i).redIntensity() - base) * thresholds.redLuminanceWeight();
            if (weightedDelta > thresholds.redContinuationThreshold()) {
                frames++;
            } else {
                break;
            }
        }

        return frames / fps;
    }
}
