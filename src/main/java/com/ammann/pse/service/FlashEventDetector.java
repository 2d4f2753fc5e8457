/* (C)2026 */
package com.ammann.pse.service;

import com.ammann.pse.config.PseThresholds;
import com.ammann.pse.enumeration.FlashKind;
import com.ammann.pse.model.FlashEvent;
import com.ammann.pse.model.LuminanceSample;
import com.ammann.pse.sampling.FrameRates;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Detects general flashes in a luminance sample sequence following the ITU-R BT.1702
 * frame-pair method.
 *
 * <p>Every consecutive pair whose absolute luminance delta exceeds the minimum flash
 * intensity yields a candidate at the later sample. The candidate's duration is estimated
 * by looking ahead while the luminance keeps differing from the flash frame by more than
 * half the detection threshold. Candidates are then merged by a {@link FlashEventMerger}.
 *
 * <p>Stateless; safe for concurrent use.
 */
@ApplicationScoped
public class FlashEventDetector {

    private static final Logger LOG = Logger.getLogger(FlashEventDetector.class);

    private PseThresholds thresholds;
    private FlashEventMerger merger;

    @Inject
    public FlashEventDetector(PseThresholds thresholds) {
        this.thresholds = thresholds;
        this.merger = new FlashEventMerger(thresholds.flashMergeTolerance());
    }

    /**
     * Detects and merges flash events.
     *
     * @param samples   luminance samples in presentation order
     * @param frameRate nominal frame rate; {@code null} or non-positive selects the default
     * @return immutable list of merged, non-overlapping flash events
     */
    public List<FlashEvent> detect(List<LuminanceSample> samples, Double frameRate) {
        List<LuminanceSample> ordered = SampleOrdering.ordered(samples, LuminanceSample::timestamp);
        if (ordered.size() < 2) {
            return List.of();
        }

        double fps = FrameRates.orDefault(frameRate, thresholds.defaultFrameRate());
        List<FlashEvent> candidates = detectCandidates(ordered, fps);
        List<FlashEvent> merged = merger.merge(candidates);

        LOG.debugf("Flash detection: %d samples at %.3f fps -> %d candidates -> %d flashes",
                ordered.size(), fps, candidates.size(), merged.size());

        return merged;
    }

    public FlashEventMerger getMerger() { return merger; }

    /** Unmerged candidates, one per frame pair over the threshold. */
    List<FlashEvent> detectCandidates(List<LuminanceSample> samples, double fps) {
        List<FlashEvent> candidates = new ArrayList<>();

        for (int i = 1; i < samples.size(); i++) {
            double current = samples.get(i).luminance();
            double previous = samples.get(i - 1).luminance();
            double delta = Math.abs(current - previous);

            if (delta > thresholds.minFlashIntensity()) {
                double intensity = relativeIntensity(delta, current, previous);
                candidates.add(new FlashEvent(
                        samples.get(i).timestamp(),
                        intensity,
                        estimateDuration(samples, i, fps),
                        FlashKind.fromIntensity(intensity)));
            }
        }

        return candidates;
    }

    /**
     * Estimates how long the flash starting at {@code index} lasts: one frame, plus one
     * frame for each following sample (within the lookahead window) that still differs
     * from the flash frame by more than the continuation threshold.
     */
    double estimateDuration(List<LuminanceSample> samples, int index, double fps) {
        double base = samples.get(index).luminance();
        int limit = Math.min(samples.size(), index + thresholds.flashLookaheadFrames());
        int frames = 1;

        for (int i = index + 1; i < limit; i++) {
            if (Math.abs(samples.get(i).luminance() - base) > thresholds.flashContinuationThreshold()) {
                frames++;
            } else {
                break;
            }
        }

        return frames / fps;
    }

    private static double relativeIntensity(double delta, double current, double previous) {
        double peak = Math.max(current, previous);
        if (!(peak > 0.0)) {
            return 0.0;
        }
        return Math.min(delta / peak, 1.0);
    }
}
