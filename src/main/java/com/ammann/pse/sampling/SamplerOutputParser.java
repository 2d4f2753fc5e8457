/* (C)2026 */
package com.ammann.pse.sampling;

import com.ammann.pse.model.LuminanceSample;
import com.ammann.pse.model.RedSample;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import org.jboss.logging.Logger;

/**
 * Converts the per-frame CSV emitted by the external frame sampler into sample sequences.
 *
 * <p>Each line has the form {@code timestamp,value[,...]}: presentation time in seconds
 * followed by the average plane value. Blank lines, lines with fewer than two fields and
 * lines with non-numeric fields are skipped, so a partially corrupted sampler output still
 * yields every readable frame.
 *
 * <p>The red sampler reports only the red plane average; saturation is approximated as
 * {@code min(red / 255, 1)}.
 */
@ApplicationScoped
public class SamplerOutputParser {

    private static final Logger LOG = Logger.getLogger(SamplerOutputParser.class);

    static final double FULL_SCALE = 255.0;

    /**
     * Parses luminance sampler output.
     *
     * @param output raw sampler output, may be {@code null}
     * @return readable samples in output order
     */
    public List<LuminanceSample> parseLuminance(String output) {
        List<LuminanceSample> samples = new ArrayList<>();
        int skipped = 0;

        for (String line : lines(output)) {
            double[] fields = parseLine(line);
            if (fields == null) {
                skipped++;
                continue;
            }
            samples.add(new LuminanceSample(fields[0], fields[1]));
        }

        logSkipped("luminance", skipped, samples.size());
        return samples;
    }

    /**
     * Parses red-plane sampler output.
     *
     * @param output raw sampler output, may be {@code null}
     * @return readable samples in output order
     */
    public List<RedSample> parseRed(String output) {
        List<RedSample> samples = new ArrayList<>();
        int skipped = 0;

        for (String line : lines(output)) {
            double[] fields = parseLine(line);
            if (fields == null) {
                skipped++;
                continue;
            }
            double red = fields[1];
            double saturation = Math.max(0.0, Math.min(red / FULL_SCALE, 1.0));
            samples.add(new RedSample(fields[0], red, saturation));
        }

        logSkipped("red", skipped, samples.size());
        return samples;
    }

    private List<String> lines(String output) {
        if (output == null || output.isBlank()) {
            return List.of();
        }
        return output.strip().lines().toList();
    }

    /** Returns {@code [timestamp, value]} or {@code null} for an unreadable line. */
    private double[] parseLine(String line) {
        if (line.isBlank()) {
            return null;
        }

        String[] parts = line.split(",");
        if (parts.length < 2) {
            return null;
        }

        try {
            double timestamp = Double.parseDouble(parts[0].trim());
            double value = Double.parseDouble(parts[1].trim());
            if (!Double.isFinite(timestamp) || !Double.isFinite(value)) {
                return null;
            }
            return new double[] {timestamp, value};
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private void logSkipped(String plane, int skipped, int parsed) {
        if (skipped > 0) {
            LOG.debugf("Skipped %d unreadable %s sampler lines (%d parsed)", (Object) skipped, plane, parsed);
        }
    }
}
