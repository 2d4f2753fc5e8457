/* (C)2026 */
package com.ammann.pse.model;

/**
 * Average luminance of one sampled frame.
 *
 * <p>Luminance may be on the 8-bit scale [0, 255] or normalized to [0, 1]; the
 * detection threshold applies to absolute deltas, so the scale only has to be
 * consistent within one sequence.
 *
 * @param timestamp presentation time in seconds
 * @param luminance average frame luminance
 */
public record LuminanceSample(double timestamp, double luminance)
{
}
