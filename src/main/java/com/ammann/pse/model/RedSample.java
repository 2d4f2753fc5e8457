/* (C)2026 */
package com.ammann.pse.model;

/**
 * Red-channel measurement of one sampled frame.
 *
 * <p>Produced independently of {@link LuminanceSample}; the two sequences need
 * not share timestamps.
 *
 * @param timestamp    presentation time in seconds
 * @param redIntensity average red-channel value
 * @param saturation   red saturation in the range [0, 1]
 */
public record RedSample(double timestamp, double redIntensity, double saturation)
{
}
