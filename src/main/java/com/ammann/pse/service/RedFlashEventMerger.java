/* (C)2026 */
package com.ammann.pse.service;

import com.ammann.pse.model.RedFlashEvent;

/**
 * Merges red flash candidates: the span is extended, intensities are averaged and the
 * higher saturation and red value are kept.
 */
public class RedFlashEventMerger extends EventMerger<RedFlashEvent>
{
    public RedFlashEventMerger(double tolerance) {
        super(tolerance);
    }

    @Override
    protected RedFlashEvent fold(RedFlashEvent current, RedFlashEvent next) {
        double endTime = Math.max(current.endTime(), next.endTime());
        return new RedFlashEvent(
                current.timestamp(),
                (current.intensity() + next.intensity()) / 2.0,
                endTime - current.timestamp(),
                Math.max(current.saturation(), next.saturation()),
                Math.max(current.redValue(), next.redValue()));
    }

    @Override
    protected RedFlashEvent truncate(RedFlashEvent event, double endTime) {
        return event.endingAt(endTime);
    }
}
