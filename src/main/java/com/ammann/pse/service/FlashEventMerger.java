/* (C)2026 */
package com.ammann.pse.service;

import com.ammann.pse.enumeration.FlashKind;
import com.ammann.pse.model.FlashEvent;

/**
 * Merges general flash candidates: the span is extended to cover both events, the
 * intensities are averaged and the more severe {@link FlashKind} is kept.
 */
public class FlashEventMerger extends EventMerger<FlashEvent>
{
    public FlashEventMerger(double tolerance) {
        super(tolerance);
    }

    @Override
    protected FlashEvent fold(FlashEvent current, FlashEvent next) {
        double endTime = Math.max(current.endTime(), next.endTime());
        return new FlashEvent(
                current.timestamp(),
                (current.intensity() + next.intensity()) / 2.0,
                endTime - current.timestamp(),
                FlashKind.mostSevere(current.kind(), next.kind()));
    }

    @Override
    protected FlashEvent truncate(FlashEvent event, double endTime) {
        return event.endingAt(endTime);
    }
}
