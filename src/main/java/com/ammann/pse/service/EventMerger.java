/* (C)2026 */
package com.ammann.pse.service;

import com.ammann.pse.model.TimedEvent;
import java.util.ArrayList;
import java.util.List;

/**
 * Folds time-ordered flash candidates into discrete, non-overlapping events.
 *
 * <p>A candidate starting within the merge tolerance of the start of the event being
 * accumulated is folded into it; any other candidate closes the accumulated event and
 * starts a new one. A closed event whose estimated span reaches past the start of its
 * successor is cut back to that start, so merged events never overlap while still
 * covering every folded candidate's timestamp.
 *
 * <p>Subclasses define how two events combine. Instances are immutable and may be
 * shared; all accumulation happens inside a {@link Session} owned by one call.
 *
 * @param <E> event type
 */
public abstract class EventMerger<E extends TimedEvent>
{
    private final double tolerance;

    protected EventMerger(double tolerance) {
        this.tolerance = tolerance;
    }

    /**
     * Merges a time-ordered candidate list.
     *
     * @param candidates candidates in ascending timestamp order
     * @return immutable list of merged events
     */
    public List<E> merge(List<E> candidates) {
        Session session = newSession();
        for (E candidate : candidates) {
            session.accept(candidate);
        }
        return session.finish();
    }

    /**
     * Opens a new merge session for incremental use.
     */
    public Session newSession() {
        return new Session();
    }

    public double getTolerance() { return tolerance; }

    /**
     * Combines {@code next} into {@code current}. The result must start at
     * {@code current.timestamp()} and end no earlier than either input.
     */
    protected abstract E fold(E current, E next);

    /**
     * Returns {@code event} shortened to end at {@code endTime}.
     */
    protected abstract E truncate(E event, double endTime);

    enum MergeState
    {
        IDLE,
        ACCUMULATING
    }

    /**
     * Single-use merge buffer. Callers only ever observe the finished list returned
     * by {@link #finish()}.
     */
    public final class Session
    {
        private final List<E> merged = new ArrayList<>();
        private MergeState state = MergeState.IDLE;
        private E current;

        private Session() {}

        /**
         * Feeds the next candidate. Candidates must arrive in ascending timestamp order.
         */
        public void accept(E next) {
            switch (state) {
                case IDLE -> {
                    current = next;
                    state = MergeState.ACCUMULATING;
                }
                case ACCUMULATING -> {
                    if (next.timestamp() - current.timestamp() <= tolerance) {
                        current = fold(current, next);
                    } else {
                        emit(next.timestamp());
                        current = next;
                    }
                }
            }
        }

        /**
         * Closes any event still accumulating and returns the merged list.
         */
        public List<E> finish() {
            if (state == MergeState.ACCUMULATING) {
                emit(Double.POSITIVE_INFINITY);
                state = MergeState.IDLE;
            }
            return List.copyOf(merged);
        }

        MergeState state() {
            return state;
        }

        private void emit(double nextStart) {
            E closed = current.endTime() > nextStart ? truncate(current, nextStart) : current;
            merged.add(closed);
            current = null;
        }
    }
}
