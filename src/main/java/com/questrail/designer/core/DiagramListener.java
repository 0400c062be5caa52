package com.questrail.designer.core;

import com.questrail.designer.internal.state.DiagramState;

/**
 * Receives the store's state after every committed mutation, including undo
 * and redo. Called synchronously on the mutating thread.
 */
@FunctionalInterface
public interface DiagramListener
{
    void onChange(DiagramState state);

    /**
     * Handle returned by {@link DiagramStore#subscribe(DiagramListener)}.
     * Closing it more than once has no further effect.
     */
    interface Subscription extends AutoCloseable
    {
        @Override
        void close();
    }
}
