package com.questrail.designer.internal.state;

import com.questrail.designer.api.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * DiagramHistory
 * -----------------------------------------------------------------------------
 * Bounded undo/redo history of committed documents.
 *
 * <h2>Model</h2>
 * An immutable list of snapshots with a cursor at the current one. The first
 * snapshot is the document the history was started with.
 * <ul>
 *   <li>{@link #record(Document)} discards every snapshot after the cursor,
 *       appends, and drops the oldest snapshot once more than
 *       {@code capacity + 1} are held, so at most {@code capacity} undo steps
 *       are available.</li>
 *   <li>{@link #undo()} and {@link #redo()} only move the cursor.</li>
 * </ul>
 *
 * Every operation returns a new instance.
 */
public final class DiagramHistory
{
    private final List<Document> snapshots;
    private final int cursor;
    private final int capacity;

    private DiagramHistory(List<Document> snapshots, int cursor, int capacity) {
        this.snapshots = List.copyOf(snapshots);
        this.cursor = cursor;
        this.capacity = capacity;
    }

    /**
     * Starts a history whose only snapshot is {@code initial}.
     *
     * @param capacity maximum number of undo steps, at least 1
     */
    public static DiagramHistory start(int capacity, Document initial) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        return new DiagramHistory(List.of(Objects.requireNonNull(initial, "initial")), 0, capacity);
    }

    public DiagramHistory record(Document document) {
        Objects.requireNonNull(document, "document");
        List<Document> next = new ArrayList<>(snapshots.subList(0, cursor + 1));
        next.add(document);
        while (next.size() > capacity + 1) {
            next.remove(0);
        }
        return new DiagramHistory(next, next.size() - 1, capacity);
    }

    public boolean canUndo() {
        return cursor > 0;
    }

    public boolean canRedo() {
        return cursor < snapshots.size() - 1;
    }

    /**
     * Returns the history moved one step back, or empty at the oldest snapshot.
     */
    public Optional<DiagramHistory> undo() {
        if (!canUndo()) {
            return Optional.empty();
        }
        return Optional.of(new DiagramHistory(snapshots, cursor - 1, capacity));
    }

    /**
     * Returns the history moved one step forward, or empty at the newest snapshot.
     */
    public Optional<DiagramHistory> redo() {
        if (!canRedo()) {
            return Optional.empty();
        }
        return Optional.of(new DiagramHistory(snapshots, cursor + 1, capacity));
    }

    public Document current() {
        return snapshots.get(cursor);
    }

    public int size() {
        return snapshots.size();
    }

    public int cursor() {
        return cursor;
    }

    public int capacity() {
        return capacity;
    }
}
