package com.example.medialibrary.application.service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Computes the order produced by dragging a set of rows onto a drop row. Works purely on the displayed
 * order it is given.
 */
public final class DragReorderPlanner {

    private DragReorderPlanner() {
    }

    /**
     * Removes the dragged rows, then splices them back in their relative order. Dropping on row 0 inserts at
     * the front; otherwise the insertion point is the number of non-dragged rows at indices {@code 0..dropIndex}.
     * A drop index past the end appends.
     *
     * @throws IllegalArgumentException when a dragged index is out of range or the drop index is negative
     */
    public static <T> List<T> plan(List<T> current, Collection<Integer> draggedIndices, int dropIndex) {
        if (current == null) {
            throw new IllegalArgumentException("current order must not be null");
        }
        if (dropIndex < 0) {
            throw new IllegalArgumentException("drop index must not be negative: " + dropIndex);
        }
        TreeSet<Integer> dragged = new TreeSet<>();
        if (draggedIndices != null) {
            for (Integer index : draggedIndices) {
                if (index == null || index < 0 || index >= current.size()) {
                    throw new IllegalArgumentException("dragged index out of range: " + index);
                }
                dragged.add(index);
            }
        }
        if (dragged.isEmpty()) {
            return new ArrayList<>(current);
        }

        List<T> moving = new ArrayList<>(dragged.size());
        List<T> remaining = new ArrayList<>(current.size() - dragged.size());
        for (int i = 0; i < current.size(); i++) {
            if (dragged.contains(i)) {
                moving.add(current.get(i));
            } else {
                remaining.add(current.get(i));
            }
        }

        int insertAt = 0;
        if (dropIndex > 0) {
            int last = Math.min(dropIndex, current.size() - 1);
            for (int i = 0; i <= last; i++) {
                if (!dragged.contains(i)) {
                    insertAt++;
                }
            }
        }

        List<T> result = new ArrayList<>(current.size());
        result.addAll(remaining.subList(0, insertAt));
        result.addAll(moving);
        result.addAll(remaining.subList(insertAt, remaining.size()));
        return result;
    }
}
