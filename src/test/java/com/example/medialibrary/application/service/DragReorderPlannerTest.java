package com.example.medialibrary.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

class DragReorderPlannerTest {

    private final List<String> rows = Arrays.asList("a", "b", "c", "d", "e");

    @Test
    void shouldMoveSingleRowDown() {
        assertEquals(Arrays.asList("b", "c", "a", "d", "e"),
                DragReorderPlanner.plan(rows, Collections.singletonList(0), 2));
    }

    @Test
    void shouldMoveSingleRowUp() {
        assertEquals(Arrays.asList("a", "b", "d", "c", "e"),
                DragReorderPlanner.plan(rows, Collections.singletonList(3), 1));
    }

    @Test
    void shouldInsertAtFrontWhenDroppedOnFirstRow() {
        assertEquals(Arrays.asList("c", "a", "b", "d", "e"),
                DragReorderPlanner.plan(rows, Collections.singletonList(2), 0));
    }

    @Test
    void shouldKeepRelativeOrderOfNonContiguousSelection() {
        assertEquals(Arrays.asList("c", "d", "a", "b", "e"),
                DragReorderPlanner.plan(rows, Arrays.asList(4, 1, 0), 3));
    }

    @Test
    void shouldAppendWhenDroppedPastEnd() {
        assertEquals(Arrays.asList("a", "c", "d", "e", "b"),
                DragReorderPlanner.plan(rows, Collections.singletonList(1), 99));
    }

    @Test
    void shouldReturnSameOrderWithoutSelection() {
        assertEquals(rows, DragReorderPlanner.plan(rows, Collections.<Integer>emptyList(), 2));
    }

    @Test
    void shouldRejectOutOfRangeIndices() {
        assertThrows(IllegalArgumentException.class,
                () -> DragReorderPlanner.plan(rows, Collections.singletonList(5), 1));
        assertThrows(IllegalArgumentException.class,
                () -> DragReorderPlanner.plan(rows, Collections.singletonList(1), -1));
    }
}
