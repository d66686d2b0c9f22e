package com.deepansh.collab.model;

import java.util.List;

/**
 * Named arrangement of slots dealt when a session starts. Slot ids are
 * unique within a layout and become the resource ids.
 */
public record Layout(String name, List<Slot> slots) {

    public Layout {
        slots = List.copyOf(slots);
    }

    public int size() {
        return slots.size();
    }

    public record Slot(String id, String label) {
    }
}
