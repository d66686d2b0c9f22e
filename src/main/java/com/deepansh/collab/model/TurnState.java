package com.deepansh.collab.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turn order and resource set of a started session. Mutated only by the
 * turn coordinator under the session monitor.
 */
public class TurnState {

    private final List<String> turnOrder;
    private final Map<String, TurnResource> resources = new LinkedHashMap<>();

    @Getter
    private int currentTurnIndex;

    public TurnState(List<String> turnOrder, List<TurnResource> resources) {
        this.turnOrder = new ArrayList<>(turnOrder);
        resources.forEach(r -> this.resources.put(r.getId(), r));
    }

    public List<String> getTurnOrder() {
        return Collections.unmodifiableList(turnOrder);
    }

    public Collection<TurnResource> getResources() {
        return Collections.unmodifiableCollection(resources.values());
    }

    public Optional<TurnResource> resource(String resourceId) {
        return Optional.ofNullable(resources.get(resourceId));
    }

    public Optional<String> currentUserId() {
        if (turnOrder.isEmpty()) return Optional.empty();
        return Optional.of(turnOrder.get(currentTurnIndex));
    }

    public void advance() {
        if (turnOrder.isEmpty()) return;
        currentTurnIndex = (currentTurnIndex + 1) % turnOrder.size();
    }

    public void append(String userId) {
        if (!turnOrder.contains(userId)) {
            turnOrder.add(userId);
        }
    }

    /**
     * Removes a user and keeps the cursor on the same person, or on the next
     * remaining one when the removed user held the turn.
     *
     * @return true when the user whose turn it is changed
     */
    public boolean remove(String userId) {
        int idx = turnOrder.indexOf(userId);
        if (idx < 0) return false;

        boolean wasCurrent = idx == currentTurnIndex;
        turnOrder.remove(idx);

        if (turnOrder.isEmpty()) {
            currentTurnIndex = 0;
        } else if (idx < currentTurnIndex) {
            currentTurnIndex--;
        } else if (wasCurrent && currentTurnIndex >= turnOrder.size()) {
            currentTurnIndex = 0;
        }
        return wasCurrent;
    }
}
