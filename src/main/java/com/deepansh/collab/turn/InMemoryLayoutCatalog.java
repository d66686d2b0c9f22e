package com.deepansh.collab.turn;

import com.deepansh.collab.model.Layout;
import com.deepansh.collab.model.Layout.Slot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.IntStream;

/**
 * Built-in layouts used when no content provider is wired in.
 */
@Component
@Slf4j
public class InMemoryLayoutCatalog implements LayoutCatalog {

    private static final List<String> SIGNS = List.of(
            "Aries", "Taurus", "Gemini", "Cancer", "Leo", "Virgo",
            "Libra", "Scorpio", "Sagittarius", "Capricorn", "Aquarius", "Pisces");

    private static final List<String> PLANETS = List.of(
            "Sun", "Moon", "Mercury", "Venus", "Mars", "Jupiter", "Saturn");

    private final Map<String, Layout> layouts = new LinkedHashMap<>();

    public InMemoryLayoutCatalog() {
        register(new Layout("three-card", List.of(
                new Slot("slot1", "Past"),
                new Slot("slot2", "Present"),
                new Slot("slot3", "Future"))));

        register(new Layout("celtic-cross", List.of(
                new Slot("slot1", "Present"),
                new Slot("slot2", "Challenge"),
                new Slot("slot3", "Foundation"),
                new Slot("slot4", "Recent Past"),
                new Slot("slot5", "Crown"),
                new Slot("slot6", "Near Future"),
                new Slot("slot7", "Self"),
                new Slot("slot8", "Environment"),
                new Slot("slot9", "Hopes and Fears"),
                new Slot("slot10", "Outcome"))));

        register(new Layout("zodiac-wheel", SIGNS.stream()
                .map(sign -> new Slot(sign.toLowerCase(), sign))
                .toList()));

        register(new Layout("planetary", PLANETS.stream()
                .map(planet -> new Slot(planet.toLowerCase(), planet))
                .toList()));

        register(new Layout("playlist", IntStream.rangeClosed(1, 5)
                .mapToObj(i -> new Slot("track" + i, "Track " + i))
                .toList()));

        log.info("Layout catalog loaded: {}", layouts.keySet());
    }

    @Override
    public Optional<Layout> find(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(layouts.get(name.trim().toLowerCase()));
    }

    @Override
    public Collection<Layout> all() {
        return Collections.unmodifiableCollection(layouts.values());
    }

    private void register(Layout layout) {
        layouts.put(layout.name(), layout);
    }
}
