package com.deepansh.collab.turn;

import com.deepansh.collab.model.Layout;

import java.util.Collection;
import java.util.Optional;

/**
 * Source of layout templates. Deck and slot content is owned by an external
 * content provider; the engine only needs slot ids and labels.
 */
public interface LayoutCatalog {

    Optional<Layout> find(String name);

    Collection<Layout> all();
}
