package io.fieldtree.core.model;

import io.fieldtree.core.document.SourceLocation;

import java.util.Objects;

/**
 * Source position that contributed a field or fragment.
 *
 * @param container the enclosing definition: {@code query Hero}, {@code fragment HeroDetails}
 *                  or {@code ... on Droid}
 */
public record Origin(String container, SourceLocation location) {

    public Origin {
        Objects.requireNonNull(container, "container");
        location = location == null ? SourceLocation.UNKNOWN : location;
    }

    @Override
    public String toString() {
        return container + "@" + location;
    }
}
