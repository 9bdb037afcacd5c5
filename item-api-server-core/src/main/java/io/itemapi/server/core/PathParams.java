package io.itemapi.server.core;

import java.util.Map;
import java.util.Objects;

/**
 * Path parameters extracted by the {@link Router}, keyed by the {@code {name}} of their segment.
 */
public final class PathParams {
    private final Map<String, String> values;

    PathParams(Map<String, String> values) {
        this.values = Map.copyOf(Objects.requireNonNull(values, "values"));
    }

    /**
     * Value of a parameter the matched route is known to declare.
     *
     * @throws IllegalStateException if the route has no such parameter
     */
    public String require(String name) {
        String v = values.get(name);
        if (v == null) throw new IllegalStateException("route declares no path parameter '" + name + "'");
        return v;
    }
}
