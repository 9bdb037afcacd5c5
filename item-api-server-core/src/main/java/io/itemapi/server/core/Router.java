package io.itemapi.server.core;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps {@code (method, path pattern)} pairs to {@link RequestHandler}s.
 *
 * <p>Patterns are made of literal segments and {@code {name}} parameters, e.g. {@code /items/{id}}.
 * A parameter matches exactly one non-empty segment. Literal segments win over parameters, so
 * registration order does not matter. A {@code HEAD} request falls back to the {@code GET}
 * handler of the same pattern.
 *
 * <pre>{@code
 * Router router = new Router()
 *     .route(HttpMethod.GET, "/items", listHandler)
 *     .route(HttpMethod.GET, "/items/{id}", getHandler);
 * }</pre>
 */
public final class Router {

    private final List<Pattern> patterns = new ArrayList<>();

    public Router route(HttpMethod method, String pattern, RequestHandler handler) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(handler, "handler");
        Pattern parsed = Pattern.parse(pattern);

        Pattern existing = find(parsed);
        if (existing == null) {
            patterns.add(parsed);
            existing = parsed;
        }
        if (existing.handlers.putIfAbsent(method, handler) != null) {
            throw new IllegalArgumentException("handler already registered for " + method + " " + pattern);
        }
        return this;
    }

    /**
     * Resolves a request path (already percent-decoded) for the given method.
     */
    public Resolution resolve(HttpMethod method, String path) {
        Objects.requireNonNull(method, "method");
        String[] segments = split(path);
        if (segments == null) return new Resolution.NotFound();

        Pattern best = null;
        Map<String, String> bestParams = null;
        for (Pattern p : patterns) {
            Map<String, String> params = p.match(segments);
            if (params == null) continue;
            if (best == null || p.literalCount > best.literalCount) {
                best = p;
                bestParams = params;
            }
        }
        if (best == null) return new Resolution.NotFound();

        RequestHandler handler = best.handlers.get(method);
        if (handler == null && method == HttpMethod.HEAD) {
            handler = best.handlers.get(HttpMethod.GET);
        }
        if (handler == null) {
            return new Resolution.MethodNotAllowed(best.allowed());
        }
        return new Resolution.Found(handler, new PathParams(bestParams));
    }

    private Pattern find(Pattern candidate) {
        for (Pattern p : patterns) {
            if (p.sameShape(candidate)) return p;
        }
        return null;
    }

    private static String[] split(String path) {
        if (path == null || !path.startsWith("/")) return null;
        if (path.length() == 1) return new String[0];
        return path.substring(1).split("/", -1);
    }

    /**
     * Outcome of {@link #resolve(HttpMethod, String)}.
     */
    public sealed interface Resolution permits Resolution.Found, Resolution.MethodNotAllowed, Resolution.NotFound {

        record Found(RequestHandler handler, PathParams params) implements Resolution {}

        /** The path matched, but not under the requested method. */
        record MethodNotAllowed(Set<HttpMethod> allowed) implements Resolution {}

        record NotFound() implements Resolution {}
    }

    private static final class Pattern {
        private final String source;
        // null entry = parameter segment
        private final String[] literals;
        private final String[] paramNames;
        private final int literalCount;
        private final Map<HttpMethod, RequestHandler> handlers = new EnumMap<>(HttpMethod.class);

        private Pattern(String source, String[] literals, String[] paramNames) {
            this.source = source;
            this.literals = literals;
            this.paramNames = paramNames;
            int count = 0;
            for (String l : literals) {
                if (l != null) count++;
            }
            this.literalCount = count;
        }

        static Pattern parse(String pattern) {
            String[] segments = split(pattern);
            if (segments == null) throw new IllegalArgumentException("pattern must start with '/': " + pattern);
            String[] literals = new String[segments.length];
            String[] names = new String[segments.length];
            for (int i = 0; i < segments.length; i++) {
                String s = segments[i];
                if (s.isEmpty()) throw new IllegalArgumentException("empty segment in pattern: " + pattern);
                if (s.startsWith("{") && s.endsWith("}")) {
                    String name = s.substring(1, s.length() - 1);
                    if (name.isEmpty()) throw new IllegalArgumentException("unnamed parameter in pattern: " + pattern);
                    names[i] = name;
                } else {
                    literals[i] = s;
                }
            }
            return new Pattern(pattern, literals, names);
        }

        Map<String, String> match(String[] segments) {
            if (segments.length != literals.length) return null;
            Map<String, String> params = new LinkedHashMap<>();
            for (int i = 0; i < segments.length; i++) {
                if (literals[i] != null) {
                    if (!literals[i].equals(segments[i])) return null;
                } else {
                    if (segments[i].isEmpty()) return null;
                    params.put(paramNames[i], segments[i]);
                }
            }
            return params;
        }

        boolean sameShape(Pattern other) {
            if (other.literals.length != literals.length) return false;
            for (int i = 0; i < literals.length; i++) {
                if (!Objects.equals(literals[i], other.literals[i])) return false;
                if (!Objects.equals(paramNames[i], other.paramNames[i])) return false;
            }
            return true;
        }

        Set<HttpMethod> allowed() {
            Set<HttpMethod> allowed = EnumSet.noneOf(HttpMethod.class);
            allowed.addAll(handlers.keySet());
            if (allowed.contains(HttpMethod.GET)) allowed.add(HttpMethod.HEAD);
            return allowed;
        }

        @Override
        public String toString() {
            return source;
        }
    }
}
