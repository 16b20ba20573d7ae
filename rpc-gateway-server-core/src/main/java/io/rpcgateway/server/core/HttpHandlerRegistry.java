package io.rpcgateway.server.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Path-prefix routing table consulted by the transport for every request.
 *
 * <p>A handler registered with {@code exactMatch} only serves its exact path; otherwise it serves
 * every path starting with the prefix. Later registrations are consulted first. Thread-safe.
 */
public final class HttpHandlerRegistry {

    /**
     * Routing decision: the handler plus the path left over after its prefix.
     */
    public record Match(HttpRequestHandler handler, String pathRemainder) {}

    private record Entry(String prefix, boolean exactMatch, HttpRequestHandler handler) {}

    private final List<Entry> entries = new ArrayList<>();

    public synchronized void register(String prefix, boolean exactMatch, HttpRequestHandler handler) {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(handler, "handler");
        entries.add(0, new Entry(prefix, exactMatch, handler));
    }

    public synchronized boolean unregister(String prefix, boolean exactMatch) {
        return entries.removeIf(e -> e.prefix().equals(prefix) && e.exactMatch() == exactMatch);
    }

    public synchronized Optional<Match> find(String path) {
        String p = path == null || path.isEmpty() ? "/" : path;
        for (Entry e : entries) {
            boolean matches = e.exactMatch() ? p.equals(e.prefix()) : p.startsWith(e.prefix());
            if (matches) {
                return Optional.of(new Match(e.handler(), p.substring(e.prefix().length())));
            }
        }
        return Optional.empty();
    }
}
