package com.riskrails.venue;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Name-indexed set of venue clients, assembled once at startup from the configured clients.
 */
public class VenueRegistry {

    private static final Logger log = LoggerFactory.getLogger(VenueRegistry.class);

    private final Map<String, VenueClient> venues = new LinkedHashMap<>();

    public VenueRegistry(List<VenueClient> clients) {
        for (VenueClient client : clients) {
            String key = client.name().toUpperCase(Locale.ROOT);
            if (venues.putIfAbsent(key, client) != null) {
                throw new IllegalStateException("Duplicate venue client registered: " + key);
            }
        }
        log.info("Venue registry initialised: venues={}", venues.keySet());
    }

    public Optional<VenueClient> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(venues.get(name.toUpperCase(Locale.ROOT)));
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(venues.keySet());
    }

    public Collection<VenueClient> all() {
        return Collections.unmodifiableCollection(venues.values());
    }
}
