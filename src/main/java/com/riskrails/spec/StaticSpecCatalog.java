package com.riskrails.spec;

import com.riskrails.domain.model.SymbolSpec;
import com.riskrails.mapper.JsonHelper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Static symbol specs used when a venue does not publish lot constraints or cannot be reached.
 *
 * <p>Loaded once from the classpath resource {@code symbol-specs.json}, then overlaid by the
 * file named in {@code riskrails.specs.overrides-file} when it exists. Lookup precedence:
 * per-symbol entry, then the venue-wide fallback. Venue aliases (e.g. {@code BINANCE_MARGIN})
 * resolve to their target before either lookup.
 */
@Component
public class StaticSpecCatalog {

    private static final Logger log = LoggerFactory.getLogger(StaticSpecCatalog.class);

    static final String DEFAULTS_RESOURCE = "/symbol-specs.json";

    private final Map<String, String> aliases = new HashMap<>();
    private final Map<String, SymbolSpec> venueDefaults = new HashMap<>();
    private final Map<String, SymbolSpec> symbolDefaults = new HashMap<>();

    public StaticSpecCatalog(@Value("${riskrails.specs.overrides-file:}") String overridesFile) {
        merge(readResource(DEFAULTS_RESOURCE));
        if (overridesFile != null && !overridesFile.isBlank()) {
            Path path = Path.of(overridesFile);
            if (Files.isRegularFile(path)) {
                merge(readFile(path));
                log.info("Symbol spec overrides loaded: file={}", path);
            } else {
                log.warn("Symbol spec overrides file not found, using built-in defaults only: file={}", path);
            }
        }
        log.info(
                "Static spec catalog ready: venues={}, symbols={}, aliases={}",
                venueDefaults.keySet(),
                symbolDefaults.size(),
                aliases);
    }

    public Optional<SymbolSpec> lookup(String venue, String symbol) {
        String canonicalVenue = canonicalVenue(venue);
        SymbolSpec spec = symbolDefaults.get(symbolKey(canonicalVenue, symbol));
        if (spec == null) {
            spec = venueDefaults.get(canonicalVenue);
        }
        return Optional.ofNullable(spec).map(SymbolSpec::normalized);
    }

    public String canonicalVenue(String venue) {
        String upper = venue.toUpperCase(Locale.ROOT);
        return aliases.getOrDefault(upper, upper);
    }

    private void merge(SpecCatalogDocument document) {
        if (document == null) {
            return;
        }
        document.getAliases()
                .forEach((alias, target) ->
                        aliases.put(alias.toUpperCase(Locale.ROOT), target.toUpperCase(Locale.ROOT)));
        document.getVenues().forEach((venue, spec) -> venueDefaults.put(venue.toUpperCase(Locale.ROOT), spec));
        document.getSymbols()
                .forEach((venue, specs) ->
                        specs.forEach((symbol, spec) -> symbolDefaults.put(symbolKey(venue, symbol), spec)));
    }

    private static String symbolKey(String venue, String symbol) {
        return venue.toUpperCase(Locale.ROOT) + ":" + symbol.toUpperCase(Locale.ROOT);
    }

    private static SpecCatalogDocument readResource(String resource) {
        try (InputStream in = StaticSpecCatalog.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + resource);
            }
            return JsonHelper.fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8), SpecCatalogDocument.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }

    private static SpecCatalogDocument readFile(Path path) {
        try {
            return JsonHelper.fromJson(Files.readString(path, StandardCharsets.UTF_8), SpecCatalogDocument.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read spec overrides " + path, e);
        }
    }
}
