package com.regolith.core.flavor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.TreeMap;

/**
 * Lookup table of available {@link Flavor}s keyed by id.
 *
 * <p>Populated once, either from the classpath via {@link ServiceLoader} or from an
 * explicit collection, and read-only afterwards. When two flavors share an id, the one
 * registered later replaces the earlier one.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * FlavorRegistry registry = FlavorRegistry.loadDefault();
 * Flavor flavor = registry.find("posix-ere")
 *     .orElseThrow(() -> new IllegalArgumentException("unknown flavor"));
 * Regexp ast = flavor.parse("[a-z]+@[a-z]+");
 * }</pre>
 */
public final class FlavorRegistry {

    private static final Logger log = LoggerFactory.getLogger(FlavorRegistry.class);

    private final Map<String, Flavor> flavors;

    private FlavorRegistry(Map<String, Flavor> flavors) {
        this.flavors = flavors;
    }

    /**
     * Discovers all flavors registered under
     * {@code META-INF/services/com.regolith.core.flavor.Flavor}.
     *
     * @return registry of discovered flavors
     */
    public static FlavorRegistry loadDefault() {
        log.debug("Discovering flavors via ServiceLoader");
        ServiceLoader<Flavor> loader = ServiceLoader.load(Flavor.class);
        List<Flavor> discovered = new ArrayList<>();
        loader.forEach(discovered::add);

        FlavorRegistry registry = of(discovered);
        log.debug("Discovered {} flavors: {}", registry.flavors.size(), registry.ids());
        return registry;
    }

    /**
     * Creates a registry from the given flavors, in registration order.
     *
     * @param candidates flavors to register
     * @return new registry
     */
    public static FlavorRegistry of(Collection<? extends Flavor> candidates) {
        Objects.requireNonNull(candidates, "candidates must not be null");
        Map<String, Flavor> byId = new TreeMap<>();
        for (Flavor flavor : candidates) {
            Flavor previous = byId.put(flavor.getId(), flavor);
            if (previous != null) {
                log.warn("Flavor id '{}' registered twice: {} replaces {}",
                    flavor.getId(), flavor.getClass().getName(), previous.getClass().getName());
            }
        }
        return new FlavorRegistry(byId);
    }

    /**
     * Looks up a flavor by id.
     *
     * @param id flavor id, e.g. "posix-ere"
     * @return the flavor, or empty when none is registered under that id
     */
    public Optional<Flavor> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(flavors.get(id));
    }

    /**
     * Returns all registered ids, sorted.
     *
     * @return sorted flavor ids
     */
    public List<String> ids() {
        return List.copyOf(flavors.keySet());
    }

    /**
     * Returns all registered flavors, sorted by id.
     *
     * @return flavors sorted by id
     */
    public List<Flavor> all() {
        return List.copyOf(flavors.values());
    }

    public boolean isEmpty() {
        return flavors.isEmpty();
    }
}
