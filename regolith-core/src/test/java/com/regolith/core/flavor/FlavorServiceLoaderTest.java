package com.regolith.core.flavor;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration test validating SPI registration for {@link Flavor} implementations.
 *
 * <p>Catches typos in {@code META-INF/services}, flavors that fail to instantiate and
 * duplicate ids.
 */
class FlavorServiceLoaderTest {

    private static final int EXPECTED_FLAVOR_COUNT = 1;

    @Test
    void serviceLoader_discoversAllRegisteredFlavors() {
        List<Flavor> flavors = ServiceLoader.load(Flavor.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();

        assertThat(flavors)
            .as("ServiceLoader should discover all %d registered flavors", EXPECTED_FLAVOR_COUNT)
            .hasSize(EXPECTED_FLAVOR_COUNT);
    }

    @Test
    void serviceLoader_flavorIdsAreUnique() {
        List<String> ids = ServiceLoader.load(Flavor.class).stream()
            .map(provider -> provider.get().getId())
            .toList();
        Set<String> unique = ids.stream().collect(Collectors.toSet());

        assertThat(unique).hasSameSizeAs(ids);
    }

    @Test
    void serviceLoader_flavorsHaveMetadata() {
        ServiceLoader.load(Flavor.class).forEach(flavor -> {
            assertThat(flavor.getId()).isNotBlank();
            assertThat(flavor.getDisplayName()).isNotBlank();
            assertThat(flavor.getSupportedFlags()).isNotNull();
            assertThat(flavor.getSupportedFeatures()).isNotNull();
        });
    }
}
