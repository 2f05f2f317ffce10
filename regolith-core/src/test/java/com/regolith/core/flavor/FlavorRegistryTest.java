package com.regolith.core.flavor;

import com.regolith.core.ast.Regexp;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FlavorRegistry}.
 */
class FlavorRegistryTest {

    @Test
    void of_withFlavors_sortsIdsAlphabetically() {
        FlavorRegistry registry = FlavorRegistry.of(List.of(new StubFlavor("pcre"), new StubFlavor("java")));

        assertThat(registry.ids()).containsExactly("java", "pcre");
        assertThat(registry.all()).extracting(Flavor::getId).containsExactly("java", "pcre");
        assertThat(registry.isEmpty()).isFalse();
    }

    @Test
    void of_withDuplicateId_laterFlavorWins() {
        StubFlavor first = new StubFlavor("pcre");
        StubFlavor second = new StubFlavor("pcre");

        FlavorRegistry registry = FlavorRegistry.of(List.of(first, second));

        assertThat(registry.ids()).containsExactly("pcre");
        assertThat(registry.find("pcre")).containsSame(second);
    }

    @Test
    void of_withNull_throwsException() {
        assertThatThrownBy(() -> FlavorRegistry.of(null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("candidates must not be null");
    }

    @Test
    void find_withUnknownOrNullId_returnsEmpty() {
        FlavorRegistry registry = FlavorRegistry.of(List.of(new StubFlavor("java")));

        assertThat(registry.find("python")).isEmpty();
        assertThat(registry.find(null)).isEmpty();
    }

    @Test
    void of_withNoFlavors_isEmpty() {
        FlavorRegistry registry = FlavorRegistry.of(List.of());

        assertThat(registry.isEmpty()).isTrue();
        assertThat(registry.ids()).isEmpty();
    }

    @Test
    void loadDefault_findsPosixEre() {
        FlavorRegistry registry = FlavorRegistry.loadDefault();

        assertThat(registry.find("posix-ere")).isPresent();
    }

    private static final class StubFlavor implements Flavor {

        private final String id;

        StubFlavor(String id) {
            this.id = id;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public String getDisplayName() {
            return "Stub " + id;
        }

        @Override
        public Regexp parse(String pattern) {
            return Regexp.of();
        }

        @Override
        public List<FlagInfo> getSupportedFlags() {
            return List.of();
        }

        @Override
        public FeatureSet getSupportedFeatures() {
            return FeatureSet.none();
        }
    }
}
