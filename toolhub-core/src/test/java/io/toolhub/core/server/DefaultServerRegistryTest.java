package io.toolhub.core.server;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DefaultServerRegistryTest {

    private DefaultServerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DefaultServerRegistry();
    }

    @Test
    void shouldReturnExactlyWhatWasRegistered() {
        ServerDefinition definition =
                ServerDefinition.builder().id("search").name("Search").endpoint("http://x").build();

        registry.register(definition);

        assertThat(registry.get("search")).containsSame(definition);
        assertThat(registry.contains("search")).isTrue();
    }

    @Test
    void shouldRejectDuplicateId() {
        registry.register(ServerDefinition.builder().id("a").endpoint("http://one").build());

        assertThatThrownBy(
                        () ->
                                registry.register(
                                        ServerDefinition.builder()
                                                .id("a")
                                                .endpoint("http://two")
                                                .build()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("a");
        assertThat(registry.get("a").orElseThrow().endpoint()).isEqualTo("http://one");
    }

    @Test
    void shouldListNothingWhenEmpty() {
        assertThat(registry.all()).isEmpty();
        assertThat(registry.size()).isZero();
    }

    @Test
    void shouldRemoveDefinition() {
        registry.register(ServerDefinition.builder().id("a").endpoint("http://x").build());

        assertThat(registry.remove("a")).isTrue();
        assertThat(registry.remove("a")).isFalse();
        assertThat(registry.get("a")).isEmpty();
    }
}
