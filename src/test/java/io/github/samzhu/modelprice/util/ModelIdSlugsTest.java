package io.github.samzhu.modelprice.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ModelIdSlugsTest {

    @Test
    void shouldLowercaseAndHyphenateWhitespace() {
        assertThat(ModelIdSlugs.slugify("Claude 3.5 Sonnet v2")).isEqualTo("claude-3.5-sonnet-v2");
    }

    @Test
    void shouldDropDisallowedCharacters() {
        // 括號與斜線被移除，點與連字號保留
        assertThat(ModelIdSlugs.slugify("Llama 3.1 (405B) Instruct")).isEqualTo("llama-3.1-405b-instruct");
        assertThat(ModelIdSlugs.slugify("Mistral/Large_2407")).isEqualTo("mistrallarge2407");
        assertThat(ModelIdSlugs.slugify("gpt-4o-mini")).isEqualTo("gpt-4o-mini");
    }

    @Test
    void shouldCollapseRunsOfWhitespaceAndTrim() {
        assertThat(ModelIdSlugs.slugify("  Claude \t  Model  ")).isEqualTo("claude-model");
    }

    @Test
    void shouldCollapseWhitespaceLeftBehindByRemovedCharacters() {
        // "Nova & Pro" → "nova  pro" → "nova-pro"
        assertThat(ModelIdSlugs.slugify("Nova & Pro")).isEqualTo("nova-pro");
    }

    @Test
    void shouldBeStableAcrossCalls() {
        String name = "Command R+ (Amazon)";
        assertThat(ModelIdSlugs.slugify(name)).isEqualTo(ModelIdSlugs.slugify(name));
    }

    @Test
    void shouldReturnEmptySlugWhenNothingSurvives() {
        assertThat(ModelIdSlugs.slugify("()")).isEmpty();
    }

    @Test
    void shouldRejectBlankNames() {
        assertThatThrownBy(() -> ModelIdSlugs.slugify("   "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ModelIdSlugs.slugify(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
