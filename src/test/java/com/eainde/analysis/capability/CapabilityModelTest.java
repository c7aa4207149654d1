package com.eainde.analysis.capability;

import com.eainde.analysis.capability.CapabilityModel.ModelDefaults;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CapabilityModelTest {

    private static final ModelDefaults DEFAULTS = new ModelDefaults("openai/gpt-4o-mini", "openai/gpt-4o");

    @Test
    @DisplayName("resolve() should map auto and blank choices to the role default")
    void resolve_shouldUseRoleDefault_forAuto() {
        assertThat(CapabilityModel.resolve("auto", CapabilityRole.EXTRACTION, DEFAULTS)).isEqualTo("openai/gpt-4o-mini");
        assertThat(CapabilityModel.resolve(null, CapabilityRole.ANALYSIS, DEFAULTS)).isEqualTo("openai/gpt-4o");
        assertThat(CapabilityModel.resolve("  ", CapabilityRole.ANALYSIS, DEFAULTS)).isEqualTo("openai/gpt-4o");
    }

    @Test
    @DisplayName("resolve() should keep an explicit supported choice, ignoring case")
    void resolve_shouldKeepExplicitChoice() {
        assertThat(CapabilityModel.resolve("Google/Gemini-3-Flash-Preview", CapabilityRole.EXTRACTION, DEFAULTS))
                .isEqualTo("google/gemini-3-flash-preview");
    }

    @Test
    @DisplayName("fromId() should reject ids outside the supported set")
    void fromId_shouldRejectUnknownModel() {
        assertThatThrownBy(() -> CapabilityModel.fromId("anthropic/unknown"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported model 'anthropic/unknown'");
    }

    @Test
    @DisplayName("resolve() should refuse a default that is itself auto")
    void resolve_shouldRejectAutoDefault() {
        ModelDefaults broken = new ModelDefaults("auto", "openai/gpt-4o");

        assertThatThrownBy(() -> CapabilityModel.resolve("auto", CapabilityRole.EXTRACTION, broken))
                .isInstanceOf(IllegalStateException.class);
    }
}
