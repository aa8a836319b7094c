package org.slngen.ownership;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class LegacyFallbackTest {

    private final LegacyFallback fallback = new LegacyFallback("Assets");

    @Test
    void resolve_coversAllFourAssemblies() {
        assertThat(fallback.resolve("Assets/Scripts")).contains(LegacyFallback.RUNTIME);
        assertThat(fallback.resolve("Assets/Plugins/Vendor")).contains(LegacyFallback.RUNTIME_FIRST_PASS);
        assertThat(fallback.resolve("Assets/Scripts/Editor")).contains(LegacyFallback.EDITOR);
        assertThat(fallback.resolve("Assets/Plugins/Vendor/Editor/Inspectors")).contains(LegacyFallback.EDITOR_FIRST_PASS);
    }

    @Test
    void resolve_firstPassOnlyAtSecondComponent() {
        assertThat(fallback.resolve("Assets/Standard Assets/Effects")).contains(LegacyFallback.RUNTIME_FIRST_PASS);
        assertThat(fallback.resolve("Assets/Pro Standard Assets")).contains(LegacyFallback.RUNTIME_FIRST_PASS);
        assertThat(fallback.resolve("Assets/Game/Plugins")).contains(LegacyFallback.RUNTIME);
    }

    @Test
    void resolve_editorMatchesWholeComponentOnly() {
        assertThat(fallback.resolve("Assets/LevelEditor")).contains(LegacyFallback.RUNTIME);
        assertThat(fallback.resolve("Assets/Editor")).contains(LegacyFallback.EDITOR);
    }

    @Test
    void resolve_outsideLegacyRootIsEmpty() {
        assertThat(fallback.resolve("Packages/com.vendor/Runtime")).isEmpty();
        assertThat(fallback.resolve("")).isEmpty();
        assertThat(fallback.resolve("AssetsExtra/Code")).isEmpty();
    }

    @Test
    void nameClassification() {
        assertThat(LegacyFallback.isLegacyName("Assembly-CSharp-firstpass")).isTrue();
        assertThat(LegacyFallback.isLegacyName("Game")).isFalse();
        assertThat(LegacyFallback.isEditorName(LegacyFallback.EDITOR_FIRST_PASS)).isTrue();
        assertThat(LegacyFallback.isEditorName(LegacyFallback.RUNTIME)).isFalse();
    }
}
