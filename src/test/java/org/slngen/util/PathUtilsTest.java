package org.slngen.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class PathUtilsTest {

    @Test
    void parentDirectory_ofTopLevelEntryIsRoot() {
        assertThat(PathUtils.parentDirectory("Assets")).isEmpty();
        assertThat(PathUtils.parentDirectory("Assets/Game/Player.cs")).isEqualTo("Assets/Game");
    }

    @Test
    void depthAndComponents() {
        assertThat(PathUtils.depth("")).isZero();
        assertThat(PathUtils.depth("Assets/Game/UI")).isEqualTo(3);
        assertThat(PathUtils.components("Assets/Game/UI")).containsExactly("Assets", "Game", "UI");
        assertThat(PathUtils.components("")).isEmpty();
    }

    @Test
    void isDescendantOrSame_respectsComponentBoundaries() {
        assertThat(PathUtils.isDescendantOrSame("Assets/Game", "Assets/Game")).isTrue();
        assertThat(PathUtils.isDescendantOrSame("Assets/Game/UI", "Assets/Game")).isTrue();
        assertThat(PathUtils.isDescendantOrSame("Assets/GameExtras", "Assets/Game")).isFalse();
        assertThat(PathUtils.isDescendantOrSame("Packages/Net", "")).isTrue();
    }

    @Test
    void join_treatsEmptyAsRoot() {
        assertThat(PathUtils.join("", "Assets")).isEqualTo("Assets");
        assertThat(PathUtils.join("Assets", "")).isEqualTo("Assets");
        assertThat(PathUtils.join("Assets", "Game")).isEqualTo("Assets/Game");
    }

    @Test
    void deduplicatePreservingOrder_keepsFirstOccurrence() {
        assertThat(PathUtils.deduplicatePreservingOrder(List.of("Core", "Net", "Core", "UI", "Net")))
                .containsExactly("Core", "Net", "UI");
    }
}
