package org.slngen.render;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ProjectIdentifiersTest {

    @Test
    void forName_isStableBracedAndUppercase() {
        String first = ProjectIdentifiers.forName("Game");

        assertThat(ProjectIdentifiers.forName("Game")).isEqualTo(first);
        assertThat(first).matches("\\{[0-9A-F]{8}-[0-9A-F]{4}-3[0-9A-F]{3}-[0-9A-F]{4}-[0-9A-F]{12}\\}");
    }

    @Test
    void forName_differsBetweenNames() {
        assertThat(ProjectIdentifiers.forName("Game")).isNotEqualTo(ProjectIdentifiers.forName("game"));
    }
}
