package tech.tessera.identity.shared;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class SlugsTest {

    @ParameterizedTest
    @CsvSource({
        "Editor, editor",
        "Content Editor, content-editor",
        "'  Ops -- Team!  ', ops-team",
        "Développeur, developpeur"
    })
    @DisplayName("slugify should lower-case, strip accents and collapse separators")
    void slugify_shouldNormalizeName(String name, String expected) {
        assertThat(Slugs.slugify(name)).isEqualTo(expected);
    }

    @Test
    @DisplayName("TsidGenerator should prefix typed ids and resolve the type back")
    void generate_shouldPrefixAndResolveType() {
        String id = TsidGenerator.generate(EntityType.ROLE);

        assertThat(id).startsWith("rol_");
        assertThat(TsidGenerator.typeOf(id)).isEqualTo(EntityType.ROLE);
        assertThat(TsidGenerator.generate(EntityType.EVENT)).doesNotContain("_");
        assertThat(TsidGenerator.typeOf("plain")).isNull();
    }
}
