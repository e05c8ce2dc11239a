package com.hartwig.minijd.format;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;

import org.junit.jupiter.api.Test;

class FormatStringTest {
    private static final SymbolTable SYMBOLS = SymbolTable.empty("test scope")
            .withAll(Map.of("Param.Scene", "/mnt/scene.blend", "Task.Param.Frame", "12", "RawParam.Braces", "{{Param.Scene}}"));

    @Test
    void literalTextIsUnchanged() {
        assertThat(FormatString.resolve("render --all", SYMBOLS)).isEqualTo("render --all");
        assertThat(FormatString.resolve("", SYMBOLS)).isEmpty();
        assertThat(FormatString.parse("a } b { c").hasReferences()).isFalse();
    }

    @Test
    void placeholdersAreSubstituted() {
        assertThat(FormatString.resolve("{{Param.Scene}} frame {{ Task.Param.Frame }}", SYMBOLS)).isEqualTo("/mnt/scene.blend frame 12");
        assertThat(FormatString.resolve("{{Task.Param.Frame}}{{Task.Param.Frame}}", SYMBOLS)).isEqualTo("1212");
    }

    @Test
    void resolvedValuesAreNotScannedAgain() {
        assertThat(FormatString.resolve("value={{RawParam.Braces}}", SYMBOLS)).isEqualTo("value={{Param.Scene}}");
    }

    @Test
    void referencesAndPlaceholdersInOrder() {
        var formatString = FormatString.parse("{{ Param.Scene }} and {{Task.Param.Frame}}");
        assertThat(formatString.getReferences()).containsExactly("Param.Scene", "Task.Param.Frame");
        assertThat(formatString.getPlaceholders()).containsExactly("{{ Param.Scene }}", "{{Task.Param.Frame}}");
        assertThat(formatString.toString()).isEqualTo("{{ Param.Scene }} and {{Task.Param.Frame}}");
    }

    @Test
    void unresolvedReferenceNamesPlaceholderAndScope() {
        var e = assertThrows(UnresolvedReferenceException.class, () -> FormatString.resolve("x {{Param.Missing}}", SYMBOLS));
        assertThat(e.getPlaceholder()).isEqualTo("{{Param.Missing}}");
        assertThat(e.getScope()).isEqualTo("test scope");
        assertThat(e.getMessage()).isEqualTo("Unresolved reference '{{Param.Missing}}' in test scope");
    }

    @Test
    void malformedPlaceholdersAreRejected() {
        assertThrows(FormatStringException.class, () -> FormatString.parse("{{Param.Scene"));
        assertThrows(FormatStringException.class, () -> FormatString.parse("{{}}"));
        assertThrows(FormatStringException.class, () -> FormatString.parse("{{Param..Scene}}"));
        assertThrows(FormatStringException.class, () -> FormatString.parse("{{Param.Scene + 1}}"));
    }

    @Test
    void symbolTablesAreImmutable() {
        var base = SymbolTable.empty("base");
        var extended = base.with("Param.A", "1");
        assertThat(base.contains("Param.A")).isFalse();
        assertThat(extended.get("Param.A")).contains("1");
        assertThat(extended.inScope("other").getScope()).isEqualTo("other");
        assertThat(extended.withAll(SymbolTable.empty("x").with("Param.A", "2")).get("Param.A")).contains("2");
    }
}
