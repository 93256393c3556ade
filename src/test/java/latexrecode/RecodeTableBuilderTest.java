package latexrecode;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static latexrecode.Definitions.*;
import static latexrecode.RecodeCategory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecodeTableBuilderTest {

    @Test
    void shouldMapMacroToGlyphForDecode() {
        RecodeTableBuilder builder = new RecodeTableBuilder(data(def(LETTERS, "ss", "ß", "base")));

        RecodeTable table = builder.buildDecode("base");

        assertThat(table.getDirection()).isEqualTo(RecodeTable.Direction.DECODE);
        assertThat(table.get(LETTERS).get("ss")).isEqualTo("ß");
        assertThat(table.get(SYMBOLS)).isNull();
        assertThat(table.isIdentity()).isFalse();
    }

    @Test
    void shouldOrderKeysLongestFirst() {
        RecodeTableBuilder builder = new RecodeTableBuilder(data(
                def(LETTERS, "ss", "ß", "base"),
                def(LETTERS, "o", "ø", "base"),
                def(LETTERS, "sscript", "ſ", "base")));

        RecodeTable.CategoryTable letters = builder.buildDecode("base").get(LETTERS);

        assertThat(letters.keys()).containsExactly("sscript", "ss", "o");
        assertThat(letters.alternation()).startsWith("(?:\\Qsscript\\E|");
        assertThat(letters.pattern().matcher("sscript").matches()).isTrue();
    }

    @Test
    void shouldOnlyIncludeMembersOfTheChosenSet() {
        RecodeTableBuilder builder = new RecodeTableBuilder(data(
                def(LETTERS, "ss", "ß", "base", "full"),
                def(GREEK, "alpha", "α", "full")));

        assertThat(builder.buildDecode("base").categories()).containsExactly(LETTERS);
        assertThat(builder.buildDecode("full").categories()).containsExactly(LETTERS, GREEK);
    }

    @Test
    void shouldLetPreferredDefinitionWinOnEncode() {
        RecodeTableBuilder builder = new RecodeTableBuilder(data(
                preferred(SYMBOLS, "textsection", "§", "base"),
                def(SYMBOLS, "S", "§", "base")));

        assertThat(builder.buildEncode("base").get(SYMBOLS).get("§")).isEqualTo("textsection");
        // Both macros still decode
        RecodeTable decode = builder.buildDecode("base");
        assertThat(decode.get(SYMBOLS).get("S")).isEqualTo("§");
        assertThat(decode.get(SYMBOLS).get("textsection")).isEqualTo("§");
    }

    @Test
    void shouldLetLastDefinitionWinWithoutPreference() {
        RecodeTableBuilder builder = new RecodeTableBuilder(data(
                def(SYMBOLS, "textsection", "§", "base"),
                def(SYMBOLS, "S", "§", "base")));

        assertThat(builder.buildEncode("base").get(SYMBOLS).get("§")).isEqualTo("S");
    }

    @Test
    void shouldTakeRawFlagFromWinningDefinition() {
        RecodeTable rawWins = new RecodeTableBuilder(data(
                def(PUNCTUATION, "textendash", "–", "base"),
                preferredRaw(PUNCTUATION, "--", "–", "base"))).buildEncode("base");

        assertThat(rawWins.get(PUNCTUATION).get("–")).isEqualTo("--");
        assertThat(rawWins.get(PUNCTUATION).isRaw("–")).isTrue();

        RecodeTable macroWins = new RecodeTableBuilder(data(
                new MacroDefinition(PUNCTUATION, "--", "–", false, true, List.of("base")),
                preferred(PUNCTUATION, "textendash", "–", "base"))).buildEncode("base");

        assertThat(macroWins.get(PUNCTUATION).get("–")).isEqualTo("textendash");
        assertThat(macroWins.get(PUNCTUATION).isRaw("–")).isFalse();
    }

    @Test
    void shouldApplyExclusionListsPerDirection() {
        RecodeData data = new RecodeData(Arrays.asList(
                def(SYMBOLS, "textbackslash", "\\", "base"),
                def(SYMBOLS, "textdegree", "°", "base")),
                List.of("textbackslash"),
                List.of("\\"));
        RecodeTableBuilder builder = new RecodeTableBuilder(data);

        RecodeTable.CategoryTable decode = builder.buildDecode("base").get(SYMBOLS);
        RecodeTable.CategoryTable encode = builder.buildEncode("base").get(SYMBOLS);

        assertThat(decode.mapping()).containsOnlyKeys("textdegree");
        assertThat(encode.mapping()).containsOnlyKeys("°");
    }

    @Test
    void shouldKeyEncodeTableByDecomposedGlyph() {
        RecodeTableBuilder builder = new RecodeTableBuilder(data(def(LETTERS, "aa", "å", "base")));

        RecodeTable.CategoryTable letters = builder.buildEncode("base").get(LETTERS);

        assertThat(letters.keys()).containsExactly(nfd("å"));
    }

    @Test
    void shouldReturnIdentityForNullSet() {
        RecodeTableBuilder builder = new RecodeTableBuilder(data(def(LETTERS, "ss", "ß", "base")));

        assertThat(builder.buildDecode("null").isIdentity()).isTrue();
        assertThat(builder.buildEncode("NULL").isIdentity()).isTrue();
    }

    @Test
    void shouldRejectUnknownSet() {
        RecodeTableBuilder builder = new RecodeTableBuilder(data(def(LETTERS, "ss", "ß", "base")));

        assertThatThrownBy(() -> builder.buildDecode("bogus"))
                .isInstanceOf(RecodeConfigurationException.class)
                .hasMessageContaining("bogus");
    }

    @Test
    void shouldRejectEmptyData() {
        RecodeTableBuilder builder = new RecodeTableBuilder(data());

        assertThatThrownBy(() -> builder.buildEncode("base"))
                .isInstanceOf(RecodeConfigurationException.class)
                .hasMessageContaining("no macro definitions");
    }

    @Test
    void shouldSkipMalformedDefinitions() {
        RecodeTableBuilder builder = new RecodeTableBuilder(data(
                def(LETTERS, "ss", "ß", "base"),
                def(null, "foo", "x", "base"),
                def(LETTERS, "", "ø", "base"),
                def(LETTERS, "l", null, "base")));

        assertThat(builder.getRejected()).hasSize(3);
        assertThat(builder.buildDecode("base").get(LETTERS).mapping()).containsOnlyKeys("ss");
    }
}
