package latexrecode;

import latexrecode.RecodeTable.CategoryTable;
import org.junit.jupiter.api.Test;

import java.text.Normalizer;
import java.util.List;

import static latexrecode.Definitions.*;
import static latexrecode.RecodeCategory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LatexRecodeTest {

    private static final String KHWARIZMI_LATEX = "Mu\\d{h}ammad ibn M\\=us\\=a al-Khw\\=arizm\\={\\i}";
    private static final String KHWARIZMI = "Muḥammad ibn Mūsā al-Khwārizmī";

    @Test
    void shouldRequireInitSetsBeforeUse() {
        LatexRecode recode = new LatexRecode();

        assertThatThrownBy(() -> recode.decode("\\ss"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("initSets");
        assertThatThrownBy(() -> recode.encode("ß")).isInstanceOf(IllegalStateException.class);
        assertThat(recode.getPlan()).isNull();
    }

    @Test
    void shouldDecodeKhwarizmiToNfdByDefault() {
        LatexRecode recode = new LatexRecode();
        recode.initSets("base", "base");

        assertThat(recode.decode(KHWARIZMI_LATEX)).isEqualTo(nfd(KHWARIZMI));
        assertThat(recode.decode(KHWARIZMI_LATEX, DecodeOptions.of(true, "nfc"))).isEqualTo(nfc(KHWARIZMI));
    }

    @Test
    void shouldRoundTripKhwarizmi() {
        LatexRecode recode = new LatexRecode();
        recode.initSets(RecodeSet.BASE, RecodeSet.BASE);

        assertThat(recode.decode(recode.encode(nfd(KHWARIZMI)))).isEqualTo(nfd(KHWARIZMI));
    }

    @Test
    void shouldRoundTripEveryEncodableGlyphOfFullSet() {
        LatexRecode recode = new LatexRecode();
        recode.initSets("full", "full");
        RecodeTable encode = recode.getPlan().getEncodeTable();

        int checked = 0;
        for (RecodeCategory category : encode.categories()) {
            if (category == DIACRITICS) continue;
            CategoryTable table = encode.get(category);
            for (String glyph : table.keys()) {
                if (table.isRaw(glyph)) continue;
                assertThat(recode.decode(recode.encode(glyph)))
                        .as("%s %s -> %s", category.asStr(), glyph, recode.encode(glyph))
                        .isEqualTo(glyph);
                checked++;
            }
        }
        assertThat(checked).isGreaterThan(100);
    }

    @Test
    void shouldDoNothingForNullSets() {
        LatexRecode recode = new LatexRecode();
        recode.initSets("null", "null");
        String latex = "M\\\"uller";
        String unicode = nfd("Müller");

        assertThat(recode.decode(latex)).isSameAs(latex);
        assertThat(recode.encode(unicode)).isSameAs(unicode);
        assertThat(recode.getLastError()).isNull();
    }

    @Test
    void shouldFallBackToIdentityForUnknownSet() {
        LatexRecode recode = new LatexRecode();
        recode.initSets("bogus", "base");

        assertThat(recode.getLastError()).contains("bogus");
        assertThat(recode.decode("\\ss")).isEqualTo("\\ss");
        assertThat(recode.encode("ß")).isEqualTo("\\ss{}");
        assertThat(recode.getDecodeSet()).isEqualTo("bogus");
        assertThat(recode.getEncodeSet()).isEqualTo("base");
    }

    @Test
    void shouldFallBackToIdentityForEmptyData() {
        LatexRecode recode = new LatexRecode(data());
        recode.initSets("base", "base");

        assertThat(recode.getLastError()).isNotNull();
        assertThat(recode.decode("\\ss")).isEqualTo("\\ss");
        assertThat(recode.encode("ß")).isEqualTo("ß");
    }

    @Test
    void shouldReplaceTablesOnReconfiguration() {
        LatexRecode recode = new LatexRecode();
        recode.initSets("full", "full");
        assertThat(recode.decode("{$\\alpha$}")).isEqualTo("α");
        assertThat(recode.encode("α")).isEqualTo("{$\\alpha$}");

        recode.initSets("base", "base");
        assertThat(recode.decode("{$\\alpha$}")).isEqualTo("{$\\alpha$}");
        assertThat(recode.encode("α")).isEqualTo("α");

        recode.initSets("bogus", "base");
        recode.initSets("base", "base");
        assertThat(recode.getLastError()).isNull();
    }

    @Test
    void shouldPreferLongestMacro() {
        LatexRecode recode = new LatexRecode(data(
                def(LETTERS, "ss", "ß", "base"),
                def(LETTERS, "sscript", "ſ", "base")));
        recode.initSets("base", "base");

        assertThat(recode.decode("\\sscript")).isEqualTo("ſ");
        assertThat(recode.decode("\\ss")).isEqualTo("ß");
        assertThat(recode.decode("\\ss{}cript")).isEqualTo("ßcript");
    }

    @Test
    void shouldEmitRawLetterBare() {
        LatexRecode recode = new LatexRecode(data(
                def(LETTERS, "ss", "ß", "base"),
                new MacroDefinition(LETTERS, "ss", "ß", true, true, List.of("base"))));
        recode.initSets("base", "base");

        assertThat(recode.encode("ß")).isEqualTo("ss");
    }

    @Test
    void shouldReportRejectedDefinitions() {
        LatexRecode recode = new LatexRecode(data(
                def(LETTERS, "ss", "ß", "base"),
                def(null, "mystery", "?", "base")));
        recode.initSets("base", "base");

        assertThat(recode.getPlan().getRejected()).hasSize(1);
        assertThat(recode.decode("\\ss")).isEqualTo("ß");
    }

    @Test
    void shouldProtectVerbatimFieldsOfDataModel() {
        LatexRecode recode = new LatexRecode();
        recode.initSets("base", "base");
        recode.setDataModelHelper(new DataModelHelper(List.of("url"), List.of("urls")));

        String decoded = recode.decode("url = {http://x.org/\\~user} and URLS = \"a\\=b\", title = M\\\"uller",
                DecodeOptions.of(true, Normalizer.Form.NFC));

        assertThat(decoded).isEqualTo(nfc("url = {http://x.org/\\~user} and URLS = \"a\\=b\", title = Müller"));

        recode.setDataModelHelper(null);
        assertThat(recode.decode("url = {\\~u}", DecodeOptions.of(true, Normalizer.Form.NFC)))
                .isEqualTo(nfc("url = \u0169"));
    }

    @Test
    void shouldShareBundledData() {
        assertThat(new LatexRecode().getData()).isSameAs(RecodeData.DataHolder.get());
    }
}
