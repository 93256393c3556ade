package latexrecode;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static latexrecode.Definitions.nfd;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecodeDataTest {

    private static final String XML = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
            + "<texmap>\n"
            + "  <maps type=\"letters\" set=\"base, full\">\n"
            + "    <map><from>ss</from><to>ß</to></map>\n"
            + "  </maps>\n"
            + "  <maps type=\"punctuation\" set=\"full\">\n"
            + "    <map><from>textendash</from><to>–</to></map>\n"
            + "    <map><from preferred=\"1\" raw=\"1\">--</from><to>–</to></map>\n"
            + "  </maps>\n"
            + "  <maps type=\"diacritics\" set=\"base\">\n"
            + "    <map><from>\"</from><to>&#x0308;</to></map>\n"
            + "  </maps>\n"
            + "  <maps type=\"emoji\" set=\"full\">\n"
            + "    <map><from>smile</from><to>☺</to></map>\n"
            + "  </maps>\n"
            + "  <decode_exclude><char>textbackslash</char></decode_exclude>\n"
            + "  <encode_exclude><char>\\</char><char>{</char></encode_exclude>\n"
            + "</texmap>\n";

    private static RecodeData parse(String xml) {
        InputStream in = new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8));
        return RecodeData.fromXml(in);
    }

    @Test
    void shouldParseMapsWithSetsAndFlags() {
        RecodeData data = parse(XML);

        assertThat(data.getDefinitions()).hasSize(5);
        MacroDefinition ss = data.getDefinitions().get(0);
        assertThat(ss.getCategory()).isEqualTo(RecodeCategory.LETTERS);
        assertThat(ss.getSets()).containsExactly("base", "full");
        assertThat(ss.isPreferred()).isFalse();

        MacroDefinition dashes = data.getDefinitions().get(2);
        assertThat(dashes.getFrom()).isEqualTo("--");
        assertThat(dashes.isPreferred()).isTrue();
        assertThat(dashes.isRaw()).isTrue();

        assertThat(data.getDefinitions().get(3).getTo()).isEqualTo("\u0308");
        assertThat(data.setIds()).containsExactly("base", "full");
    }

    @Test
    void shouldKeepUnknownCategoryForLaterRejection() {
        MacroDefinition smile = parse(XML).getDefinitions().get(4);

        assertThat(smile.getCategory()).isNull();
        assertThatThrownBy(smile::validate).isInstanceOf(RecodeDataException.class);
    }

    @Test
    void shouldReadExclusionLists() {
        RecodeData data = parse(XML);

        assertThat(data.getDecodeExclude()).containsExactly("textbackslash");
        assertThat(data.getEncodeExclude()).containsExactly("\\", "{");
    }

    @Test
    void shouldFailOnMalformedXml() {
        assertThatThrownBy(() -> parse("<texmap><maps>"))
                .isInstanceOf(RecodeDataException.class)
                .hasMessageContaining("Malformed");
    }

    @Test
    void shouldLoadBundledData() {
        RecodeData data = RecodeData.DataHolder.get();

        assertThat(data.isEmpty()).isFalse();
        assertThat(data.setIds()).contains("base", "full");
        assertThat(data.getDecodeExclude()).contains("textbackslash", "--");
        assertThat(data.getEncodeExclude()).contains("\\", "{", "}", "$");
    }

    @Test
    void shouldNormalizeGlyphsToNfd() {
        MacroDefinition aa = new MacroDefinition(RecodeCategory.LETTERS, "aa", "\u00e5", false, false, null);

        assertThat(aa.getTo()).isEqualTo("a\u030a");
        assertThat(aa.getSets()).isEmpty();
        assertThat(aa.isMemberOf("base")).isFalse();
    }

    @Test
    void shouldWriteAndReadJson(@TempDir Path dir) throws Exception {
        RecodeData data = parse(XML);
        Path json = dir.resolve("recode_data.json");

        data.serializeToJson(json);
        RecodeData back = RecodeData.fromFile(json);

        assertThat(Files.readString(json)).contains("\"category\" : \"letters\"");
        assertThat(back.getDefinitions()).isEqualTo(data.getDefinitions());
        assertThat(back.getDecodeExclude()).isEqualTo(data.getDecodeExclude());
        assertThat(back.getEncodeExclude()).isEqualTo(data.getEncodeExclude());
    }

    @Test
    void shouldChooseXmlParserByExtension(@TempDir Path dir) throws Exception {
        Path xml = dir.resolve("custom.xml");
        Files.writeString(xml, XML);

        assertThat(RecodeData.fromFile(xml).getDefinitions().get(0).getTo()).isEqualTo(nfd("ß"));
    }
}
