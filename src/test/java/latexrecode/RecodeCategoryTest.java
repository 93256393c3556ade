package latexrecode;

import org.junit.jupiter.api.Test;

import java.text.Normalizer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecodeCategoryTest {

    @Test
    void shouldParseCategoryNamesIgnoringCase() {
        assertThat(RecodeCategory.fromStr("negatedsymbols")).isEqualTo(RecodeCategory.NEGATEDSYMBOLS);
        assertThat(RecodeCategory.fromStr(" Greek ")).isEqualTo(RecodeCategory.GREEK);
        assertThat(RecodeCategory.tryParse("emoji")).isNull();
        assertThat(RecodeCategory.tryParse(null)).isNull();
        assertThatThrownBy(() -> RecodeCategory.fromStr("emoji")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldCoverEveryCategoryInBothPassOrders() {
        assertThat(RecodeCategory.DECODE_ORDER).containsExactlyInAnyOrder(RecodeCategory.values());
        assertThat(RecodeCategory.ENCODE_ORDER).containsExactlyInAnyOrder(RecodeCategory.values());
        assertThat(RecodeCategory.DECODE_ORDER.get(0)).isEqualTo(RecodeCategory.GREEK);
        assertThat(RecodeCategory.DECODE_ORDER.get(8)).isEqualTo(RecodeCategory.DIACRITICS);
    }

    @Test
    void shouldParseRecodeSets() {
        assertThat(RecodeSet.fromStr("FULL")).isEqualTo(RecodeSet.FULL);
        assertThat(RecodeSet.defaultSet().id()).isEqualTo("base");
        assertThat(RecodeSet.isNull(" Null ")).isTrue();
        assertThat(RecodeSet.isNull("base")).isFalse();
        assertThat(RecodeSet.tryParse("custom")).isNull();
        assertThatThrownBy(() -> RecodeSet.fromStr(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldParseNormalizationForms() {
        assertThat(DecodeOptions.parseForm("nfkc")).isEqualTo(Normalizer.Form.NFKC);
        assertThat(DecodeOptions.DEFAULT.getForm()).isEqualTo(Normalizer.Form.NFD);
        assertThat(DecodeOptions.unnormalized().isNormalize()).isFalse();
        assertThatThrownBy(() -> DecodeOptions.parseForm("NFX"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("NFX");
    }
}
