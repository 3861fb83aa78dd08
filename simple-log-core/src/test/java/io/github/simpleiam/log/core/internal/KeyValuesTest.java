package io.github.simpleiam.log.core.internal;

import io.github.simpleiam.log.api.Field;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("KeyValues")
class KeyValuesTest {

    private final List<String> reports = new ArrayList<>();
    private final List<Field> details = new ArrayList<>();
    private KeyValues.Diagnostics diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = (message, detail) -> {
            reports.add(message);
            details.add(detail);
        };
    }

    @Test
    @DisplayName("should pair keys with values in order")
    void shouldPairKeysWithValues() {
        List<Field> fields = KeyValues.convert(new Object[]{"user", "colin", "age", 30}, diagnostics);

        assertThat(fields).containsExactly(Field.any("user", "colin"), Field.any("age", 30));
        assertThat(fields.get(1).getType()).isEqualTo(Field.Type.LONG);
        assertThat(reports).isEmpty();
    }

    @Test
    @DisplayName("should keep pairs before a dangling key")
    void shouldReportDanglingKey() {
        List<Field> fields = KeyValues.convert(new Object[]{"a", 1, "b"}, diagnostics);

        assertThat(fields).containsExactly(Field.any("a", 1));
        assertThat(reports).containsExactly(KeyValues.ODD_ARGUMENTS_MESSAGE);
        assertThat(details).containsExactly(Field.any("ignored key", "b"));
    }

    @Test
    @DisplayName("should stop at a non-string key")
    void shouldStopAtNonStringKey() {
        List<Field> fields = KeyValues.convert(new Object[]{"a", 1, 2, "b", "c", "d"}, diagnostics);

        assertThat(fields).containsExactly(Field.any("a", 1));
        assertThat(reports).containsExactly(KeyValues.NON_STRING_KEY_MESSAGE);
        assertThat(details.get(0).getValue()).isEqualTo(2);
    }

    @Test
    @DisplayName("should stop at a typed field passed as a key")
    void shouldStopAtTypedField() {
        Field typed = Field.string("k", "v");

        List<Field> fields = KeyValues.convert(new Object[]{typed, "x"}, diagnostics);

        assertThat(fields).isEmpty();
        assertThat(reports).containsExactly(KeyValues.TYPED_FIELD_MESSAGE);
        assertThat(details.get(0).getValue()).isSameAs(typed);
    }

    @Test
    @DisplayName("should always append additional fields")
    void shouldAppendAdditionalFields() {
        Field extra = Field.bool("audited", true);

        assertThat(KeyValues.convert(new Object[]{"a", 1, 2}, diagnostics, extra))
                .containsExactly(Field.any("a", 1), extra);
        assertThat(KeyValues.convert(null, diagnostics, extra)).containsExactly(extra);
        assertThat(KeyValues.convert(new Object[0], diagnostics)).isEmpty();
    }
}
