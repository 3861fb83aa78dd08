package io.github.simpleiam.log.core.internal;

import io.github.simpleiam.log.api.Field;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * key/value 교대 인자를 Field 목록으로 변환.
 *
 * 잘못된 입력은 예외 대신 자가 진단 로그를 남기고 그 지점 이후를 버린다.
 */
final class KeyValues {

    static final String TYPED_FIELD_MESSAGE = "strongly-typed Field passed as a key-value pair";
    static final String ODD_ARGUMENTS_MESSAGE = "odd number of arguments passed as key-value pairs for logging";
    static final String NON_STRING_KEY_MESSAGE = "non-string key argument passed to logging, ignoring all later arguments";

    /** 자가 진단 로그 수신자 */
    @FunctionalInterface
    interface Diagnostics {
        void report(String message, Field detail);
    }

    private KeyValues() {}

    static List<Field> convert(Object[] keysAndValues, Diagnostics diagnostics, Field... additional) {
        if (keysAndValues == null || keysAndValues.length == 0) {
            return additional.length == 0 ? List.of() : Arrays.asList(additional);
        }

        List<Field> fields = new ArrayList<>(keysAndValues.length / 2 + additional.length);

        for (int i = 0; i < keysAndValues.length; ) {
            Object key = keysAndValues[i];

            if (key instanceof Field) {
                diagnostics.report(TYPED_FIELD_MESSAGE, Field.any("typed field", key));
                break;
            }

            if (i == keysAndValues.length - 1) {
                diagnostics.report(ODD_ARGUMENTS_MESSAGE, Field.any("ignored key", key));
                break;
            }

            if (!(key instanceof String)) {
                diagnostics.report(NON_STRING_KEY_MESSAGE, Field.any("invalid key", key));
                break;
            }

            fields.add(Field.any((String) key, keysAndValues[i + 1]));
            i += 2;
        }

        fields.addAll(Arrays.asList(additional));
        return fields;
    }
}
