package io.github.simpleiam.log.core.layout;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.github.simpleiam.log.api.Field;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * 필드 값의 JSON 표현. Duration은 밀리초(실수), Throwable은 toString().
 * Jackson이 직렬화하지 못하는 값은 toString()으로 대체.
 */
public final class FieldRenderer {

    static final DateTimeFormatter TIMESTAMP_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneId.systemDefault());

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private FieldRenderer() {}

    public static JsonNode toNode(Object value) {
        if (value == null) {
            return NODES.nullNode();
        }
        if (value instanceof Duration) {
            return NODES.numberNode(((Duration) value).toNanos() / 1_000_000.0);
        }
        if (value instanceof Throwable) {
            return NODES.textNode(value.toString());
        }
        try {
            return MAPPER.valueToTree(value);
        } catch (IllegalArgumentException e) {
            return NODES.textNode(String.valueOf(value));
        }
    }

    static JsonGenerator newGenerator(Writer out) throws IOException {
        return MAPPER.createGenerator(out);
    }

    /** 필드를 순서대로 기록. 같은 키도 덮어쓰지 않고 모두 쓴다. */
    static void writeFields(JsonGenerator generator, List<Field> fields) throws IOException {
        for (Field field : fields) {
            generator.writeFieldName(field.getKey());
            generator.writeTree(toNode(field.getValue()));
        }
    }

    /** 필드만 담은 JSON 객체 문자열 */
    static String writeObject(List<Field> fields) {
        StringWriter out = new StringWriter(64);
        try (JsonGenerator generator = newGenerator(out)) {
            generator.writeStartObject();
            writeFields(generator, fields);
            generator.writeEndObject();
        } catch (IOException e) {
            // StringWriter 출력은 실패하지 않는다
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    static String formatTimestamp(long epochMillis) {
        return TIMESTAMP_FORMAT.format(Instant.ofEpochMilli(epochMillis));
    }
}
