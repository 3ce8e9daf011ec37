package com.deepansh.historyagent.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JsonSchemaValidatorTest {

    private final JsonSchemaValidator validator = new JsonSchemaValidator();
    private final ObjectMapper mapper = new ObjectMapper();

    private final Map<String, Object> schema = Map.of(
            "type", "object",
            "properties", Map.of(
                    "entity", Map.of("type", "string", "enum", List.of("artist", "track")),
                    "n", Map.of("type", "integer", "minimum", 1, "maximum", 50),
                    "start_date", Map.of("type", "string", "format", "date"),
                    "tags", Map.of("type", "array", "items", Map.of("type", "string"), "maxItems", 2)),
            "required", List.of("entity", "n"),
            "additionalProperties", false);

    @Test
    void validate_conformingObject_returnsNoViolations() throws Exception {
        var value = mapper.readTree("{\"entity\":\"artist\",\"n\":5,\"start_date\":\"2025-01-01\"}");
        assertThat(validator.validate(value, schema)).isEmpty();
    }

    @Test
    void validate_missingRequired_namesTheProperty() throws Exception {
        var value = mapper.readTree("{\"entity\":\"artist\"}");
        assertThat(validator.validate(value, schema))
                .singleElement()
                .satisfies(v -> assertThat(v).contains("n").contains("required"));
    }

    @Test
    void validate_collectsEveryViolation() throws Exception {
        var value = mapper.readTree(
                "{\"entity\":\"genre\",\"n\":500,\"extra\":1,\"tags\":[\"a\",\"b\",3]}");

        List<String> violations = validator.validate(value, schema);

        assertThat(violations).hasSize(5);
        assertThat(violations).anyMatch(v -> v.contains("$.entity"));
        assertThat(violations).anyMatch(v -> v.contains("$.n") && v.contains("50"));
        assertThat(violations).anyMatch(v -> v.contains("extra"));
        assertThat(violations).anyMatch(v -> v.contains("$.tags") && v.contains("2"));
        assertThat(violations).anyMatch(v -> v.contains("$.tags[2]"));
    }

    @Test
    void validate_wrongRootType_isReported() throws Exception {
        var value = mapper.readTree("[1,2]");
        assertThat(validator.validate(value, schema))
                .singleElement()
                .satisfies(v -> assertThat(v).contains("array").contains("object"));
    }

    @Test
    void compile_equalSchemas_shareOneCompiledInstance() {
        JsonSchema first = validator.compile(schema);
        JsonSchema second = validator.compile(new HashMap<>(schema));

        assertThat(second).isSameAs(first);
    }
}
