package com.deepansh.historyagent.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Validates JSON values against the agent's JSON Schemas (draft 7).
 *
 * Schemas are declared as Maps by tools and output schemas; each is compiled once
 * and cached by value. Every violation is returned, sorted, as the validator's message.
 */
@Component
public class JsonSchemaValidator {

    private final JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
    private final ObjectMapper schemaMapper = new ObjectMapper();
    private final Map<Map<String, Object>, JsonSchema> compiled = new ConcurrentHashMap<>();

    public JsonSchema compile(Map<String, Object> schema) {
        return compiled.computeIfAbsent(schema, s -> factory.getSchema(schemaMapper.valueToTree(s)));
    }

    public List<String> validate(JsonNode value, Map<String, Object> schema) {
        return validate(value, compile(schema));
    }

    public List<String> validate(JsonNode value, JsonSchema schema) {
        return schema.validate(value).stream()
                .map(ValidationMessage::getMessage)
                .sorted()
                .toList();
    }
}
