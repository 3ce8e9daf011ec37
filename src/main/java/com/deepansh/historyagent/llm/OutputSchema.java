package com.deepansh.historyagent.llm;

import lombok.Value;

import java.util.Map;

/**
 * A named JSON Schema (as a Map) that a structured generation must conform to.
 */
@Value(staticConstructor = "of")
public class OutputSchema {
    String name;
    String description;
    Map<String, Object> jsonSchema;
}
