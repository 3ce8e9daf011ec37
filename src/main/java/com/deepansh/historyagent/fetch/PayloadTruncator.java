package com.deepansh.historyagent.fetch;

import com.deepansh.historyagent.config.AgentProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Serializes tool rows as a JSON array no larger than the configured byte budget.
 *
 * Rows arrive most relevant first, so an oversized result keeps its leading rows and
 * ends with a marker naming how many were kept. When not even the first row fits, the
 * serialized text itself is cut at a UTF-8 character boundary.
 */
@Component
public class PayloadTruncator {

    private final ObjectMapper objectMapper;
    private final int byteBudget;

    @Autowired
    public PayloadTruncator(ObjectMapper objectMapper, AgentProperties properties) {
        this(objectMapper, properties.getTruncationByteBudget());
    }

    public PayloadTruncator(ObjectMapper objectMapper, int byteBudget) {
        if (byteBudget <= 0) {
            throw new IllegalArgumentException("truncation-byte-budget must be positive, was " + byteBudget);
        }
        this.objectMapper = objectMapper;
        this.byteBudget = byteBudget;
    }

    public TruncatedPayload truncate(List<Map<String, Object>> rows) {
        int total = rows.size();
        List<String> serialized = new ArrayList<>(total);
        for (Map<String, Object> row : rows) {
            serialized.add(write(row));
        }

        String full = "[" + String.join(",", serialized) + "]";
        if (utf8Length(full) <= byteBudget) {
            return new TruncatedPayload(full, false, total, total);
        }

        // "[" + rows joined by "," + "]"
        int kept = 0;
        int size = 2;
        while (kept < total) {
            int next = size + utf8Length(serialized.get(kept)) + (kept > 0 ? 1 : 0);
            if (next + utf8Length(marker(kept + 1, total)) > byteBudget) {
                break;
            }
            size = next;
            kept++;
        }

        if (kept > 0) {
            String payload = "[" + String.join(",", serialized.subList(0, kept)) + "]" + marker(kept, total);
            return new TruncatedPayload(payload, true, kept, total);
        }

        String marker = marker(0, total);
        int room = byteBudget - utf8Length(marker);
        String payload = room > 0 ? cutToBytes(full, room) + marker : cutToBytes(marker, byteBudget);
        return new TruncatedPayload(payload, true, 0, total);
    }

    static String marker(int kept, int total) {
        return " …[truncated: kept " + kept + " of " + total + " records]";
    }

    static int utf8Length(String s) {
        return s.getBytes(StandardCharsets.UTF_8).length;
    }

    /** Longest prefix of {@code s} whose UTF-8 encoding fits in {@code maxBytes} */
    static String cutToBytes(String s, int maxBytes) {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        if (bytes.length <= maxBytes) return s;
        int end = maxBytes;
        // step back off UTF-8 continuation bytes
        while (end > 0 && (bytes[end] & 0xC0) == 0x80) {
            end--;
        }
        return new String(bytes, 0, end, StandardCharsets.UTF_8);
    }

    private String write(Map<String, Object> row) {
        try {
            return objectMapper.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Tool row is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    public record TruncatedPayload(String payload, boolean truncated, int keptRecords, int totalRecords) {}
}
