package com.ryuqq.handover.adapter.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.handover.core.exception.JobQueryException;
import com.ryuqq.handover.core.job.JobOutput;
import com.ryuqq.handover.core.job.JobState;
import com.ryuqq.handover.core.job.JobStatus;
import com.ryuqq.handover.core.spi.CompletionReport;

import java.util.Map;

/**
 * Turns job service JSON into {@link JobStatus} and {@link CompletionReport}.
 *
 * <p>Anything that cannot be read as a known status raises a malformed-response
 * {@link JobQueryException}; a broken payload never reads as "still running".</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class JobStatusParser {

    private static final TypeReference<Map<String, Object>> ATTRIBUTES = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public JobStatusParser(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * Parses a {@code GET /jobs/{id}} body: {@code {"status": ..., "output": {...}}}.
     */
    public JobStatus parseStatus(String body) {
        JsonNode root = readObject(body);
        JobState state = readState(root);

        JsonNode output = root.get("output");
        if (output == null || output.isNull()) {
            return JobStatus.of(state);
        }
        if (!output.isObject()) {
            throw JobQueryException.malformed("Job output is not an object: " + output.getNodeType(), null);
        }
        JsonNode outputStatus = output.get("status");
        if (outputStatus != null && !outputStatus.isNull() && !outputStatus.isTextual()) {
            throw JobQueryException.malformed("Job output status is not a string", null);
        }
        String status = outputStatus == null || outputStatus.isNull() ? null : outputStatus.asText();
        Map<String, Object> attributes = objectMapper.convertValue(output, ATTRIBUTES);
        return JobStatus.of(state, new JobOutput(status, attributes));
    }

    /**
     * Parses a completion URL body: {@code {"status": ..., "subject": ..., "body": ...}}.
     *
     * <p>subject and body are only required once the status is no longer pending.</p>
     */
    public CompletionReport parseCompletion(String body) {
        JsonNode root = readObject(body);
        JobState state = readState(root);
        String subject = textOrNull(root, "subject");
        String text = textOrNull(root, "body");
        if (!state.isPending() && (subject == null || text == null)) {
            throw JobQueryException.malformed("Completed report is missing subject or body", null);
        }
        return new CompletionReport(state, subject, text);
    }

    private JsonNode readObject(String body) {
        if (body == null || body.isBlank()) {
            throw JobQueryException.malformed("Empty response body", null);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw JobQueryException.malformed("Response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw JobQueryException.malformed("Response is not a JSON object", null);
        }
        return root;
    }

    private static JobState readState(JsonNode root) {
        JsonNode status = root.get("status");
        if (status == null || !status.isTextual()) {
            throw JobQueryException.malformed("Response has no status", null);
        }
        return JobState.fromWire(status.asText())
            .orElseThrow(() -> JobQueryException.malformed("Unknown job status: " + status.asText(), null));
    }

    private static String textOrNull(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
