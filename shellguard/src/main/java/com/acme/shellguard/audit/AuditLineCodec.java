package com.acme.shellguard.audit;

import com.acme.shellguard.policy.SafetyTier;
import com.acme.shellguard.util.JsonCodec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Encodes one {@link AuditRecord} as one self-contained JSON line and back.
 *
 * <p>Absent optionals are written as JSON {@code null}; on read a null or missing optional field is
 * accepted. The encoded line never contains a raw newline.</p>
 */
public final class AuditLineCodec {
    static final String TIMESTAMP = "timestamp";
    static final String USER = "user";
    static final String ORGANIZATION = "organization";
    static final String DEPARTMENT = "department";
    static final String INPUT = "input";
    static final String GENERATED_COMMAND = "generated_command";
    static final String EXECUTED = "executed";
    static final String EXIT_CODE = "exit_code";
    static final String SAFETY_LEVEL = "safety_level";
    static final String NOTES = "notes";
    static final String LLM_BACKEND = "llm_backend";
    static final String SESSION_ID = "session_id";

    public String encode(AuditRecord record) throws AuditLineFormatException {
        return new String(encodeLine(record), StandardCharsets.UTF_8);
    }

    /** UTF-8 bytes of the line, without the trailing newline. */
    public byte[] encodeLine(AuditRecord record) throws AuditLineFormatException {
        ObjectNode node = JsonCodec.createObjectNode();
        node.put(TIMESTAMP, record.timestamp().toString());
        node.put(USER, record.user());
        node.put(ORGANIZATION, record.organization());
        node.put(DEPARTMENT, record.department());
        node.put(INPUT, record.naturalLanguageInput());
        node.put(GENERATED_COMMAND, record.generatedCommand());
        node.put(EXECUTED, record.executed());
        node.put(EXIT_CODE, record.exitCode());
        node.put(SAFETY_LEVEL, record.tier().wireName());
        node.put(NOTES, record.notes());
        node.put(LLM_BACKEND, record.backendId());
        node.put(SESSION_ID, record.sessionId());
        try {
            return JsonCodec.writeBytes(node);
        } catch (JsonProcessingException e) {
            throw new AuditLineFormatException("cannot serialize audit record", e);
        }
    }

    public AuditRecord decode(String line) throws AuditLineFormatException {
        JsonNode row;
        try {
            row = JsonCodec.readTree(line);
        } catch (JsonProcessingException e) {
            throw new AuditLineFormatException("not valid JSON", e);
        }
        if (row == null || !row.isObject()) {
            throw new AuditLineFormatException("not a JSON object");
        }
        return new AuditRecord(
            parseTimestamp(requiredText(row, TIMESTAMP)),
            requiredText(row, USER),
            optionalText(row, ORGANIZATION),
            optionalText(row, DEPARTMENT),
            requiredText(row, INPUT),
            requiredText(row, GENERATED_COMMAND),
            requiredBoolean(row, EXECUTED),
            optionalInt(row, EXIT_CODE),
            parseTier(requiredText(row, SAFETY_LEVEL)),
            requiredText(row, LLM_BACKEND),
            optionalText(row, NOTES),
            optionalText(row, SESSION_ID)
        );
    }

    private static String requiredText(JsonNode row, String field) throws AuditLineFormatException {
        JsonNode v = row.get(field);
        if (v == null || !v.isTextual()) {
            throw new AuditLineFormatException("missing required text field: " + field);
        }
        return v.asText();
    }

    private static boolean requiredBoolean(JsonNode row, String field) throws AuditLineFormatException {
        JsonNode v = row.get(field);
        if (v == null || !v.isBoolean()) {
            throw new AuditLineFormatException("missing required boolean field: " + field);
        }
        return v.asBoolean();
    }

    private static String optionalText(JsonNode row, String field) throws AuditLineFormatException {
        JsonNode v = row.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        if (!v.isTextual()) {
            throw new AuditLineFormatException("expected text field: " + field);
        }
        return v.asText();
    }

    private static Integer optionalInt(JsonNode row, String field) throws AuditLineFormatException {
        JsonNode v = row.get(field);
        if (v == null || v.isNull()) {
            return null;
        }
        if (!v.isInt()) {
            throw new AuditLineFormatException("expected int field: " + field);
        }
        return v.asInt();
    }

    private static Instant parseTimestamp(String raw) throws AuditLineFormatException {
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(raw).toInstant();
            } catch (DateTimeParseException ignored) {
                throw new AuditLineFormatException("bad timestamp: " + raw, e);
            }
        }
    }

    private static SafetyTier parseTier(String raw) throws AuditLineFormatException {
        try {
            return SafetyTier.fromWireName(raw);
        } catch (IllegalArgumentException e) {
            throw new AuditLineFormatException(e.getMessage(), e);
        }
    }
}
