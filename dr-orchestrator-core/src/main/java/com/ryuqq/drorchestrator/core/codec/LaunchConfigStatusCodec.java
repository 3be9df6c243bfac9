package com.ryuqq.drorchestrator.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.drorchestrator.core.model.ConfigState;
import com.ryuqq.drorchestrator.core.model.LaunchConfigStatus;
import com.ryuqq.drorchestrator.core.model.ServerConfigState;
import com.ryuqq.drorchestrator.core.model.ServerConfigStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link LaunchConfigStatus} JSON 문서 변환.
 *
 * <p>{@link PersistedFields}의 안정 필드 이름과 소문자 상태 값, ISO-8601 시각을 사용합니다.
 * 인코딩 후 디코딩한 값은 원본과 모든 필드에서 같습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LaunchConfigStatusCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    // Utility class - prevent instantiation
    private LaunchConfigStatusCodec() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * JSON 문자열로 인코딩.
     *
     * @param status 상태 (null 불가)
     * @return JSON 문서
     */
    public static String encode(LaunchConfigStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        ObjectNode root = MAPPER.createObjectNode();
        root.put(PersistedFields.STATUS, status.status() == null ? null : status.status().wireValue());
        putInstant(root, PersistedFields.LAST_APPLIED, status.lastApplied());
        root.put(PersistedFields.APPLIED_BY, status.appliedBy());

        if (status.serverConfigs() == null) {
            root.putNull(PersistedFields.SERVER_CONFIGS);
        } else {
            ObjectNode servers = root.putObject(PersistedFields.SERVER_CONFIGS);
            status.serverConfigs().forEach((serverId, config) -> {
                ObjectNode server = servers.putObject(serverId);
                server.put(PersistedFields.STATUS, config.status().wireValue());
                putInstant(server, PersistedFields.LAST_APPLIED, config.lastApplied());
                server.put(PersistedFields.CONFIG_HASH, config.configHash());
                putErrors(server, config.errors());
            });
        }
        putErrors(root, status.errors());

        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode launch config status", e);
        }
    }

    /**
     * JSON 문자열로부터 디코딩.
     *
     * @param json JSON 문서
     * @return 상태
     * @throws IllegalArgumentException 문서 형식이 잘못된 경우
     */
    public static LaunchConfigStatus decode(String json) {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed launch config status document", e);
        }

        ConfigState state = textOrNull(root, PersistedFields.STATUS) == null
            ? null
            : ConfigState.fromWireValue(root.get(PersistedFields.STATUS).asText());

        Map<String, ServerConfigStatus> serverConfigs = null;
        JsonNode servers = root.get(PersistedFields.SERVER_CONFIGS);
        if (servers != null && servers.isObject()) {
            serverConfigs = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = servers.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                JsonNode server = entry.getValue();
                serverConfigs.put(entry.getKey(), new ServerConfigStatus(
                    ServerConfigState.fromWireValue(server.get(PersistedFields.STATUS).asText()),
                    instantOrNull(server, PersistedFields.LAST_APPLIED),
                    textOrNull(server, PersistedFields.CONFIG_HASH),
                    errors(server)
                ));
            }
        }

        return new LaunchConfigStatus(
            state,
            instantOrNull(root, PersistedFields.LAST_APPLIED),
            textOrNull(root, PersistedFields.APPLIED_BY),
            serverConfigs,
            errors(root)
        );
    }

    private static void putInstant(ObjectNode node, String field, Instant value) {
        node.put(field, value == null ? null : value.toString());
    }

    private static void putErrors(ObjectNode node, List<String> errors) {
        if (errors == null) {
            node.putNull(PersistedFields.ERRORS);
            return;
        }
        ArrayNode array = node.putArray(PersistedFields.ERRORS);
        errors.forEach(array::add);
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Instant instantOrNull(JsonNode node, String field) {
        String text = textOrNull(node, field);
        return text == null ? null : Instant.parse(text);
    }

    private static List<String> errors(JsonNode node) {
        JsonNode array = node.get(PersistedFields.ERRORS);
        if (array == null || array.isNull()) {
            return null;
        }
        List<String> errors = new ArrayList<>();
        array.forEach(element -> errors.add(element.asText()));
        return errors;
    }
}
