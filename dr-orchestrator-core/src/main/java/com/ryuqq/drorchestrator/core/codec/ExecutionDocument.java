package com.ryuqq.drorchestrator.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.drorchestrator.core.model.Execution;
import com.ryuqq.drorchestrator.core.model.ServerStatus;
import com.ryuqq.drorchestrator.core.model.Wave;
import com.ryuqq.drorchestrator.core.model.WaveResult;

import java.time.Instant;

/**
 * Execution을 UI가 읽는 JSON 문서로 변환.
 *
 * <p>{@code status}, {@code pausedBeforeWave}, {@code wave_results}는 안정 필드입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ExecutionDocument {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    // Utility class - prevent instantiation
    private ExecutionDocument() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static ObjectNode toTree(Execution execution) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("executionId", execution.getExecutionId());
        root.put("planId", execution.getPlanId());
        root.put("executionType", execution.getType().name());
        root.put(PersistedFields.STATUS, execution.getStatus().name());
        putInstant(root, "startTime", execution.getStartTime());
        putInstant(root, "endTime", execution.getEndTime());
        putInstant(root, "lastPolledTime", execution.getLastPolledTime());
        if (execution.getDurationSeconds() == null) {
            root.putNull("durationSeconds");
        } else {
            root.put("durationSeconds", execution.getDurationSeconds());
        }
        if (execution.getPausedBeforeWave() == null) {
            root.putNull(PersistedFields.PAUSED_BEFORE_WAVE);
        } else {
            root.put(PersistedFields.PAUSED_BEFORE_WAVE, execution.getPausedBeforeWave());
        }
        root.put("currentWave", execution.getCurrentWaveNumber());
        root.put("completed_waves", execution.getCompletedWaves());
        root.put("failed_waves", execution.getFailedWaves());
        root.put("all_waves_completed", execution.isAllWavesCompleted());
        root.put("error", execution.getError());
        root.put("error_code", execution.getErrorCode() == null ? null : execution.getErrorCode().name());
        root.put("status_reason", execution.getStatusReason());

        ArrayNode waves = root.putArray("waves");
        for (Wave wave : execution.getWaves()) {
            ObjectNode node = waves.addObject();
            node.put("waveNumber", wave.getWaveNumber());
            node.put("waveName", wave.getWaveName());
            node.put("protectionGroupId", wave.getProtectionGroupId());
            node.put(PersistedFields.STATUS, wave.getStatus().name());
            node.put("jobId", wave.getJobId());
            node.put("region", wave.getRegion());
            ArrayNode servers = node.putArray("serverStatuses");
            for (ServerStatus server : wave.getServers()) {
                ObjectNode serverNode = servers.addObject();
                serverNode.put("sourceServerId", server.sourceServerId());
                serverNode.put("launchStatus", server.launchStatus().name());
                serverNode.put("recoveryInstanceId", server.recoveryInstanceId());
                serverNode.put("hostname", server.hostname());
                serverNode.put("privateIp", server.privateIp());
            }
        }

        ArrayNode results = root.putArray(PersistedFields.WAVE_RESULTS);
        for (WaveResult result : execution.getWaveResults()) {
            ObjectNode node = results.addObject();
            node.put("waveNumber", result.waveNumber());
            node.put("waveName", result.waveName());
            node.put("jobId", result.jobId());
            node.put("region", result.region());
            ArrayNode serverIds = node.putArray("serverIds");
            result.serverIds().forEach(serverIds::add);
            putInstant(node, "startTime", result.startTime());
        }
        return root;
    }

    public static String toJson(Execution execution) {
        try {
            return MAPPER.writeValueAsString(toTree(execution));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode execution " + execution.getKey(), e);
        }
    }

    private static void putInstant(ObjectNode node, String field, Instant value) {
        node.put(field, value == null ? null : value.toString());
    }
}
