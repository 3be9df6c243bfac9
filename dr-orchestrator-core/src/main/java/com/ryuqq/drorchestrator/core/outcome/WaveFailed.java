package com.ryuqq.drorchestrator.core.outcome;

import com.ryuqq.drorchestrator.core.exception.ErrorCode;
import com.ryuqq.drorchestrator.core.model.ServerStatus;

import java.util.List;

/**
 * 영구 실패.
 *
 * @param errorCode 오류 코드 (null 불가)
 * @param message 오류 메시지 (null/blank 불가)
 * @param servers 서버 스냅샷
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record WaveFailed(ErrorCode errorCode, String message, List<ServerStatus> servers) implements WaveOutcome {

    public WaveFailed {
        if (errorCode == null) {
            throw new IllegalArgumentException("errorCode cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        servers = List.copyOf(servers);
    }
}
