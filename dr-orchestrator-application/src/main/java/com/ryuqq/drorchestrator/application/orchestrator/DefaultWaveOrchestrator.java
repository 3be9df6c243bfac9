package com.ryuqq.drorchestrator.application.orchestrator;

import com.ryuqq.drorchestrator.application.admission.AdmissionController;
import com.ryuqq.drorchestrator.application.admission.Conflict;
import com.ryuqq.drorchestrator.application.admission.MembershipResolver;
import com.ryuqq.drorchestrator.application.launchconfig.LaunchConfigService;
import com.ryuqq.drorchestrator.application.wave.ExecutionFinalizer;
import com.ryuqq.drorchestrator.application.wave.WaveExecutor;
import com.ryuqq.drorchestrator.application.wave.WavePoller;
import com.ryuqq.drorchestrator.core.config.OrchestratorConfig;
import com.ryuqq.drorchestrator.core.exception.ConflictException;
import com.ryuqq.drorchestrator.core.exception.ErrorCode;
import com.ryuqq.drorchestrator.core.exception.NotFoundException;
import com.ryuqq.drorchestrator.core.exception.PersistenceException;
import com.ryuqq.drorchestrator.core.exception.QuotaExceededException;
import com.ryuqq.drorchestrator.core.exception.ValidationException;
import com.ryuqq.drorchestrator.core.model.AccountContext;
import com.ryuqq.drorchestrator.core.model.Execution;
import com.ryuqq.drorchestrator.core.model.ExecutionKey;
import com.ryuqq.drorchestrator.core.model.ExecutionType;
import com.ryuqq.drorchestrator.core.model.RecoveryPlan;
import com.ryuqq.drorchestrator.core.retry.Sleeper;
import com.ryuqq.drorchestrator.core.spi.ControlPlaneProvider;
import com.ryuqq.drorchestrator.core.spi.ExecutionStore;
import com.ryuqq.drorchestrator.core.spi.ProtectionGroupStore;
import com.ryuqq.drorchestrator.core.spi.ServerReservations;
import com.ryuqq.drorchestrator.core.statemachine.ExecutionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link WaveOrchestrator} 기본 구현.
 *
 * <p>모든 진입점은 저장소의 최신 실행을 기준으로 동작하며,
 * 경계에서 예외를 다음과 같이 처리합니다:</p>
 * <ul>
 *   <li>{@link ValidationException}: 상태 변경 없이 현재 저장 상태 반환</li>
 *   <li>{@link PersistenceException}: 다른 호출이 먼저 갱신한 경우이므로 최신 저장 상태 반환</li>
 *   <li>그 외: 실행을 FAILED(INTERNAL_ERROR)로 종료</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DefaultWaveOrchestrator implements WaveOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DefaultWaveOrchestrator.class);

    private final ExecutionStore executionStore;
    private final AdmissionController admissionController;
    private final WaveExecutor waveExecutor;
    private final WavePoller wavePoller;
    private final ExecutionFinalizer finalizer;
    private final OrchestratorConfig config;
    private final Clock clock;

    public DefaultWaveOrchestrator(ExecutionStore executionStore, AdmissionController admissionController,
                                   WaveExecutor waveExecutor, WavePoller wavePoller,
                                   ExecutionFinalizer finalizer, OrchestratorConfig config, Clock clock) {
        if (executionStore == null) {
            throw new IllegalArgumentException("executionStore cannot be null");
        }
        if (admissionController == null) {
            throw new IllegalArgumentException("admissionController cannot be null");
        }
        if (waveExecutor == null) {
            throw new IllegalArgumentException("waveExecutor cannot be null");
        }
        if (wavePoller == null) {
            throw new IllegalArgumentException("wavePoller cannot be null");
        }
        if (finalizer == null) {
            throw new IllegalArgumentException("finalizer cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.executionStore = executionStore;
        this.admissionController = admissionController;
        this.waveExecutor = waveExecutor;
        this.wavePoller = wavePoller;
        this.finalizer = finalizer;
        this.config = config;
        this.clock = clock;
    }

    /**
     * 저장소와 제어 평면으로부터 전체 구성요소를 조립.
     */
    public static DefaultWaveOrchestrator create(ExecutionStore executionStore, ProtectionGroupStore groupStore,
                                                 ServerReservations reservations,
                                                 ControlPlaneProvider controlPlaneProvider,
                                                 OrchestratorConfig config, Sleeper sleeper, Clock clock) {
        MembershipResolver membershipResolver = new MembershipResolver(controlPlaneProvider);
        AdmissionController admissionController = new AdmissionController(
            executionStore, groupStore, membershipResolver, controlPlaneProvider, config.quotaLimits());
        LaunchConfigService launchConfigService = new LaunchConfigService(
            groupStore, controlPlaneProvider, config.throttleRetry(), sleeper, clock);
        ExecutionFinalizer finalizer = new ExecutionFinalizer(executionStore, reservations, clock);
        WaveExecutor waveExecutor = new WaveExecutor(executionStore, groupStore, membershipResolver,
            admissionController, launchConfigService, reservations, controlPlaneProvider, finalizer,
            config, sleeper, clock);
        WavePoller wavePoller = new WavePoller(executionStore, groupStore, controlPlaneProvider,
            waveExecutor, finalizer, clock);
        return new DefaultWaveOrchestrator(executionStore, admissionController, waveExecutor, wavePoller,
            finalizer, config, clock);
    }

    @Override
    public Execution begin(RecoveryPlan plan, String executionId, ExecutionType type,
                           AccountContext accountContext, String initiatedBy) {
        List<Conflict> conflicts = admissionController.checkConflicts(plan, accountContext);
        List<Conflict> serverConflicts = conflicts.stream().filter(c -> !c.isQuotaViolation()).toList();
        if (!serverConflicts.isEmpty()) {
            throw new ConflictException(describe(serverConflicts));
        }
        if (!conflicts.isEmpty()) {
            throw new QuotaExceededException(describe(conflicts));
        }

        Execution execution = Execution.begin(plan, executionId, type, accountContext, initiatedBy,
            clock.instant(), config.pollIntervalSeconds(), config.maxWaitSeconds());
        Execution created = executionStore.create(execution);
        log.info("Execution created: key={}, type={}, waves={}, initiatedBy={}",
            created.getKey(), type, created.getWaves().size(), initiatedBy);
        return created;
    }

    @Override
    public Execution startWave(ExecutionKey key, int waveNumber, AccountContext accountContext) {
        Execution current = load(key);
        return guard(current, () -> waveExecutor.startWave(current, waveNumber, accountContext));
    }

    @Override
    public Execution poll(Execution execution) {
        if (execution == null) {
            throw new IllegalArgumentException("execution cannot be null");
        }
        Execution current = executionStore.find(execution.getKey()).orElse(execution);
        if (current.getStatus().isTerminal()) {
            log.debug("Poll on terminal execution ignored: key={}, status={}", current.getKey(), current.getStatus());
            return current;
        }
        return guard(current, () -> wavePoller.poll(current));
    }

    @Override
    public Execution resume(Execution execution) {
        if (execution == null) {
            throw new IllegalArgumentException("execution cannot be null");
        }
        Execution current = load(execution.getKey());
        return guard(current, () -> {
            Execution working = current.copy();
            int waveNumber;
            try {
                waveNumber = working.clearPause();
            } catch (IllegalStateException e) {
                throw new ValidationException(e.getMessage());
            }
            log.info("Resuming execution: key={}, wave={}", working.getKey(), waveNumber);
            Execution saved = executionStore.update(working);
            return waveExecutor.startWave(saved, waveNumber, null);
        });
    }

    @Override
    public Execution requestCancellation(ExecutionKey key) {
        Execution current = load(key);
        if (current.getStatus().isTerminal()) {
            throw new ValidationException(
                "Execution " + key + " is already " + current.getStatus() + " and cannot be cancelled");
        }
        if (current.getStatus() == ExecutionStatus.CANCELLING) {
            return current;
        }
        if (current.getStatus() == ExecutionStatus.PAUSED || !current.hasJobHandle()) {
            log.info("Cancelling idle execution immediately: key={}, status={}", key, current.getStatus());
            return finalizer.cancel(current);
        }
        current.transitionTo(ExecutionStatus.CANCELLING);
        Execution saved = executionStore.update(current);
        log.info("Cancellation requested: key={}", key);
        return saved;
    }

    private Execution load(ExecutionKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return executionStore.find(key)
            .orElseThrow(() -> new NotFoundException("Execution not found: " + key));
    }

    /**
     * 진입점 경계. 예외를 밖으로 던지지 않습니다.
     */
    private Execution guard(Execution current, Supplier<Execution> action) {
        try {
            return action.get();
        } catch (ValidationException e) {
            log.warn("Request rejected: key={}, message={}", current.getKey(), e.getMessage());
            return latest(current);
        } catch (PersistenceException e) {
            log.warn("Concurrent update detected, returning latest state: key={}", current.getKey(), e);
            return latest(current);
        } catch (RuntimeException e) {
            log.error("Unexpected failure, marking execution failed: key={}", current.getKey(), e);
            return failInternal(current, e);
        }
    }

    private Execution latest(Execution current) {
        try {
            return executionStore.find(current.getKey()).orElse(current);
        } catch (RuntimeException e) {
            log.error("Failed to reload execution: key={}", current.getKey(), e);
            return current;
        }
    }

    private Execution failInternal(Execution current, RuntimeException cause) {
        try {
            Execution fresh = latest(current).copy();
            if (fresh.getStatus().isTerminal()) {
                return fresh;
            }
            String message = "Internal error: " + cause.getMessage();
            fresh.recordError(ErrorCode.INTERNAL_ERROR, message);
            return finalizer.finish(fresh, ExecutionStatus.FAILED, message);
        } catch (RuntimeException e) {
            log.error("Failed to record internal failure: key={}", current.getKey(), e);
            return current;
        }
    }

    private static String describe(List<Conflict> conflicts) {
        return conflicts.stream().map(Conflict::message).collect(Collectors.joining("; "));
    }
}
