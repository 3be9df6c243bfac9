/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the interfaces infrastructure adapters implement
 * to give the orchestrator its storage and recovery control plane.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.drorchestrator.core.spi.ExecutionStore} - Execution persistence with version-guarded writes</li>
 *   <li>{@link com.ryuqq.drorchestrator.core.spi.ProtectionGroupStore} - Protection group and launch-config status persistence</li>
 *   <li>{@link com.ryuqq.drorchestrator.core.spi.ServerReservations} - Atomic server claims across executions</li>
 *   <li>{@link com.ryuqq.drorchestrator.core.spi.RecoveryControlPlane} - Recovery job and launch configuration API</li>
 *   <li>{@link com.ryuqq.drorchestrator.core.spi.ControlPlaneProvider} - Cross-account scoped clients</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., dr-orchestrator-adapter-inmemory) provide concrete implementations.
 * Blocking calls must be bounded by timeouts inside the adapter.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.drorchestrator.core.spi;
