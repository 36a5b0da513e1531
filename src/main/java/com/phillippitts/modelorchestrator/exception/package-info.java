/**
 * Application-specific exception hierarchy.
 *
 * <ul>
 *   <li>{@link com.phillippitts.modelorchestrator.exception.ModelOrchestratorException} - base for
 *       all application errors</li>
 *   <li>{@link com.phillippitts.modelorchestrator.exception.InvalidOrchestrationRequestException} -
 *       caller input rejected before any model is contacted</li>
 *   <li>{@link com.phillippitts.modelorchestrator.exception.UnsupportedModelException} - model id
 *       without a backend</li>
 *   <li>{@link com.phillippitts.modelorchestrator.exception.ModelInvocationException} - classified
 *       backend failure, used inside adapters only</li>
 * </ul>
 *
 * <p>Per-model failures never surface as exceptions from an orchestration run; they are reported
 * as {@code FailureSummary} entries. Only request validation errors reach the caller.
 */
package com.phillippitts.modelorchestrator.exception;
