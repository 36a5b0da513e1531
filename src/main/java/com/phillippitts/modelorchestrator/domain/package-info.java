/**
 * Immutable value types flowing through an orchestration run.
 *
 * <p>An {@link com.phillippitts.modelorchestrator.domain.Outcome} is produced per attempt,
 * folded into one {@link com.phillippitts.modelorchestrator.domain.RetryResult} per model, and
 * the results are reduced to an {@link com.phillippitts.modelorchestrator.domain.OrchestrationSummary}.
 * All of them are records validated in their constructors and safe to share across threads.
 */
package com.phillippitts.modelorchestrator.domain;
