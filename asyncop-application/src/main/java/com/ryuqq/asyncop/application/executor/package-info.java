/**
 * Runs a cancellable operation while publishing loading, status and progress state.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.asyncop.application.executor;
