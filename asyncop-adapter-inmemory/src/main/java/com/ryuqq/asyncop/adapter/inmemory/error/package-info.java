/**
 * In-memory ErrorReporter adapter implementation package.
 *
 * <p>{@link com.ryuqq.asyncop.adapter.inmemory.error.CollectingErrorReporter} records
 * terminal operation failures instead of showing them to a user, so headless runs and
 * Contract Tests can assert on what would have been reported.</p>
 *
 * @see com.ryuqq.asyncop.core.spi.ErrorReporter
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.asyncop.adapter.inmemory.error;
