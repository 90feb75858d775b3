/**
 * UI-bound ordered collection that accepts mutations from any thread.
 *
 * <p>Every call swaps one immutable snapshot and emits exactly one
 * {@link com.ryuqq.asyncop.core.collection.CollectionChange}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.asyncop.core.collection;
