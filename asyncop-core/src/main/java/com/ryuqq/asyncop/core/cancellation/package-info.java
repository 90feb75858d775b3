/**
 * Cooperative, epoch-scoped cancellation.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.asyncop.core.cancellation.CancellationSignal} - read side observed by operations</li>
 *   <li>{@link com.ryuqq.asyncop.core.cancellation.CancellationEpoch} - one generation, cancelled at most once</li>
 *   <li>{@link com.ryuqq.asyncop.core.cancellation.CancellationSource} - owns the current epoch, cancel/reset/dispose</li>
 * </ul>
 *
 * <h2>Epoch Rules</h2>
 * <pre>
 * reset():  current = next(); previous.cancel()
 * close():  current.cancel(); every later current()/reset() fails fast
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.asyncop.core.cancellation;
