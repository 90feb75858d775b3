/**
 * Guarded loading of a repository into a UI-bound collection, with retry and a time limit.
 *
 * <ul>
 *   <li>{@link com.ryuqq.asyncop.application.loader.CollectionLoader} - multi-phase load path</li>
 *   <li>{@link com.ryuqq.asyncop.application.loader.TimeoutRace} - operation vs fixed delay</li>
 *   <li>{@link com.ryuqq.asyncop.application.loader.LoaderConfig} - retry and timeout settings</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.asyncop.application.loader;
