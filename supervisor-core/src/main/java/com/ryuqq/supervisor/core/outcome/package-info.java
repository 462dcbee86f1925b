/**
 * Process result package.
 *
 * <p>This package defines the sealed interface hierarchy returned by
 * {@link com.ryuqq.supervisor.core.process.Process#ready()} and
 * {@link com.ryuqq.supervisor.core.process.Process#waitFor()}.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.supervisor.core.outcome.Ok} - Success</li>
 *   <li>{@link com.ryuqq.supervisor.core.outcome.RunnerError} - The runner's setup or run failed</li>
 *   <li>{@link com.ryuqq.supervisor.core.outcome.ResultAlreadyGiven} - The result was already handed out</li>
 *   <li>{@link com.ryuqq.supervisor.core.outcome.CouldNotRecvResult} - The runner thread exited without publishing</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Values, not exceptions:</strong> lifecycle misuse is reported as a result</li>
 *   <li><strong>Opaque errors:</strong> runner failures are carried as-is</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Supervisor Team
 */
package com.ryuqq.supervisor.core.outcome;
