/**
 * Process state machine package.
 *
 * <p>This package guards the one-shot result delivery of a
 * {@link com.ryuqq.supervisor.core.process.Process}.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.supervisor.core.statemachine.ProcState} - Result delivery states (enum)</li>
 *   <li>{@link com.ryuqq.supervisor.core.statemachine.StateTransition} - Transition rules</li>
 * </ul>
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * INIT → SETUP_DONE (ready)
 * INIT → FINISHED (wait without ready)
 * SETUP_DONE → FINISHED (wait)
 *
 * Forbidden:
 * - FINISHED → * (terminal state)
 * - SETUP_DONE → SETUP_DONE (second ready)
 * </pre>
 *
 * @since 1.0.0
 * @author Supervisor Team
 */
package com.ryuqq.supervisor.core.statemachine;
