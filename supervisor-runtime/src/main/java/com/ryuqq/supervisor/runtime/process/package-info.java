/**
 * Process handle over a single background runner thread.
 *
 * <p>{@link com.ryuqq.supervisor.runtime.process.SupervisedProcess} reports setup and run
 * outcomes once each, rejects repeated calls with
 * {@link com.ryuqq.supervisor.core.outcome.ResultAlreadyGiven}, and joins its thread on close.</p>
 */
package com.ryuqq.supervisor.runtime.process;
