/**
 * External event identities.
 *
 * <p>{@link com.ryuqq.supervisor.core.signal.Signal} is a pure value type naming the
 * POSIX signal a shutdown or control request originated from.</p>
 *
 * @since 1.0.0
 * @author Supervisor Team
 */
package com.ryuqq.supervisor.core.signal;
