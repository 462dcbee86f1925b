/**
 * Thread-to-thread channels and multi-way wait.
 *
 * <p>This package provides the blocking hand-off primitives used by the supervision
 * runtime to move signals and results between threads.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.supervisor.core.channel.Sender} - Sending handle</li>
 *   <li>{@link com.ryuqq.supervisor.core.channel.Receiver} - Receiving handle</li>
 *   <li>{@link com.ryuqq.supervisor.core.channel.Channel} - Bounded, rendezvous or unbounded channel</li>
 *   <li>{@link com.ryuqq.supervisor.core.channel.Select} - Wait until one of several receivers is ready</li>
 * </ul>
 *
 * <h2>Capacities</h2>
 * <pre>
 * bounded(n)   → send blocks while n values are buffered
 * rendezvous() → send blocks until a receiver takes the value
 * unbounded()  → send never blocks
 * </pre>
 *
 * <h2>Closing</h2>
 * <ul>
 *   <li>Sending to a closed channel returns {@code false}</li>
 *   <li>Receiving from a closed, drained channel returns {@code Optional.empty()}</li>
 *   <li>A closed channel is always "ready" for {@link com.ryuqq.supervisor.core.channel.Select}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Supervisor Team
 */
package com.ryuqq.supervisor.core.channel;
