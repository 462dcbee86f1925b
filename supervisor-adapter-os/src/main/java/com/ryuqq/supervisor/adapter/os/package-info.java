/**
 * OS signal adapter.
 *
 * <p>{@link com.ryuqq.supervisor.adapter.os.Launcher} subscribes to process signals through a
 * {@link com.ryuqq.supervisor.adapter.os.SignalSubscriber} and starts the runner in a
 * {@link com.ryuqq.supervisor.runtime.process.SupervisedProcess}. OS signals and
 * {@code Process.signal} calls share one unbounded channel.</p>
 */
package com.ryuqq.supervisor.adapter.os;
