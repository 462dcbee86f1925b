/**
 * Test support for Runner and Process implementations.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.supervisor.testkit.TestRunner} - Scripted runner reporting its outcome</li>
 *   <li>{@link com.ryuqq.supervisor.testkit.TestProcess} - Minimal process for testing runners alone</li>
 *   <li>{@link com.ryuqq.supervisor.testkit.AbstractSupervisionTest} - JUnit base class joining processes after each test</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Supervisor Team
 */
package com.ryuqq.supervisor.testkit;
