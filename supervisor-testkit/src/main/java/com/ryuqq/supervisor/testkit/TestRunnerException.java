package com.ryuqq.supervisor.testkit;

/**
 * Failure raised by {@link TestRunner}.
 *
 * @author Supervisor Team
 * @since 1.0.0
 */
public class TestRunnerException extends Exception {

    private static final long serialVersionUID = 1L;

    public TestRunnerException(String message) {
        super(message);
    }
}
