package com.ryuqq.supervisor.core.runner;

import com.ryuqq.supervisor.core.channel.Receiver;
import com.ryuqq.supervisor.core.signal.Signal;

/**
 * {@link Runner#run(Receiver)}과 같은 시그니처의 함수.
 *
 * @author Supervisor Team
 * @since 1.0.0
 * @see FnRunner
 */
@FunctionalInterface
public interface RunFunction {

    void run(Receiver<Signal> signals) throws Exception;
}
