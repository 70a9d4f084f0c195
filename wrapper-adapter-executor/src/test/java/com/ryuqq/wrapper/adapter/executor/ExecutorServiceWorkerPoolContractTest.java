package com.ryuqq.wrapper.adapter.executor;

import com.ryuqq.wrapper.core.spi.WorkerPool;
import com.ryuqq.wrapper.testkit.contract.AbstractWorkerPoolContractTest;

/**
 * ExecutorServiceWorkerPool에 대한 WorkerPool 계약 검증.
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
class ExecutorServiceWorkerPoolContractTest extends AbstractWorkerPoolContractTest {

    @Override
    protected WorkerPool createPool() {
        return new ExecutorServiceWorkerPool(new WorkerPoolConfig()
            .withThreads(4)
            .withThreadNamePrefix("contract")
            .withShutdownTimeoutMs(5000));
    }
}
