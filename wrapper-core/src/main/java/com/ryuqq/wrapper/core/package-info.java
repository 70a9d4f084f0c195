/**
 * Wrapper Core - 함수 감싸기 combinator 라이브러리.
 *
 * <h2>패키지 구성</h2>
 * <pre>
 * core
 *  ├─ model       (Invocation)
 *  ├─ function    (Invocable, CallWrapper, Decorator)
 *  ├─ outcome     (Guarded: Returned | Suppressed)
 *  ├─ spi         (WorkerPool, CompletionHandle, MonotonicTimer)
 *  ├─ diagnostic  (DiagnosticSink)
 *  ├─ combinator  (Repeat, ThreadedRepeat, Catch, TimeIt)
 *  └─ decorator   (DecoratorFactory)
 * </pre>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
package com.ryuqq.wrapper.core;
