package com.ryuqq.wrapper.testkit;

import com.ryuqq.wrapper.core.diagnostic.DiagnosticSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 보고 내용을 메모리에 기록하는 DiagnosticSink.
 *
 * <p>테스트에서 기본 sink가 호출되었는지(또는 호출되지 않았는지) 검증할 때 사용합니다.
 * thread-safe합니다.</p>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
public final class RecordingDiagnosticSink implements DiagnosticSink {

    /**
     * 기록된 예외 보고.
     *
     * @param name 대상 이름
     * @param error 예외
     */
    public record FailureReport(String name, Throwable error) {
    }

    /**
     * 기록된 타이밍 보고.
     *
     * @param name 대상 이름
     * @param elapsedSeconds 경과 시간
     */
    public record TimingReport(String name, double elapsedSeconds) {
    }

    private final List<FailureReport> failures = new CopyOnWriteArrayList<>();
    private final List<TimingReport> timings = new CopyOnWriteArrayList<>();

    @Override
    public void reportFailure(String name, Throwable error) {
        failures.add(new FailureReport(name, error));
    }

    @Override
    public void reportTiming(String name, double elapsedSeconds) {
        timings.add(new TimingReport(name, elapsedSeconds));
    }

    public List<FailureReport> getFailures() {
        return List.copyOf(failures);
    }

    public List<TimingReport> getTimings() {
        return List.copyOf(timings);
    }

    /**
     * 기록 초기화.
     */
    public void clear() {
        failures.clear();
        timings.clear();
    }
}
