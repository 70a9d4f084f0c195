package com.ryuqq.wrapper.core.combinator;

import com.ryuqq.wrapper.core.diagnostic.DiagnosticSink;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Catch combinator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>exceptions: 잡을 예외 클래스 집합 (기본 {@code {Exception.class}})</li>
 *   <li>handler: 잡힌 예외를 받을 handler (기본 없음, null 허용)</li>
 *   <li>silent: true이면 handler가 있어도 아무 것도 보고하지 않음 (기본 false)</li>
 *   <li>sink: handler가 없을 때 사용할 DiagnosticSink (기본 표준 스트림)</li>
 * </ul>
 *
 * <p>exceptions에 지정된 클래스 중 하나라도 일치(하위 타입 포함)하면 잡습니다.
 * 일치하지 않는 예외는 그대로 전파됩니다.</p>
 *
 * @author Wrapper Team
 * @since 1.0.0
 * @param exceptions 잡을 예외 클래스 (1개 이상)
 * @param handler 예외 handler (null 허용)
 * @param silent 진단 출력 억제 여부
 * @param sink 기본 진단 출력 채널
 */
public record CatchPolicy(
    Set<Class<? extends Throwable>> exceptions,
    FailureHandler handler,
    boolean silent,
    DiagnosticSink sink
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: exceptions={Exception.class}, handler=null, silent=false, sink=표준 스트림</p>
     */
    public CatchPolicy() {
        this(Set.of(Exception.class), null, false, DiagnosticSink.standardStreams());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CatchPolicy {
        if (exceptions == null || exceptions.isEmpty()) {
            throw new IllegalArgumentException("exceptions cannot be null or empty");
        }
        for (Class<? extends Throwable> type : exceptions) {
            if (type == null) {
                throw new IllegalArgumentException("exceptions cannot contain null");
            }
        }
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        exceptions = Set.copyOf(exceptions);
        // handler는 null 허용
    }

    /**
     * 예외 일치 여부.
     *
     * @param error 대상이 던진 예외
     * @return 설정된 클래스 중 하나의 인스턴스이면 true
     */
    public boolean matches(Throwable error) {
        for (Class<? extends Throwable> type : exceptions) {
            if (type.isInstance(error)) {
                return true;
            }
        }
        return false;
    }

    /**
     * exceptions만 변경한 새 인스턴스 생성.
     */
    @SafeVarargs
    public final CatchPolicy withExceptions(Class<? extends Throwable>... exceptions) {
        if (exceptions == null) {
            throw new IllegalArgumentException("exceptions cannot be null or empty");
        }
        return withExceptions(Arrays.asList(exceptions));
    }

    /**
     * exceptions만 변경한 새 인스턴스 생성 (목록은 집합으로 정규화).
     */
    public CatchPolicy withExceptions(Collection<? extends Class<? extends Throwable>> exceptions) {
        if (exceptions == null) {
            throw new IllegalArgumentException("exceptions cannot be null or empty");
        }
        return new CatchPolicy(new LinkedHashSet<>(exceptions), handler, silent, sink);
    }

    /**
     * handler만 변경한 새 인스턴스 생성.
     */
    public CatchPolicy withHandler(FailureHandler handler) {
        return new CatchPolicy(exceptions, handler, silent, sink);
    }

    /**
     * silent만 변경한 새 인스턴스 생성.
     */
    public CatchPolicy withSilent(boolean silent) {
        return new CatchPolicy(exceptions, handler, silent, sink);
    }

    /**
     * sink만 변경한 새 인스턴스 생성.
     */
    public CatchPolicy withSink(DiagnosticSink sink) {
        return new CatchPolicy(exceptions, handler, silent, sink);
    }
}
