package com.ryuqq.wrapper.testkit;

import com.ryuqq.wrapper.core.function.Invocable;
import com.ryuqq.wrapper.core.model.Invocation;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 호출 횟수와 인자를 기록하는 Invocable.
 *
 * <p>실제 동작은 위임 대상이 수행하며, 호출 전에 횟수와 Invocation을 기록합니다.
 * 여러 스레드에서 동시에 호출되어도 정확히 셉니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CountingInvocable<Integer> square = CountingInvocable.of("square",
 *     call -> call.positional(0, Integer.class) * call.positional(0, Integer.class));
 *
 * Repeat.times(3).decorate(square).call(4);
 * square.count(); // 3
 * }</pre>
 *
 * @param <R> 반환 타입
 * @author Wrapper Team
 * @since 1.0.0
 */
public final class CountingInvocable<R> implements Invocable<R> {

    private final String name;
    private final Invocable<R> delegate;
    private final AtomicInteger count = new AtomicInteger();
    private final List<Invocation> invocations = new CopyOnWriteArrayList<>();

    private CountingInvocable(String name, Invocable<R> delegate) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.name = name;
        this.delegate = delegate;
    }

    /**
     * 생성.
     *
     * @param name 이름
     * @param delegate 실제 동작
     * @param <R> 반환 타입
     * @return CountingInvocable 인스턴스
     */
    public static <R> CountingInvocable<R> of(String name, Invocable<R> delegate) {
        return new CountingInvocable<>(name, delegate);
    }

    /**
     * 항상 같은 값을 반환하는 CountingInvocable.
     *
     * @param name 이름
     * @param value 반환값
     * @param <R> 반환 타입
     * @return CountingInvocable 인스턴스
     */
    public static <R> CountingInvocable<R> returning(String name, R value) {
        return new CountingInvocable<>(name, invocation -> value);
    }

    /**
     * 항상 예외를 던지는 CountingInvocable.
     *
     * @param name 이름
     * @param error 던질 예외
     * @param <R> 반환 타입
     * @return CountingInvocable 인스턴스
     */
    public static <R> CountingInvocable<R> throwing(String name, Exception error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new CountingInvocable<>(name, invocation -> {
            throw error;
        });
    }

    @Override
    public R invoke(Invocation invocation) throws Exception {
        count.incrementAndGet();
        invocations.add(invocation);
        return delegate.invoke(invocation);
    }

    @Override
    public String name() {
        return name;
    }

    public int count() {
        return count.get();
    }

    public List<Invocation> getInvocations() {
        return List.copyOf(invocations);
    }
}
