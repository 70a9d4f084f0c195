package com.ryuqq.wrapper.core.spi;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * 핸들 집합을 완료 순서대로 꺼내는 반복자.
 *
 * <p>제출 순서가 아니라 먼저 완료된 핸들부터 반환합니다.
 * {@link #next()}는 다음 핸들이 완료될 때까지 블로킹합니다.</p>
 *
 * <p><strong>인터럽트 처리:</strong> 대기 중 인터럽트가 발생해도 대기를 포기하지 않습니다.
 * 다음 핸들을 계속 기다린 뒤, 반환 직전에 현재 스레드의 인터럽트 플래그를 복원합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * for (CompletionHandle<T> done : CompletionOrder.of(handles)) {
 *     T value = done.await(); // 이미 완료된 핸들이므로 즉시 반환
 * }
 * }</pre>
 *
 * @param <T> 결과 타입
 * @author Wrapper Team
 * @since 1.0.0
 */
public final class CompletionOrder<T> implements Iterable<CompletionHandle<T>>, Iterator<CompletionHandle<T>> {

    private final LinkedBlockingQueue<CompletionHandle<T>> completed = new LinkedBlockingQueue<>();
    private final int total;
    private int taken;

    private CompletionOrder(List<? extends CompletionHandle<T>> handles) {
        this.total = handles.size();
        for (CompletionHandle<T> handle : handles) {
            handle.whenDone(() -> completed.add(handle));
        }
    }

    /**
     * 완료 순서 반복자 생성.
     *
     * @param handles 대기할 핸들 목록
     * @param <T> 결과 타입
     * @return CompletionOrder 인스턴스
     * @throws IllegalArgumentException handles가 null이거나 null 요소를 포함한 경우
     */
    public static <T> CompletionOrder<T> of(List<? extends CompletionHandle<T>> handles) {
        if (handles == null) {
            throw new IllegalArgumentException("handles cannot be null");
        }
        List<CompletionHandle<T>> copy = new ArrayList<>(handles.size());
        for (CompletionHandle<T> handle : handles) {
            if (handle == null) {
                throw new IllegalArgumentException("handles cannot contain null");
            }
            copy.add(handle);
        }
        return new CompletionOrder<>(copy);
    }

    @Override
    public Iterator<CompletionHandle<T>> iterator() {
        return this;
    }

    @Override
    public boolean hasNext() {
        return taken < total;
    }

    @Override
    public CompletionHandle<T> next() {
        if (!hasNext()) {
            throw new NoSuchElementException("all " + total + " handles already taken");
        }
        boolean interrupted = false;
        try {
            while (true) {
                try {
                    CompletionHandle<T> handle = completed.take();
                    taken++;
                    return handle;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * 남은 핸들 수.
     *
     * @return 아직 꺼내지 않은 핸들 수
     */
    public int remaining() {
        return total - taken;
    }
}
