package com.ryuqq.wrapper.core.function;

import com.ryuqq.wrapper.core.model.Invocation;

/**
 * 이름을 가진 Invocable.
 *
 * @param <R> 반환 타입
 * @author Wrapper Team
 * @since 1.0.0
 */
final class NamedInvocable<R> implements Invocable<R> {

    private final String name;
    private final Invocable<R> body;

    NamedInvocable(String name, Invocable<R> body) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        this.name = name;
        this.body = body;
    }

    @Override
    public R invoke(Invocation invocation) throws Exception {
        return body.invoke(invocation);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "Invocable{" + name + '}';
    }
}
