package com.ryuqq.wrapper.core.function;

import com.ryuqq.wrapper.core.model.Invocation;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Invocable 팩토리 및 기본 메서드 테스트.
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
class InvocableTest {

    @Test
    void named_ValidName_ExposesNameAndDelegates() throws Exception {
        // Given
        Invocable<Integer> add = Invocable.named("add",
            call -> call.positional(0, Integer.class) + call.positional(1, Integer.class));

        // When
        Integer result = add.call(2, 3);

        // Then
        assertEquals("add", add.name());
        assertEquals(5, result);
    }

    @Test
    void named_BlankName_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Invocable.named(" ", call -> 1));
    }

    @Test
    void named_NullBody_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> Invocable.named("f", null));
    }

    @Test
    void invoke_NoArgs_UsesEmptyInvocation() throws Exception {
        // Given
        Invocable<Integer> size = Invocable.named("size", Invocation::size);

        // When & Then
        assertEquals(0, size.invoke());
    }

    @Test
    void ofSupplier_Invoked_ReturnsSuppliedValue() throws Exception {
        Invocable<String> hello = Invocable.ofSupplier("hello", () -> "hi");

        assertEquals("hi", hello.invoke());
        assertEquals("hello", hello.name());
    }

    @Test
    void ofFunction_FirstPositional_AppliedToFunction() throws Exception {
        Invocable<Integer> length = Invocable.ofFunction("length", String.class, String::length);

        assertEquals(5, length.call("hello"));
    }

    @Test
    void name_Lambda_DefaultsToClassSimpleName() {
        Invocable<Integer> anonymous = call -> 1;

        assertNotNull(anonymous.name());
    }
}
