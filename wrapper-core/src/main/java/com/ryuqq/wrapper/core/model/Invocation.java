package com.ryuqq.wrapper.core.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 한 번의 호출에 전달되는 인자 묶음.
 *
 * <p>위치 인자(positional)와 이름 인자(keyword)를 함께 담으며,
 * Repeat/ThreadedRepeat는 같은 Invocation을 매 반복마다 그대로 전달합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가. 위치 인자에는 null 허용.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Invocation call = Invocation.of(1, 2).withKeyword("key", 3);
 * Object first = call.positional(0);  // 1
 * Object key = call.keyword("key");   // 3
 * }</pre>
 *
 * @author Wrapper Team
 * @since 1.0.0
 */
public final class Invocation {

    private static final Invocation EMPTY = new Invocation(List.of(), Map.of());

    private final List<Object> positional;
    private final Map<String, Object> keywords;

    private Invocation(List<Object> positional, Map<String, Object> keywords) {
        this.positional = positional;
        this.keywords = keywords;
    }

    /**
     * 인자가 없는 Invocation.
     *
     * @return 빈 Invocation
     */
    public static Invocation empty() {
        return EMPTY;
    }

    /**
     * 위치 인자만으로 Invocation 생성.
     *
     * @param args 위치 인자 (null 요소 허용)
     * @return Invocation 인스턴스
     * @throws IllegalArgumentException args 배열 자체가 null인 경우
     */
    public static Invocation of(Object... args) {
        if (args == null) {
            throw new IllegalArgumentException("args cannot be null");
        }
        if (args.length == 0) {
            return EMPTY;
        }
        return new Invocation(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(args))), Map.of());
    }

    /**
     * 위치 인자와 이름 인자로 Invocation 생성.
     *
     * @param positional 위치 인자
     * @param keywords 이름 인자 (순서 보존)
     * @return Invocation 인스턴스
     * @throws IllegalArgumentException 인자가 null이거나 keyword 이름이 blank인 경우
     */
    public static Invocation of(List<?> positional, Map<String, ?> keywords) {
        if (positional == null) {
            throw new IllegalArgumentException("positional cannot be null");
        }
        if (keywords == null) {
            throw new IllegalArgumentException("keywords cannot be null");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : keywords.entrySet()) {
            copy.put(requireName(entry.getKey()), entry.getValue());
        }
        return new Invocation(
            Collections.unmodifiableList(new ArrayList<>(positional)),
            Collections.unmodifiableMap(copy)
        );
    }

    /**
     * 데코레이터 인자와 호출 인자를 합성.
     *
     * <p>위치 인자는 decorator 인자 뒤에 call 인자를 이어 붙이고,
     * 이름 인자는 같은 이름일 때 call 쪽 값이 decorator 쪽 값을 덮어씁니다.</p>
     *
     * @param decoratorArgs 데코레이터 적용 시점의 인자
     * @param callArgs 호출 시점의 인자
     * @return 합성된 Invocation
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static Invocation merge(Invocation decoratorArgs, Invocation callArgs) {
        if (decoratorArgs == null) {
            throw new IllegalArgumentException("decoratorArgs cannot be null");
        }
        if (callArgs == null) {
            throw new IllegalArgumentException("callArgs cannot be null");
        }
        if (decoratorArgs.isEmpty()) {
            return callArgs;
        }
        List<Object> args = new ArrayList<>(decoratorArgs.positional);
        args.addAll(callArgs.positional);
        Map<String, Object> kwargs = new LinkedHashMap<>(decoratorArgs.keywords);
        kwargs.putAll(callArgs.keywords);
        return new Invocation(Collections.unmodifiableList(args), Collections.unmodifiableMap(kwargs));
    }

    /**
     * 이름 인자 하나를 추가(또는 교체)한 새 인스턴스 생성.
     *
     * @param name 인자 이름
     * @param value 인자 값 (null 허용)
     * @return 새 Invocation 인스턴스
     * @throws IllegalArgumentException name이 null이거나 blank인 경우
     */
    public Invocation withKeyword(String name, Object value) {
        Map<String, Object> kwargs = new LinkedHashMap<>(keywords);
        kwargs.put(requireName(name), value);
        return new Invocation(positional, Collections.unmodifiableMap(kwargs));
    }

    /**
     * i번째 위치 인자 조회.
     *
     * @param index 0부터 시작하는 인덱스
     * @return 인자 값 (null 가능)
     * @throws IndexOutOfBoundsException 범위를 벗어난 경우
     */
    public Object positional(int index) {
        return positional.get(index);
    }

    /**
     * i번째 위치 인자를 지정 타입으로 조회.
     *
     * @param index 0부터 시작하는 인덱스
     * @param type 기대 타입
     * @param <T> 기대 타입
     * @return 인자 값 (null 가능)
     * @throws ClassCastException 타입이 맞지 않는 경우
     */
    public <T> T positional(int index, Class<T> type) {
        return type.cast(positional.get(index));
    }

    /**
     * 이름 인자 조회.
     *
     * @param name 인자 이름
     * @return 인자 값, 없으면 null
     */
    public Object keyword(String name) {
        return keywords.get(name);
    }

    /**
     * 이름 인자를 지정 타입으로 조회.
     *
     * @param name 인자 이름
     * @param type 기대 타입
     * @param <T> 기대 타입
     * @return 인자 값, 없으면 null
     * @throws ClassCastException 타입이 맞지 않는 경우
     */
    public <T> T keyword(String name, Class<T> type) {
        return type.cast(keywords.get(name));
    }

    public boolean hasKeyword(String name) {
        return keywords.containsKey(name);
    }

    /**
     * 위치 인자 목록 (읽기 전용).
     *
     * @return 위치 인자
     */
    public List<Object> positionalArgs() {
        return positional;
    }

    /**
     * 이름 인자 맵 (읽기 전용, 삽입 순서 보존).
     *
     * @return 이름 인자
     */
    public Map<String, Object> keywordArgs() {
        return keywords;
    }

    public int size() {
        return positional.size();
    }

    public boolean isEmpty() {
        return positional.isEmpty() && keywords.isEmpty();
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("keyword name cannot be null or blank");
        }
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Invocation that = (Invocation) o;
        return positional.equals(that.positional) && keywords.equals(that.keywords);
    }

    @Override
    public int hashCode() {
        return 31 * positional.hashCode() + keywords.hashCode();
    }

    @Override
    public String toString() {
        return "Invocation{args=" + positional + ", kwargs=" + keywords + '}';
    }
}
