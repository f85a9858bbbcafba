package com.ryuqq.halfling.core.comprehension;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 이름으로 조회하는 중간 결과 모음 (불변).
 *
 * <p>{@link TaskComprehension}의 각 binding 표현식과 body는 앞선 binding들의 값을 이 객체로 받습니다.
 * 같은 이름을 다시 binding하면 이후 표현식에서는 새 값이 보입니다.</p>
 *
 * @author Halfling Team
 * @since 1.0.0
 */
public final class Bindings {

    private static final Bindings EMPTY = new Bindings(Map.of());

    private final Map<String, Object> values;

    private Bindings(Map<String, Object> values) {
        this.values = values;
    }

    static Bindings empty() {
        return EMPTY;
    }

    Bindings with(String name, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(values);
        next.put(name, value);
        return new Bindings(Collections.unmodifiableMap(next));
    }

    /**
     * binding 값 조회.
     *
     * @param name binding 이름
     * @param <T> 기대하는 값 타입
     * @return binding 값 (null 가능)
     * @throws IllegalArgumentException name에 해당하는 binding이 없는 경우
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String name) {
        if (!values.containsKey(name)) {
            throw new IllegalArgumentException("No binding named '" + name + "' (bound: " + values.keySet() + ")");
        }
        return (T) values.get(name);
    }

    /**
     * binding 존재 여부.
     *
     * @param name binding 이름
     * @return 존재하면 true
     */
    public boolean contains(String name) {
        return values.containsKey(name);
    }

    /**
     * binding 이름 목록 (binding 순서).
     *
     * @return 이름 집합
     */
    public Set<String> names() {
        return values.keySet();
    }

    @Override
    public String toString() {
        return "Bindings" + values;
    }
}
