package com.ryuqq.broker.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 메시지에 담긴 업무 데이터.
 *
 * <p>Payload는 문자열 키와 JSON으로 표현 가능한 값(null, Boolean, Number, String,
 * 리스트, 중첩 맵)의 매핑입니다. 엔진은 Payload의 내용을 해석하거나 변환하지 않으며,
 * 직렬화 형식은 라우터 경계에서만 결정됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>Payload.of(Map.of("orderId", 123, "amount", 50000))</li>
 *   <li>빈 Payload: Payload.empty()</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 시 전달된 맵을 깊은 복사하여 수정 불가능한 형태로 보관합니다.
 * 게시자가 원본 맵을 수정해도, 소비자가 받은 맵을 수정하려 해도 엔진 상태에는 영향이 없습니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>맵 자체는 null 불가 (빈 맵 허용)</li>
 *   <li>키는 null 불가</li>
 *   <li>값은 JSON 표현 가능한 타입만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Payload {

    private static final Payload EMPTY = new Payload(Collections.emptyMap());

    private final Map<String, Object> value;

    private Payload(Map<String, Object> value) {
        this.value = value;
    }

    /**
     * Payload 생성.
     *
     * @param value 업무 데이터 (null 불가)
     * @return Payload 인스턴스
     * @throws IllegalArgumentException value가 null이거나 JSON으로 표현할 수 없는 값을 포함한 경우
     */
    public static Payload of(Map<String, ?> value) {
        if (value == null) {
            throw new IllegalArgumentException("Payload value cannot be null");
        }
        return new Payload(copyMap(value));
    }

    /**
     * 빈 Payload 생성.
     *
     * @return 빈 Payload 인스턴스
     */
    public static Payload empty() {
        return EMPTY;
    }

    /**
     * Payload 값 조회.
     *
     * @return 수정 불가능한 맵
     */
    public Map<String, Object> getValue() {
        return value;
    }

    /**
     * Payload가 비어있는지 확인.
     *
     * @return 비어있으면 true
     */
    public boolean isEmpty() {
        return value.isEmpty();
    }

    private static Map<String, Object> copyMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new IllegalArgumentException("Payload keys must be non-null strings, but was: " + entry.getKey());
            }
            copy.put(key, copyValue(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object copyValue(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            return copyMap(map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object element : collection) {
                copy.add(copyValue(element));
            }
            return Collections.unmodifiableList(copy);
        }
        throw new IllegalArgumentException("Unsupported payload value type: " + value.getClass().getName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return value.equals(payload.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Payload{" + value.size() + " fields}";
    }
}
