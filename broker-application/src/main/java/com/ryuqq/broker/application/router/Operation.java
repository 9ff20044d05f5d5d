package com.ryuqq.broker.application.router;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 라우터가 처리하는 Broker 연산.
 *
 * <p>각 연산은 하나 이상의 이름(alias)으로 호출됩니다. 이름은 대소문자를 구분하지 않으며,
 * 경로 형태의 앞쪽 {@code "/"} 하나는 무시합니다 ({@code "/send"} == {@code "send"}).</p>
 *
 * <table>
 *   <caption>연산별 이름</caption>
 *   <tr><th>연산</th><th>이름</th></tr>
 *   <tr><td>REGISTER</td><td>register</td></tr>
 *   <tr><td>PUBLISH</td><td>send, publish</td></tr>
 *   <tr><td>CONSUME</td><td>read, consume</td></tr>
 *   <tr><td>ACKNOWLEDGE</td><td>confirm, acknowledge</td></tr>
 *   <tr><td>PURGE</td><td>purge</td></tr>
 *   <tr><td>STATS</td><td>stats</td></tr>
 * </table>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum Operation {

    REGISTER("register"),
    PUBLISH("send", "publish"),
    CONSUME("read", "consume"),
    ACKNOWLEDGE("confirm", "acknowledge"),
    PURGE("purge"),
    STATS("stats");

    private static final Map<String, Operation> BY_NAME;

    static {
        Map<String, Operation> byName = new HashMap<>();
        for (Operation operation : values()) {
            for (String alias : operation.aliases) {
                byName.put(alias, operation);
            }
        }
        BY_NAME = Collections.unmodifiableMap(byName);
    }

    private final List<String> aliases;

    Operation(String... aliases) {
        this.aliases = List.of(aliases);
    }

    /**
     * 이 연산을 호출하는 이름 목록.
     *
     * @return 소문자 이름 목록 (첫 번째가 대표 이름)
     */
    public List<String> aliases() {
        return aliases;
    }

    /**
     * 이름으로 연산 조회.
     *
     * @param name 연산 이름 (null 허용)
     * @return 일치하는 연산, 없으면 empty
     */
    public static Optional<Operation> resolve(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String key = name.strip();
        if (key.startsWith("/")) {
            key = key.substring(1);
        }
        return Optional.ofNullable(BY_NAME.get(key.toLowerCase(Locale.ROOT)));
    }
}
