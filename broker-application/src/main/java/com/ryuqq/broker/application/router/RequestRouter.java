package com.ryuqq.broker.application.router;

import com.ryuqq.broker.core.delivery.ConsumeResult;
import com.ryuqq.broker.core.delivery.Delivered;
import com.ryuqq.broker.core.exception.BrokerException;
import com.ryuqq.broker.core.model.ChannelName;
import com.ryuqq.broker.core.model.ChannelStats;
import com.ryuqq.broker.core.model.MessageId;
import com.ryuqq.broker.core.model.Payload;
import com.ryuqq.broker.core.spi.ChannelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ChannelRegistry} 기반 {@link Broker} 구현체.
 *
 * <p>연산 이름을 {@link Operation}으로 해석하고, 요청 필드를 검증한 뒤 Registry 호출 결과를
 * {@link BrokerResponse}로 변환합니다. Registry 상태는 직접 다루지 않습니다.</p>
 *
 * <p><strong>오류 변환:</strong></p>
 * <ul>
 *   <li>{@link BrokerException}, {@link IllegalArgumentException}: WARN 로그 후 error 응답</li>
 *   <li>기타 RuntimeException: ERROR 로그 후 error 응답</li>
 * </ul>
 *
 * <p>"메시지 없음"과 "확인할 메시지 없음"은 오류가 아니며 {@code message} 필드로 응답합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RequestRouter implements Broker {

    private static final Logger log = LoggerFactory.getLogger(RequestRouter.class);

    static final String READY_MESSAGES = "ready_messages";
    static final String UNACKED_MESSAGES = "unacked_messages";
    static final String TOTAL = "total";

    private final ChannelRegistry registry;

    /**
     * 생성자.
     *
     * @param registry 요청을 처리할 Registry
     * @throws IllegalArgumentException registry가 null인 경우
     */
    public RequestRouter(ChannelRegistry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
    }

    @Override
    public BrokerResponse dispatch(String operationName, BrokerRequest request) {
        BrokerRequest effective = request != null ? request : BrokerRequest.empty();
        try {
            Operation operation = Operation.resolve(operationName)
                .orElseThrow(() -> new UnknownOperationException(operationName));
            return handle(operation, effective);
        } catch (UnknownOperationException e) {
            log.warn("Unknown operation requested: {}", e.getOperation());
            return BrokerResponse.ofError(e.getMessage());
        } catch (BrokerException e) {
            log.warn("Rejected {} request [{}]: {}", operationName, e.getErrorCode(), e.getMessage());
            return BrokerResponse.ofError(e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("Rejected {} request: {}", operationName, e.getMessage());
            return BrokerResponse.ofError(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure handling {} request", operationName, e);
            return BrokerResponse.ofError(describe(e));
        }
    }

    private BrokerResponse handle(Operation operation, BrokerRequest request) {
        return switch (operation) {
            case REGISTER -> register(request);
            case PUBLISH -> publish(request);
            case CONSUME -> consume(request);
            case ACKNOWLEDGE -> acknowledge(request);
            case PURGE -> purge(request);
            case STATS -> stats(request);
        };
    }

    private BrokerResponse register(BrokerRequest request) {
        ChannelName channel = request.requireChannel();
        registry.register(channel);
        return BrokerResponse.ofMessage("Channel " + channel + " successfully registered");
    }

    private BrokerResponse publish(BrokerRequest request) {
        ChannelName channel = request.requireChannel();
        Payload payload = request.requireData();
        MessageId id = registry.publish(channel, payload);
        return BrokerResponse.ofData(payload.getValue()).withMessageId(id.getValue());
    }

    private BrokerResponse consume(BrokerRequest request) {
        ChannelName channel = request.requireChannel();
        ConsumeResult result = registry.consume(channel);
        if (result instanceof Delivered delivered) {
            return BrokerResponse.ofData(delivered.message().payload().getValue())
                .withMessageId(delivered.message().id().getValue());
        }
        return BrokerResponse.ofMessage("No messages in channel " + channel);
    }

    private BrokerResponse acknowledge(BrokerRequest request) {
        ChannelName channel = request.requireChannel();
        String rawId = request.requireMessageIdValue();
        boolean confirmed;
        if (MessageId.isValid(rawId)) {
            confirmed = registry.acknowledge(channel, MessageId.of(rawId));
        } else {
            // no message can carry this id; the lookup still applies the missing-channel policy
            registry.stats(channel);
            confirmed = false;
        }
        String message = confirmed
            ? "Message confirmed"
            : "Message " + rawId + " does not exist in channel " + channel;
        return BrokerResponse.ofMessage(message).withMessageId(rawId);
    }

    private BrokerResponse purge(BrokerRequest request) {
        ChannelName channel = request.requireChannel();
        registry.purge(channel);
        return BrokerResponse.ofMessage("Channel " + channel + " purged");
    }

    private BrokerResponse stats(BrokerRequest request) {
        Optional<ChannelName> channel = request.optionalChannel();
        Map<String, Object> data = new LinkedHashMap<>();
        if (channel.isPresent()) {
            registry.stats(channel.get())
                .ifPresent(stats -> data.put(channel.get().getValue(), toView(stats)));
        } else {
            registry.stats().forEach((name, stats) -> data.put(name.getValue(), toView(stats)));
        }
        return BrokerResponse.ofData(data);
    }

    private static Map<String, Object> toView(ChannelStats stats) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put(READY_MESSAGES, stats.ready());
        view.put(UNACKED_MESSAGES, stats.unacked());
        view.put(TOTAL, stats.total());
        return view;
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
