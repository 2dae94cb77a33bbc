package com.ryuqq.producer.runtime.transport;

import com.ryuqq.producer.core.spi.ProducerTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SLF4J로 기록하는 기본 {@link ProducerTransport}.
 *
 * <p>송신/수신 payload는 INFO, 시도 실패는 ERROR (stack trace 포함)로 남깁니다.</p>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public final class Slf4jProducerTransport implements ProducerTransport {

    private final Logger log;

    public Slf4jProducerTransport() {
        this(LoggerFactory.getLogger(Slf4jProducerTransport.class));
    }

    Slf4jProducerTransport(Logger log) {
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        this.log = log;
    }

    @Override
    public void info(String tag, String direction, Object payload) {
        log.info("{} {}{}", tag, direction, payload);
    }

    @Override
    public void error(String tag, Throwable error) {
        log.error("{} {}", tag, error == null ? "unknown error" : error.getMessage(), error);
    }
}
