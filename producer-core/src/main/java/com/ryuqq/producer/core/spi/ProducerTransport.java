package com.ryuqq.producer.core.spi;

/**
 * Logging sink for producer traffic.
 *
 * <p>Side effect only; never influences control flow. Implementations must not throw.</p>
 *
 * <p><strong>Events:</strong></p>
 * <ul>
 *   <li>{@code info(tag, "[destination] > ", payload)} before every send attempt</li>
 *   <li>{@code info(tag, "[destination] < ", payload)} for every matched RPC reply</li>
 *   <li>{@code error(tag, err)} for every failed attempt, before the retry delay</li>
 * </ul>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public interface ProducerTransport {

    void info(String tag, String direction, Object payload);

    void error(String tag, Throwable error);
}
