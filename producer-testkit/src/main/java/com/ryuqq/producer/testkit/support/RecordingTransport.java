package com.ryuqq.producer.testkit.support;

import com.ryuqq.producer.core.spi.ProducerTransport;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link ProducerTransport} that records every call for assertions.
 *
 * <p>Thread-safe: the producer logs from worker threads and reply dispatch logs from the
 * broker's consumer thread.</p>
 *
 * @author Producer Team
 * @since 1.0.0
 */
public class RecordingTransport implements ProducerTransport {

    /**
     * One {@code info} call.
     *
     * @param tag log tag
     * @param direction {@code "[dest] > "} or {@code "[dest] < "}
     * @param payload logged payload
     */
    public record InfoEvent(String tag, String direction, Object payload) {

        public boolean isOutbound() {
            return direction.endsWith("> ");
        }

        public boolean isInbound() {
            return direction.endsWith("< ");
        }
    }

    /**
     * One {@code error} call.
     *
     * @param tag log tag
     * @param error logged failure
     */
    public record ErrorEvent(String tag, Throwable error) {
    }

    private final List<InfoEvent> infos = new CopyOnWriteArrayList<>();
    private final List<ErrorEvent> errors = new CopyOnWriteArrayList<>();

    @Override
    public void info(String tag, String direction, Object payload) {
        infos.add(new InfoEvent(tag, direction, payload));
    }

    @Override
    public void error(String tag, Throwable error) {
        errors.add(new ErrorEvent(tag, error));
    }

    public List<InfoEvent> infos() {
        return List.copyOf(infos);
    }

    public List<ErrorEvent> errors() {
        return List.copyOf(errors);
    }

    /**
     * Payloads logged before sending to a destination.
     *
     * @param destination destination name
     * @return payloads in logging order
     */
    public List<Object> outbound(String destination) {
        return payloads("[" + destination + "] > ");
    }

    /**
     * Reply payloads logged on dispatch for a destination.
     *
     * @param destination destination name
     * @return payloads in logging order
     */
    public List<Object> inbound(String destination) {
        return payloads("[" + destination + "] < ");
    }

    private List<Object> payloads(String direction) {
        return infos.stream()
            .filter(event -> event.direction().equals(direction))
            .map(InfoEvent::payload)
            .toList();
    }
}
