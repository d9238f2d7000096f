package tore.relay.service.queue;

/**
 * Reference to a job accepted by {@link RelayJobQueue#enqueue}.
 */
public record JobHandle(long id, String name) {
}
