package tore.relay.service.queue;

public enum JobStatus {
    WAITING,
    ACTIVE,
    COMPLETED,
    FAILED
}
