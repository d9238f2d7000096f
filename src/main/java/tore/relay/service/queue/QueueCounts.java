package tore.relay.service.queue;

public record QueueCounts(long waiting, long active, long completed, long failed) {

    public long total() {
        return waiting + active + completed + failed;
    }
}
