package tore.relay.service.lifecycle;

import java.util.List;
import tore.relay.service.backfill.BackfillResult;
import tore.relay.service.chain.ChainLogClient;
import tore.relay.service.chain.ContractBinding;
import tore.relay.service.queue.RelayJobQueue;
import tore.relay.service.subscription.LiveEventSubscriber;

/**
 * Resources owned by one initialized listener: the chain connection, the bound contracts, the
 * queue handle and the live subscriber.
 *
 * @param startupBackfill result of the backfill run during initialization
 * @param syncedToBlock   chain height the checkpoint was advanced to during initialization
 */
public record ListenerResourceBundle(
    ChainLogClient connection,
    List<ContractBinding> contractBindings,
    RelayJobQueue queue,
    LiveEventSubscriber subscriber,
    BackfillResult startupBackfill,
    long syncedToBlock,
    Runnable cleanupAction
) {

    public ListenerResourceBundle {
        contractBindings = List.copyOf(contractBindings);
    }

    /**
     * Unsubscribes, closes the connection and forgets this bundle so the next initialization
     * starts from scratch.
     */
    public void cleanup() {
        cleanupAction.run();
    }
}
