package tore.relay.service.backfill;

import tore.relay.service.chain.ContractBinding;
import tore.relay.service.event.EventDescriptor;

/**
 * One {@code eth_getLogs} query: a single event of a single contract over an inclusive block range.
 */
public record BackfillRange(ContractBinding binding, EventDescriptor event, long fromBlock, long toBlock) {

    @Override
    public String toString() {
        return binding.name() + "." + event.name() + " " + fromBlock + "-" + toBlock;
    }
}
