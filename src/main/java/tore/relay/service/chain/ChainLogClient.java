package tore.relay.service.chain;

import io.reactivex.Flowable;
import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.EthFilter;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthLog;
import org.web3j.protocol.core.methods.response.Log;
import tore.relay.exception.ChainConnectionException;

/**
 * Thin wrapper around the web3j calls the relay needs, translating transport and RPC errors into
 * {@link ChainConnectionException}.
 */
@Slf4j
public class ChainLogClient {

    private final Web3j web3j;

    public ChainLogClient(Web3j web3j) {
        this.web3j = web3j;
    }

    public long currentBlockNumber() {
        EthBlockNumber response;
        try {
            response = web3j.ethBlockNumber().send();
        } catch (IOException | RuntimeException e) {
            throw new ChainConnectionException("eth_blockNumber", "Cannot read current block: " + e.getMessage(), e);
        }
        if (response.hasError()) {
            throw new ChainConnectionException("eth_blockNumber", response.getError().getMessage());
        }
        try {
            return response.getBlockNumber().longValueExact();
        } catch (RuntimeException e) {
            // out of long range or not a hex quantity
            throw new ChainConnectionException("eth_blockNumber", "Malformed block number: " + e.getMessage(), e);
        }
    }

    /**
     * Historical logs of one contract and topic over the inclusive range {@code [fromBlock, toBlock]}.
     */
    public List<Log> getLogs(String contractAddress, String topic, long fromBlock, long toBlock) {
        EthFilter filter = new EthFilter(
            DefaultBlockParameter.valueOf(BigInteger.valueOf(fromBlock)),
            DefaultBlockParameter.valueOf(BigInteger.valueOf(toBlock)),
            contractAddress
        );
        filter.addSingleTopic(topic);

        EthLog ethLog;
        try {
            ethLog = web3j.ethGetLogs(filter).send();
        } catch (IOException | RuntimeException e) {
            throw new ChainConnectionException("eth_getLogs", "Cannot query logs " + fromBlock + "-" + toBlock + ": " + e.getMessage(), e);
        }
        if (ethLog.hasError()) {
            throw new ChainConnectionException("eth_getLogs", ethLog.getError().getMessage());
        }

        List<Log> logs = new ArrayList<>();
        List<EthLog.LogResult> results = ethLog.getLogs();
        if (results == null) {
            return logs;
        }
        for (EthLog.LogResult<?> result : results) {
            if (result instanceof EthLog.LogObject logObject) {
                logs.add(logObject.get());
            } else {
                log.debug("Ignoring non-object log result {}", result.get());
            }
        }
        return logs;
    }

    /**
     * Stream of new logs of one contract and topic, starting at the chain head.
     * Removed logs are delivered too, flagged with {@link Log#isRemoved()}.
     */
    public Flowable<Log> logFlowable(String contractAddress, String topic) {
        EthFilter filter = new EthFilter(
            DefaultBlockParameterName.LATEST,
            DefaultBlockParameterName.LATEST,
            contractAddress
        );
        filter.addSingleTopic(topic);
        return web3j.ethLogFlowable(filter);
    }

    public void shutdown() {
        try {
            web3j.shutdown();
        } catch (RuntimeException e) {
            log.warn("Error shutting down chain connection: {}", e.getMessage());
        }
    }

    public Web3j getWeb3j() {
        return web3j;
    }
}
