package com.escrowmart.chain.service;

import com.escrowmart.chain.contract.MarketplaceContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.RemoteFunctionCall;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.gas.StaticGasProvider;
import org.web3j.utils.Convert;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.HexFormat;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * Mirrors escrow transitions onto the marketplace contract.
 *
 * The database stays authoritative. Every call returns empty when the mirror is
 * disabled or the transaction fails, and failures are logged rather than propagated.
 */
@Service
public class ChainEscrowMirror {

    private static final Logger log = LoggerFactory.getLogger(ChainEscrowMirror.class);

    private final ChainProperties properties;
    private final MarketplaceContract contract;

    public ChainEscrowMirror(ChainProperties properties) {
        this.properties = properties;
        this.contract = properties.isEnabled() ? connect(properties) : null;
    }

    private static MarketplaceContract connect(ChainProperties properties) {
        if (!properties.isConfigured()) {
            log.warn("Chain mirror enabled without contract address or signing key; mirroring is off");
            return null;
        }
        try {
            Web3j web3j = Web3j.build(new HttpService(properties.getNodeUrl()));
            BigInteger gasPrice = Convert.toWei(properties.getGas().getPriceGwei(), Convert.Unit.GWEI).toBigInteger();
            MarketplaceContract contract = MarketplaceContract.load(
                    properties.getContractAddress(),
                    web3j,
                    Credentials.create(properties.getSigningKey()),
                    new StaticGasProvider(gasPrice, BigInteger.valueOf(properties.getGas().getLimit())));
            log.info("Mirroring escrow to marketplace contract at {}", properties.getContractAddress());
            return contract;
        } catch (RuntimeException e) {
            log.error("Failed to connect to marketplace contract; mirroring is off", e);
            return null;
        }
    }

    public Optional<ChainTxResult> productListed(UUID productId, UUID supplierId, BigDecimal price) {
        return submit("list product", productId,
                c -> c.listProduct(uuidToBytes32(productId), uuidToBytes32(supplierId), toBaseUnits(price)));
    }

    public Optional<ChainTxResult> escrowLocked(UUID productId, UUID consumerId, BigDecimal amount) {
        return submit("lock escrow", productId,
                c -> c.lockEscrow(uuidToBytes32(productId), uuidToBytes32(consumerId), toBaseUnits(amount)));
    }

    public Optional<ChainTxResult> escrowReleased(UUID productId, UUID recipientId, BigDecimal amount) {
        return submit("release escrow", productId,
                c -> c.releaseEscrow(uuidToBytes32(productId), uuidToBytes32(recipientId), toBaseUnits(amount)));
    }

    public Optional<ChainTxResult> disputeRaised(UUID productId, UUID complaintId, String reason) {
        return submit("raise dispute", productId,
                c -> c.raiseDispute(uuidToBytes32(productId), uuidToBytes32(complaintId), reason == null ? "" : reason));
    }

    public Optional<ChainTxResult> disputeResolved(UUID productId, boolean forConsumer) {
        return submit("resolve dispute", productId,
                c -> c.resolveDispute(uuidToBytes32(productId), forConsumer));
    }

    public boolean isEnabled() {
        return contract != null;
    }

    private Optional<ChainTxResult> submit(String action, UUID productId,
                                           Function<MarketplaceContract, RemoteFunctionCall<TransactionReceipt>> call) {
        if (!isEnabled()) {
            return Optional.empty();
        }
        try {
            TransactionReceipt receipt = call.apply(contract).send();
            return Optional.of(new ChainTxResult(
                    receipt.getTransactionHash(),
                    receipt.getBlockNumber(),
                    receipt.isStatusOK()
            ));
        } catch (Exception e) {
            log.error("Failed to {} on chain for product {}", action, productId, e);
            return Optional.empty();
        }
    }

    BigInteger toBaseUnits(BigDecimal amount) {
        return amount.setScale(properties.getAmountDecimals(), RoundingMode.DOWN).unscaledValue();
    }

    static byte[] uuidToBytes32(UUID uuid) {
        String hex = uuid.toString().replace("-", "");
        byte[] bytes = new byte[32];
        byte[] uuidBytes = HexFormat.of().parseHex(hex);
        System.arraycopy(uuidBytes, 0, bytes, 16, 16);
        return bytes;
    }

    public record ChainTxResult(String txHash, BigInteger blockNumber, boolean success) {}
}
