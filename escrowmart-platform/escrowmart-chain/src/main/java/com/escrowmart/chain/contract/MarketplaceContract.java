package com.escrowmart.chain.contract;

import org.web3j.abi.datatypes.*;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.crypto.Credentials;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.RemoteFunctionCall;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.tx.Contract;
import org.web3j.tx.gas.ContractGasProvider;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;

/**
 * Web3j wrapper for the marketplace escrow contract.
 *
 * Mirrors escrow fills, releases and disputes recorded by the marketplace.
 * Principals and products are identified by bytes32-padded UUIDs.
 *
 * Solidity equivalent:
 * contract EscrowMart {
 *     struct Escrow {
 *         bytes32 supplier;
 *         bytes32 consumer;
 *         uint256 amount;
 *         EscrowStatus status;
 *     }
 *
 *     enum EscrowStatus { EMPTY, HELD, DISPUTED, RELEASED }
 *
 *     mapping(bytes32 => Escrow) escrows;
 *
 *     event ProductListed(bytes32 indexed productId, bytes32 indexed supplier, uint256 price);
 *     event EscrowLocked(bytes32 indexed productId, bytes32 indexed consumer, uint256 amount);
 *     event EscrowReleased(bytes32 indexed productId, bytes32 indexed recipient, uint256 amount);
 *     event DisputeRaised(bytes32 indexed productId, bytes32 indexed complaintId, string reason);
 *     event DisputeResolved(bytes32 indexed productId, bool forConsumer);
 * }
 */
public class MarketplaceContract extends Contract {

    /**
     * Compiled bytecode. Empty because the wrapper only loads an already deployed
     * contract through {@link #load}.
     */
    public static final String BINARY = "";

    public static final String FUNC_LISTPRODUCT = "listProduct";
    public static final String FUNC_LOCKESCROW = "lockEscrow";
    public static final String FUNC_RELEASEESCROW = "releaseEscrow";
    public static final String FUNC_RAISEDISPUTE = "raiseDispute";
    public static final String FUNC_RESOLVEDISPUTE = "resolveDispute";

    protected MarketplaceContract(String contractAddress, Web3j web3j, Credentials credentials,
                                  ContractGasProvider gasProvider) {
        super(BINARY, contractAddress, web3j, credentials, gasProvider);
    }

    public RemoteFunctionCall<TransactionReceipt> listProduct(byte[] productId, byte[] supplier, BigInteger price) {
        return transact(FUNC_LISTPRODUCT, new Bytes32(productId), new Bytes32(supplier), new Uint256(price));
    }

    /**
     * Locks the full payment for the chosen consumer.
     */
    public RemoteFunctionCall<TransactionReceipt> lockEscrow(byte[] productId, byte[] consumer, BigInteger amount) {
        return transact(FUNC_LOCKESCROW, new Bytes32(productId), new Bytes32(consumer), new Uint256(amount));
    }

    /**
     * Releases the whole escrow to a recipient. The contract reverts on a second release.
     */
    public RemoteFunctionCall<TransactionReceipt> releaseEscrow(byte[] productId, byte[] recipient, BigInteger amount) {
        return transact(FUNC_RELEASEESCROW, new Bytes32(productId), new Bytes32(recipient), new Uint256(amount));
    }

    public RemoteFunctionCall<TransactionReceipt> raiseDispute(byte[] productId, byte[] complaintId, String reason) {
        return transact(FUNC_RAISEDISPUTE, new Bytes32(productId), new Bytes32(complaintId), new Utf8String(reason));
    }

    public RemoteFunctionCall<TransactionReceipt> resolveDispute(byte[] productId, boolean forConsumer) {
        return transact(FUNC_RESOLVEDISPUTE, new Bytes32(productId), new Bool(forConsumer));
    }

    @SuppressWarnings("rawtypes")
    private RemoteFunctionCall<TransactionReceipt> transact(String name, Type... arguments) {
        return executeRemoteCallTransaction(new Function(name, Arrays.asList(arguments), Collections.emptyList()));
    }

    public static MarketplaceContract load(String contractAddress, Web3j web3j,
                                           Credentials credentials, ContractGasProvider gasProvider) {
        return new MarketplaceContract(contractAddress, web3j, credentials, gasProvider);
    }
}
