package com.escrowmart.chain.service;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

/**
 * Settings of the optional on-chain escrow mirror, bound from {@code escrowmart.chain.*}.
 * The mirror stays off unless {@code enabled} is set and both the contract address and
 * the signing key are present.
 */
@Configuration
@ConfigurationProperties(prefix = "escrowmart.chain")
public class ChainProperties {

    private boolean enabled;
    private String nodeUrl = "http://localhost:8545";
    private String contractAddress;
    private String signingKey;
    /** Fraction digits kept when escrow amounts are sent as integer base units. */
    private int amountDecimals = 4;
    private final Gas gas = new Gas();

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getNodeUrl() { return nodeUrl; }
    public void setNodeUrl(String nodeUrl) { this.nodeUrl = nodeUrl; }
    public String getContractAddress() { return contractAddress; }
    public void setContractAddress(String contractAddress) { this.contractAddress = contractAddress; }
    public String getSigningKey() { return signingKey; }
    public void setSigningKey(String signingKey) { this.signingKey = signingKey; }
    public int getAmountDecimals() { return amountDecimals; }
    public void setAmountDecimals(int amountDecimals) { this.amountDecimals = amountDecimals; }
    public Gas getGas() { return gas; }

    boolean isConfigured() {
        return contractAddress != null && !contractAddress.isBlank()
                && signingKey != null && !signingKey.isBlank();
    }

    public static class Gas {
        private BigDecimal priceGwei = BigDecimal.valueOf(20);
        private long limit = 6_721_975L;

        public BigDecimal getPriceGwei() { return priceGwei; }
        public void setPriceGwei(BigDecimal priceGwei) { this.priceGwei = priceGwei; }
        public long getLimit() { return limit; }
        public void setLimit(long limit) { this.limit = limit; }
    }
}
