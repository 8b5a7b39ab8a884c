package com.escrowmart.api.product;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.escrowmart.api.capability.CapabilityController;
import com.escrowmart.api.dispute.ComplaintController;
import com.escrowmart.api.error.GlobalExceptionHandler;
import com.escrowmart.api.settlement.SettlementController;
import com.escrowmart.api.support.MarketplaceFixture;
import com.escrowmart.api.support.MutableClock;
import com.jayway.jsonpath.JsonPath;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
  * REST round trips over in-memory repositories, including the error-code to HTTP status mapping.
  */
class ProductControllerTest {

    private static final String PRINCIPAL = "X-Principal-ID";

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
    private final UUID supplier = UUID.randomUUID();
    private final UUID consumer = UUID.randomUUID();
    private final UUID admin = UUID.randomUUID();

    private MarketplaceFixture market;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        market = new MarketplaceFixture();
        mockMvc =
                MockMvcBuilders.standaloneSetup(
                                new ProductController(market.lifecycleService, market.disputeService, clock),
                                new ComplaintController(market.disputeService, clock),
                                new SettlementController(market.settlementService),
                                new CapabilityController(market.capabilityService, clock))
                        .setControllerAdvice(new GlobalExceptionHandler())
                        .build();
    }

    // --- Happy path ---

    @Test
    void listBidChooseSubmitConfirm() throws Exception {
        var listing = listProduct(90, "100", 3600);
        var productId = JsonPath.<String>read(listing, "$.product.id");
        var capId = JsonPath.<String>read(listing, "$.productCapId");

        placeBid(productId, consumer, "[\"high_quality\"]")
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.requirements[0]").value("high_quality"));

        mockMvc
                .perform(
                        post("/api/v1/products/" + productId + "/choose")
                                .header(PRINCIPAL, supplier)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(chooseBody(capId, consumer, "120")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.chosenBid.bidderId").value(consumer.toString()))
                .andExpect(jsonPath("$.product.consumerId").value(consumer.toString()));

        mockMvc
                .perform(post("/api/v1/products/" + productId + "/submit").header(PRINCIPAL, consumer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.orderSubmitted").value(true));

        mockMvc
                .perform(
                        post("/api/v1/products/" + productId + "/confirm")
                                .header(PRINCIPAL, supplier)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"productCapId\":\"" + capId + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recipientId").value(consumer.toString()))
                .andExpect(jsonPath("$.amount").value(120))
                .andExpect(jsonPath("$.reason").value("ORDER_CONFIRMED"));
    }

    @Test
    void escrowAndCapabilityLookups() throws Exception {
        var listing = listProduct(50, "100", 3600);
        var productId = JsonPath.<String>read(listing, "$.product.id");
        var capId = JsonPath.<String>read(listing, "$.productCapId");
        placeBid(productId, consumer, "[]").andExpect(status().isCreated());
        mockMvc
                .perform(
                        post("/api/v1/products/" + productId + "/choose")
                                .header(PRINCIPAL, supplier)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(chooseBody(capId, consumer, "120")))
                .andExpect(status().isOk());

        mockMvc
                .perform(get("/api/v1/settlement/products/" + productId + "/escrow"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.productId").value(productId))
                .andExpect(jsonPath("$.held").value(120))
                .andExpect(jsonPath("$.currency").value("USD"));

        mockMvc
                .perform(get("/api/v1/capabilities/product").param("productId", productId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.capabilityId").value(capId))
                .andExpect(jsonPath("$.holderId").value(supplier.toString()));

        mockMvc
                .perform(get("/api/v1/capabilities/product").param("productId", UUID.randomUUID().toString()))
                .andExpect(status().isNotFound());
    }

    // --- Error mapping ---

    @Test
    void wrongCapabilityHolder_isForbidden() throws Exception {
        var listing = listProduct(50, "10", 3600);
        var productId = JsonPath.<String>read(listing, "$.product.id");
        var capId = JsonPath.<String>read(listing, "$.productCapId");
        placeBid(productId, consumer, "[]").andExpect(status().isCreated());

        mockMvc
                .perform(
                        post("/api/v1/products/" + productId + "/choose")
                                .header(PRINCIPAL, consumer)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(chooseBody(capId, consumer, "10")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("INVALID_CAPABILITY"))
                .andExpect(jsonPath("$.code").value(4));
    }

    @Test
    void unmetRequirement_isUnprocessable() throws Exception {
        var listing = listProduct(79, "10", 3600);
        var productId = JsonPath.<String>read(listing, "$.product.id");

        placeBid(productId, consumer, "[\"high_quality\"]")
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("REQUIREMENTS_NOT_MET"))
                .andExpect(jsonPath("$.category").value("VALUE"));
    }

    @Test
    void duplicateBid_isConflict() throws Exception {
        var productId = JsonPath.<String>read(listProduct(50, "10", 3600), "$.product.id");
        placeBid(productId, consumer, "[]").andExpect(status().isCreated());

        placeBid(productId, consumer, "[]")
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("DUPLICATE_BID"));
    }

    @Test
    void complaintBeforeDeadline_isConflict() throws Exception {
        var listing = listProduct(50, "10", 3600);
        var productId = JsonPath.<String>read(listing, "$.product.id");
        var capId = JsonPath.<String>read(listing, "$.productCapId");
        placeBid(productId, consumer, "[]");
        mockMvc.perform(
                post("/api/v1/products/" + productId + "/choose")
                        .header(PRINCIPAL, supplier)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(chooseBody(capId, consumer, "10")));

        fileComplaint(productId, consumer)
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("DEADLINE_NOT_REACHED"));
    }

    @Test
    void unknownProduct_isNotFound() throws Exception {
        mockMvc
                .perform(get("/api/v1/products/" + UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NO_SUCH_PRODUCT"));
    }

    @Test
    void missingPrincipalHeader_isBadRequest() throws Exception {
        mockMvc
                .perform(
                        post("/api/v1/products")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(listBody(50, "10", 3600)))
                .andExpect(status().isBadRequest());
    }

    @Test
    void nonPositivePrice_failsValidation() throws Exception {
        mockMvc
                .perform(
                        post("/api/v1/products")
                                .header(PRINCIPAL, supplier)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(listBody(50, "0", 3600)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"));
    }

    @Test
    void missingQuality_failsValidation() throws Exception {
        mockMvc
                .perform(
                        post("/api/v1/products")
                                .header(PRINCIPAL, supplier)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"description\":\"lamp\",\"price\":10,\"durationSeconds\":3600}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"));

        mockMvc
                .perform(get("/api/v1/products").param("supplierId", supplier.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }

    @Test
    void durationPastInstantRange_isInvalidListing() throws Exception {
        mockMvc
                .perform(
                        post("/api/v1/products")
                                .header(PRINCIPAL, supplier)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(listBody(50, "10", Long.MAX_VALUE)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("INVALID_LISTING"));
    }

    // --- Dispute over REST ---

    @Test
    void complaintResolvedForSupplier() throws Exception {
        var adminCap = market.capabilityService.mintAdminCap(admin, clock.instant());
        var listing = listProduct(50, "10", 60);
        var productId = JsonPath.<String>read(listing, "$.product.id");
        var capId = JsonPath.<String>read(listing, "$.productCapId");
        placeBid(productId, consumer, "[]");
        mockMvc.perform(
                post("/api/v1/products/" + productId + "/choose")
                        .header(PRINCIPAL, supplier)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(chooseBody(capId, consumer, "15")));
        clock.advance(Duration.ofSeconds(61));

        var complaint =
                fileComplaint(productId, supplier)
                        .andExpect(status().isCreated())
                        .andReturn()
                        .getResponse()
                        .getContentAsString();
        var complaintId = JsonPath.<String>read(complaint, "$.id");

        var resolveBody =
                "{\"adminCapId\":\"" + adminCap.getId() + "\",\"outcome\":\"SUPPLIER\"}";
        mockMvc
                .perform(
                        post("/api/v1/complaints/" + complaintId + "/resolve")
                                .header(PRINCIPAL, consumer)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(resolveBody))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("NOT_ADMIN"));

        mockMvc
                .perform(
                        post("/api/v1/complaints/" + complaintId + "/resolve")
                                .header(PRINCIPAL, admin)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(resolveBody))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.release.recipientId").value(supplier.toString()))
                .andExpect(jsonPath("$.complaint.resolved").value(true));

        mockMvc
                .perform(
                        post("/api/v1/complaints/" + complaintId + "/resolve")
                                .header(PRINCIPAL, admin)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(resolveBody))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("DISPUTE_FALSE"));
    }

    private String listProduct(int quality, String price, long durationSeconds) throws Exception {
        return mockMvc
                .perform(
                        post("/api/v1/products")
                                .header(PRINCIPAL, supplier)
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(listBody(quality, price, durationSeconds)))
                .andExpect(status().isCreated())
                .andReturn()
                .getResponse()
                .getContentAsString();
    }

    private ResultActions placeBid(
            String productId, UUID bidder, String requirementsJson) throws Exception {
        return mockMvc.perform(
                post("/api/v1/products/" + productId + "/bids")
                        .header(PRINCIPAL, bidder)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"description\":\"bid\",\"requirements\":" + requirementsJson + "}"));
    }

    private ResultActions fileComplaint(
            String productId, UUID caller) throws Exception {
        return mockMvc.perform(
                post("/api/v1/products/" + productId + "/complaints")
                        .header(PRINCIPAL, caller)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"not delivered\"}"));
    }

    private static String listBody(int quality, String price, long durationSeconds) {
        return "{\"description\":\"lamp\",\"quality\":"
                + quality
                + ",\"price\":"
                + price
                + ",\"durationSeconds\":"
                + durationSeconds
                + "}";
    }

    private static String chooseBody(String capId, UUID consumerId, String payment) {
        return "{\"productCapId\":\""
                + capId
                + "\",\"consumerId\":\""
                + consumerId
                + "\",\"payment\":"
                + payment
                + "}";
    }
}
