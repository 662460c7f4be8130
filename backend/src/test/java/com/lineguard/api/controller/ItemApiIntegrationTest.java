package com.lineguard.api.controller;

import com.lineguard.common.TextNormalizer;
import com.lineguard.domain.CanonicalItem;
import com.lineguard.domain.CanonicalItemRepository;
import com.lineguard.domain.ItemType;
import com.lineguard.domain.PriceBand;
import com.lineguard.domain.PriceBandRepository;
import com.lineguard.domain.ProposalRepository;
import com.lineguard.proposal.SafetyScanProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Match, price validation, proposals and the safety scan over HTTP.
 */
@SpringBootTest
@AutoConfigureWebTestClient
@ActiveProfiles("test")
@Testcontainers
class ItemApiIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    WebTestClient webTestClient;
    @Autowired
    CanonicalItemRepository canonicalItemRepository;
    @Autowired
    PriceBandRepository priceBandRepository;
    @Autowired
    ProposalRepository proposalRepository;
    @Autowired
    SafetyScanProperties safetyScanProperties;

    String valveId;

    @BeforeEach
    void seed() {
        proposalRepository.deleteAll();
        priceBandRepository.deleteAll();
        canonicalItemRepository.deleteAll();

        CanonicalItem valve = new CanonicalItem();
        valve.setName("Brass Ball Valve 1/2in");
        valve.setNormalizedName(TextNormalizer.normalize("Brass Ball Valve 1/2in"));
        valve.setKind(ItemType.MATERIAL);
        valve.setCreatedAt(Instant.now());
        valveId = canonicalItemRepository.save(valve).getId();

        PriceBand band = new PriceBand();
        band.setCanonicalItemId(valveId);
        band.setCurrency("USD");
        band.setMinPrice(new BigDecimal("8"));
        band.setMaxPrice(new BigDecimal("12"));
        band.setCreatedAt(Instant.now());
        band.setUpdatedAt(Instant.now());
        priceBandRepository.save(band);
    }

    @Test
    @DisplayName("single match returns the canonical item, batch keeps order")
    void match() {
        webTestClient.post().uri("/api/v1/items/match")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"lineItemId\":\"L1\",\"itemName\":\"brass ball valve 1/2in\",\"forceMatcher\":true}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.lineItemId").isEqualTo("L1")
                .jsonPath("$.matchResult.canonicalItemId").isEqualTo(valveId)
                .jsonPath("$.status").isEqualTo("MATCHED");

        webTestClient.post().uri("/api/v1/items/match")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"items":[
                          {"lineItemId":"A","itemName":"unobtainium widget","forceMatcher":true},
                          {"lineItemId":"B","itemName":"Brass Ball Valve 1/2in","forceMatcher":true},
                          {"lineItemId":"C","itemName":"   "}
                        ]}
                        """)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.results[0].lineItemId").isEqualTo("A")
                .jsonPath("$.results[0].status").isEqualTo("AWAITING_INGEST")
                .jsonPath("$.results[1].status").isEqualTo("MATCHED")
                .jsonPath("$.results[2].success").isEqualTo(false)
                .jsonPath("$.summary.matched").isEqualTo(1)
                .jsonPath("$.summary.blocked").isEqualTo(1);
    }

    @Test
    @DisplayName("far outlier price raises a proposal that a human can approve once")
    void priceOutlierProposal() {
        webTestClient.post().uri("/api/v1/items/validate-price")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("""
                        {"items":[
                          {"lineItemId":"P1","canonicalItemId":"%s","unitPrice":10,"currency":"USD"},
                          {"lineItemId":"P2","canonicalItemId":"%s","unitPrice":40,"currency":"USD"}
                        ]}
                        """.formatted(valveId, valveId))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.results[0].isValid").isEqualTo(true)
                .jsonPath("$.results[1].isValid").isEqualTo(false)
                .jsonPath("$.results[1].validationResult.proposalId").exists()
                .jsonPath("$.summary.total").isEqualTo(2)
                .jsonPath("$.summary.passed").isEqualTo(1);

        String proposalId = proposalRepository.findAll().get(0).getId();

        webTestClient.get().uri("/api/v1/proposals?status=PENDING")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].id").isEqualTo(proposalId)
                .jsonPath("$[0].anomalyClass").isEqualTo("PRICE_OUTLIER");

        webTestClient.post().uri("/api/v1/proposals/" + proposalId + "/approve")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"note\":\"vendor raised prices\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("APPROVED")
                .jsonPath("$.applied").isEqualTo(false);

        webTestClient.post().uri("/api/v1/proposals/" + proposalId + "/deny")
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.error").isEqualTo("PROPOSAL_ALREADY_DECIDED");
    }

    @Test
    @DisplayName("invalid single price is a 400")
    void invalidPrice() {
        webTestClient.post().uri("/api/v1/items/validate-price")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"lineItemId\":\"P1\",\"canonicalItemId\":\"" + valveId + "\",\"unitPrice\":-5}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_PRICE");
    }

    @Test
    @DisplayName("safety scan reports issues and is unavailable when disabled")
    void safetyScan() {
        webTestClient.post().uri("/api/v1/safety-scan")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.issues.bands_fixed").isEqualTo(0)
                .jsonPath("$.issues.conflicts").isEqualTo(0)
                .jsonPath("$.scannedAt").exists();

        safetyScanProperties.setEnabled(false);
        try {
            webTestClient.post().uri("/api/v1/safety-scan")
                    .exchange()
                    .expectStatus().isEqualTo(503)
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("SAFETY_SCAN_DISABLED");
        } finally {
            safetyScanProperties.setEnabled(true);
        }
    }
}
