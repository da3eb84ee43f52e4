package com.zecinsight.api.controller;

import com.zecinsight.domain.BenchmarkRepository;
import com.zecinsight.domain.PrivacyAuditEntryRepository;
import com.zecinsight.domain.PrivacyMode;
import com.zecinsight.domain.Project;
import com.zecinsight.domain.ProjectRepository;
import com.zecinsight.domain.Wallet;
import com.zecinsight.domain.WalletRepository;
import com.zecinsight.domain.WalletType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "zecinsight.indexer.resync-enabled=false",
        "zecinsight.tasks.monitoring-enabled=false"
})
@AutoConfigureWebTestClient
@Testcontainers
class BenchmarkAndPrivacyIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    WebTestClient webTestClient;
    @Autowired
    BenchmarkRepository benchmarkRepository;
    @Autowired
    ProjectRepository projectRepository;
    @Autowired
    WalletRepository walletRepository;
    @Autowired
    PrivacyAuditEntryRepository auditRepository;

    private String walletId;

    @BeforeEach
    void setUp() {
        benchmarkRepository.deleteAll();
        walletRepository.deleteAll();
        projectRepository.deleteAll();
        auditRepository.deleteAll();

        Project project = new Project();
        project.setUserId("owner-1");
        project.setName("Shield Swap");
        project.setCategory("defi");
        project = projectRepository.save(project);

        Wallet wallet = new Wallet();
        wallet.setProjectId(project.getId());
        wallet.setType(WalletType.SHIELDED);
        walletId = walletRepository.save(wallet).getId();
    }

    @Test
    @DisplayName("POST /benchmarks stores a snapshot that GET returns as latest")
    void storeThenGetLatest() {
        String body = """
                {"benchmark_type":"productivity","category":"defi","p25":40,"p50":55,"p75":68,"p90":82,
                 "sample_size":120,"as_of_date":"2025-03-01"}
                """;
        webTestClient.post().uri("/api/v1/benchmarks")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.data.p50").isEqualTo(55.0);

        webTestClient.get().uri("/api/v1/benchmarks/defi/productivity")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.sample_size").isEqualTo(120)
                .jsonPath("$.data.as_of_date").isEqualTo("2025-03-01");
    }

    @Test
    @DisplayName("POST /benchmarks with decreasing percentiles returns 400")
    void storeDecreasingPercentiles() {
        String body = """
                {"benchmark_type":"productivity","category":"defi","p25":60,"p50":55,"p75":68,"p90":82,"sample_size":1}
                """;
        webTestClient.post().uri("/api/v1/benchmarks")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.error").isEqualTo("VALIDATION_ERROR");
        assertThat(benchmarkRepository.count()).isZero();
    }

    @Test
    @DisplayName("GET latest benchmark for an unknown type returns 404")
    void getLatestMissing() {
        webTestClient.get().uri("/api/v1/benchmarks/defi/retention")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("NOT_FOUND");
    }

    @Test
    @DisplayName("owner changes privacy mode and the change is audited")
    void ownerSetsPrivacyMode() {
        webTestClient.put().uri("/api/v1/privacy/wallets/{id}", walletId)
                .header("X-User-Id", "owner-1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"privacy_mode\":\"public\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data.privacy_mode").isEqualTo("public");

        assertThat(walletRepository.findById(walletId)).get()
                .extracting(Wallet::getPrivacyMode).isEqualTo(PrivacyMode.PUBLIC);
        assertThat(auditRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("non-owner cannot change privacy mode")
    void nonOwnerDenied() {
        webTestClient.put().uri("/api/v1/privacy/wallets/{id}", walletId)
                .header("X-User-Id", "someone-else")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"privacy_mode\":\"monetizable\"}")
                .exchange()
                .expectStatus().isForbidden()
                .expectBody()
                .jsonPath("$.error").isEqualTo("ACCESS_DENIED");

        assertThat(walletRepository.findById(walletId)).get()
                .extracting(Wallet::getPrivacyMode).isEqualTo(PrivacyMode.PRIVATE);
    }

    @Test
    @DisplayName("withdrawal to a malformed address returns 400 INVALID_ADDRESS")
    void withdrawalInvalidAddress() {
        webTestClient.post().uri("/api/v1/monetization/withdrawals")
                .header("X-User-Id", "owner-1")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"to_address\":\"0x742d35Cc6634C0532925a3b844Bc454e4438f44e\",\"amount_zec\":0.001}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INVALID_ADDRESS");
    }
}
