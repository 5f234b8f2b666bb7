package com.qgen.controller;

import com.qgen.ContractFixtures;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

import static org.hamcrest.Matchers.matchesPattern;

@SpringBootTest(properties = {"qgen.rate-limit.max-requests=2", "qgen.rate-limit.window=60s"})
@AutoConfigureWebTestClient
class QgenControllerRateLimitTest {

    @Autowired
    private WebTestClient client;

    @Test
    void thirdRequestInWindowIs429() {
        Map<String, String> body = Map.of("contract_code", ContractFixtures.load(ContractFixtures.VOTING));
        for (int i = 0; i < 2; i++) {
            client.post().uri("/generate").contentType(MediaType.APPLICATION_JSON).bodyValue(body)
                    .exchange().expectStatus().isOk();
        }

        client.post().uri("/generate").contentType(MediaType.APPLICATION_JSON).bodyValue(body)
                .exchange()
                .expectStatus().isEqualTo(429)
                .expectBody()
                .jsonPath("$.message").value(matchesPattern("Rate limit exceeded\\. Try again in \\d+\\.\\d seconds\\."));

        client.get().uri("/health").exchange().expectStatus().isOk();
    }
}
