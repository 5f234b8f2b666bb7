package com.qgen.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.http.HttpStatus;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LedgerControllerTest {

    private static WebTestClient clientFor(LedgerStore store) {
        CommitmentLedger ledger = new CommitmentLedger("ctl", store, Clock.fixed(Instant.EPOCH, ZoneOffset.UTC), 3);
        return WebTestClient.bindToController(new LedgerController(ledger, new LedgerExportService(ledger, new ObjectMapper())))
                .build();
    }

    private static WebTestClient unavailableStore() throws Exception {
        LedgerStore store = mock(LedgerStore.class);
        when(store.load(anyString()))
                .thenThrow(new LedgerException(LedgerException.Reason.STORAGE_UNAVAILABLE, "database down"));
        when(store.last(anyString()))
                .thenThrow(new LedgerException(LedgerException.Reason.STORAGE_UNAVAILABLE, "database down"));
        return clientFor(store);
    }

    @ParameterizedTest
    @ValueSource(strings = {"json", "csv", "ndjson"})
    void exportReportsUnavailableStorageAs503(String format) throws Exception {
        unavailableStore().get().uri("/ledger/export?format=" + format).exchange()
                .expectStatus().isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    void verifyAndTailReportUnavailableStorageAs503() throws Exception {
        WebTestClient client = unavailableStore();

        client.get().uri("/ledger/verify").exchange()
                .expectStatus().isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        client.get().uri("/ledger/tail").exchange()
                .expectStatus().isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    void csvExportStreamsHeaderAndRows() throws Exception {
        InMemoryLedgerStore store = new InMemoryLedgerStore();
        WebTestClient client = clientFor(store);
        new CommitmentLedger("ctl", store, Clock.fixed(Instant.EPOCH, ZoneOffset.UTC), 3)
                .append("a".repeat(64), OperationKind.SCAN);

        client.get().uri("/ledger/export?format=csv").exchange()
                .expectStatus().isOk()
                .expectBody(String.class)
                .value(body -> assertThat(body)
                        .startsWith(LedgerExportService.CSV_HEADER)
                        .contains(",SCAN," + "a".repeat(64) + ","));
    }
}
