package com.qgen.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.qgen.api.dto.LedgerReceipt;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class LedgerExportServiceTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void csvLineFollowsHeaderColumns() {
        LedgerEntry e = LedgerHasher.link(null, "a".repeat(64), OperationKind.SCAN, Instant.parse("2025-01-01T00:00:00Z"));

        String line = LedgerExportService.toCsvLine(LedgerReceipt.of(e));
        String[] cols = line.trim().split(",");

        assertEquals(LedgerExportService.CSV_HEADER.trim().split(",").length, cols.length);
        assertEquals("1", cols[0]);
        assertEquals("SCAN", cols[1]);
        assertEquals(LedgerHasher.GENESIS, cols[3]);
        assertEquals("2025-01-01T00:00:00Z", cols[5]);
        assertThat(cols[6]).startsWith("QUBIC-SCAN-TX-");
        assertTrue(line.endsWith("\n"));
    }

    @Test
    void jsonExportListsEntriesInOrder() throws Exception {
        CommitmentLedger ledger = new CommitmentLedger("exp", new InMemoryLedgerStore(),
                Clock.fixed(Instant.EPOCH, ZoneOffset.UTC), 3);
        ledger.append("a".repeat(64), OperationKind.SCAN);
        ledger.append("b".repeat(64), OperationKind.GENERATE);
        LedgerExportService service = new LedgerExportService(ledger, mapper);

        StepVerifier.create(service.exportJson())
                .assertNext(resp -> {
                    assertEquals(MediaType.APPLICATION_JSON, resp.getHeaders().getContentType());
                    assertThat(resp.getHeaders().getFirst(HttpHeaders.CONTENT_DISPOSITION)).contains("ledger-exp.json");
                    JsonNode rows = readTree(resp.getBody());
                    assertEquals(2, rows.size());
                    assertEquals(1, rows.get(0).get("sequence").asInt());
                    assertEquals("GENERATE", rows.get(1).get("operation_kind").asText());
                    assertEquals(rows.get(0).get("entry_hash").asText(), rows.get(1).get("prev_hash").asText());
                })
                .verifyComplete();
    }

    private JsonNode readTree(byte[] body) {
        try {
            return mapper.readTree(body);
        } catch (Exception e) {
            throw new AssertionError(e);
        }
    }
}
