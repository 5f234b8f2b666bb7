package com.qgen.ledger;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.qgen.api.dto.LedgerReceipt;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.util.List;

@Service
@RequiredArgsConstructor
public class LedgerExportService {

    static final String CSV_HEADER = "sequence,operation_kind,report_hash,prev_hash,entry_hash,timestamp,transaction_id\n";

    private final CommitmentLedger ledger;
    private final ObjectMapper objectMapper;

    /** 单一数据口径：导出与校验看到的是同一份快照；存储不可用时统一 503 */
    Mono<List<LedgerReceipt>> snapshot() {
        return Mono.fromCallable(() -> ledger.entries().stream().map(LedgerReceipt::of).toList())
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(LedgerException.class,
                        e -> new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), e));
    }

    /** CSV 流式导出；快照取到后才写响应头 */
    public Mono<Void> streamCsv(ServerHttpResponse resp) {
        return snapshot().flatMap(list -> {
            resp.getHeaders().setContentType(MediaType.parseMediaType("text/csv; charset=UTF-8"));
            resp.getHeaders().setContentDisposition(attachment("csv"));

            DataBufferFactory buf = resp.bufferFactory();
            Flux<DataBuffer> body = Flux.just(CSV_HEADER)
                    .concatWith(Flux.fromIterable(list).map(LedgerExportService::toCsvLine))
                    .map(s -> buf.wrap(s.getBytes(StandardCharsets.UTF_8)));
            return resp.writeWith(body);
        });
    }

    /** JSON 导出（一次性写出） */
    public Mono<ResponseEntity<byte[]>> exportJson() {
        return snapshot().map(list -> {
            try {
                return ResponseEntity.ok()
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(HttpHeaders.CONTENT_DISPOSITION, attachment("json").toString())
                        .body(objectMapper.writeValueAsBytes(list));
            } catch (Exception e) {
                throw new IllegalStateException("ledger JSON export failed", e);
            }
        });
    }

    /** NDJSON 流式导出（逐行一条 JSON） */
    public Mono<Void> streamNdjson(ServerHttpResponse resp) {
        return snapshot().flatMap(list -> {
            resp.getHeaders().setContentType(MediaType.parseMediaType("application/x-ndjson; charset=UTF-8"));
            resp.getHeaders().setContentDisposition(attachment("ndjson"));

            DataBufferFactory buf = resp.bufferFactory();
            Flux<DataBuffer> body = Flux.fromIterable(list)
                    .map(row -> {
                        try { return objectMapper.writeValueAsString(row) + "\n"; }
                        catch (Exception e) { throw new IllegalStateException(e); }
                    })
                    .map(s -> buf.wrap(s.getBytes(StandardCharsets.UTF_8)));
            return resp.writeWith(body);
        });
    }

    private ContentDisposition attachment(String ext) {
        return ContentDisposition.attachment()
                .filename("ledger-" + ledger.getLedgerId() + "." + ext, StandardCharsets.UTF_8)
                .build();
    }

    static String toCsvLine(LedgerReceipt r) {
        return r.sequence() + "," + csv(r.operationKind()) + "," + csv(r.reportHash()) + "," + csv(r.prevHash()) + ","
                + csv(r.entryHash()) + "," + csv(r.timestamp()) + "," + csv(r.transactionId()) + "\n";
    }

    private static String csv(String v) {
        if (v == null) return "";
        boolean q = v.contains(",") || v.contains("\"") || v.contains("\n");
        return q ? "\"" + v.replace("\"", "\"\"") + "\"" : v;
    }
}
