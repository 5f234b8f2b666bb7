package com.qgen.ledger;

import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/ledger")
@RequiredArgsConstructor
public class LedgerController {

    private final CommitmentLedger ledger;
    private final LedgerExportService exportService;

    @Operation(summary = "账本校验，返回 JSON 报告")
    @GetMapping(value = "/verify", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ChainVerificationResult> verify() {
        return Mono.fromCallable(ledger::verifyChain)
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(LedgerException.class, LedgerController::unavailable);
    }

    @Operation(summary = "获取尾哈希（tailHash）")
    @GetMapping(value = "/tail", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> tail() {
        return Mono.fromCallable(() -> {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("ledgerId", ledger.getLedgerId());
            m.put("tailHash", ledger.tailHash());
            return m;
        }).subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(LedgerException.class, LedgerController::unavailable);
    }

    @Operation(summary = "导出 CSV（流式）")
    @GetMapping(value = "/export", params = "format=csv", produces = "text/csv")
    public Mono<Void> exportCsv(ServerHttpResponse resp) {
        return exportService.streamCsv(resp);
    }

    @Operation(summary = "导出 JSON")
    @GetMapping(value = "/export", params = "format=json", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<byte[]>> exportJson() {
        return exportService.exportJson();
    }

    @Operation(summary = "导出 NDJSON（流式，逐行）")
    @GetMapping(value = "/export", params = "format=ndjson", produces = "application/x-ndjson")
    public Mono<Void> exportNdjson(ServerHttpResponse resp) {
        return exportService.streamNdjson(resp);
    }

    private static Throwable unavailable(LedgerException e) {
        return new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage(), e);
    }
}
