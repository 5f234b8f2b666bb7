package com.qgen.controller;

import com.qgen.api.dto.BatchAuditRequest;
import com.qgen.api.dto.BatchItem;
import com.qgen.api.dto.QgenRequest;
import com.qgen.api.dto.QgenResponse;
import com.qgen.infra.RequestRateLimiter;
import com.qgen.service.QgenRequestService;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.InetSocketAddress;
import java.util.List;
import java.util.Map;

@RestController
@RequiredArgsConstructor
public class QgenController {

    private final QgenRequestService service;
    private final RequestRateLimiter rateLimiter;

    @Operation(summary = "生成或扫描合约，审计结果写入承诺账本")
    @PostMapping(value = "/generate", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<QgenResponse> generate(@Valid @RequestBody QgenRequest req, ServerHttpRequest http) {
        checkRate(http);
        // === 模式互斥校验 ===
        if (!req.isGeneration() && !req.isScan()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Request must contain either 'user_prompt' or 'contract_code'.");
        }
        if (req.isGeneration() && req.isScan()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "Request cannot contain both modes simultaneously.");
        }
        return Mono.fromCallable(() -> req.isGeneration() ? service.generate(req) : service.scan(req))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorMap(ErrorMapping::toStatus);
    }

    @Operation(summary = "批量扫描（并行分析，账本追加仍串行）")
    @PostMapping(value = "/audit/batch", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<List<BatchItem>> batch(@Valid @RequestBody BatchAuditRequest req, ServerHttpRequest http) {
        checkRate(http);
        List<String> contracts = req.contracts();
        return Flux.range(0, contracts.size())
                .flatMapSequential(i -> Mono.fromCallable(() -> service.scanOne(i, contracts.get(i), req.language(), req.clientRef()))
                        .subscribeOn(Schedulers.boundedElastic()))
                .collectList()
                .onErrorMap(ErrorMapping::toStatus);
    }

    @Operation(summary = "健康检查")
    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> health() {
        return Map.of("status", "ok", "app", "Q-Gen API");
    }

    private void checkRate(ServerHttpRequest http) {
        RequestRateLimiter.Decision d = rateLimiter.tryAcquire(clientKey(http));
        if (!d.allowed()) {
            throw new ResponseStatusException(HttpStatus.TOO_MANY_REQUESTS, d.message());
        }
    }

    private static String clientKey(ServerHttpRequest http) {
        InetSocketAddress addr = http.getRemoteAddress();
        if (addr == null) return "unknown";
        return addr.getAddress() != null ? addr.getAddress().getHostAddress() : addr.getHostString();
    }
}
