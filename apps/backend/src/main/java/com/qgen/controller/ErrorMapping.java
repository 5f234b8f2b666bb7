package com.qgen.controller;

import com.qgen.ai.GenerationException;
import com.qgen.contract.parser.ContractParseException;
import com.qgen.ledger.LedgerException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * 领域异常 -> HTTP 状态：
 *   解析失败 422，账本失败 503，模型失败 502（未配置模型 503）
 */
@Slf4j
final class ErrorMapping {
    private ErrorMapping() {}

    static Throwable toStatus(Throwable e) {
        if (e instanceof ResponseStatusException) return e;
        if (e instanceof ContractParseException p) {
            log.warn("Contract rejected: {}", p.getMessage());
            return new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, p.getMessage(), p);
        }
        if (e instanceof LedgerException l) {
            log.error("Ledger failure: {}", l.getMessage(), l);
            return new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, l.getMessage(), l);
        }
        if (e instanceof GenerationException g) {
            log.warn("Generation failed ({}): {}", g.getReason(), g.getMessage());
            HttpStatus status = g.getReason() == GenerationException.Reason.UNAVAILABLE
                    ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.BAD_GATEWAY;
            return new ResponseStatusException(status, g.getMessage(), g);
        }
        log.error("Unexpected failure", e);
        return new ResponseStatusException(HttpStatus.INTERNAL_SERVER_ERROR, "internal error", e);
    }
}
