package com.qgen.config;

import com.qgen.contract.model.SemanticModelBuilder;
import com.qgen.contract.parser.ContractParser;
import com.qgen.contract.parser.PrimitiveCatalog;
import com.qgen.detector.AuditPolicy;
import com.qgen.detector.Detector;
import com.qgen.detector.DetectorSet;
import com.qgen.report.ReportCanonicalizer;
import com.qgen.report.ReportComposer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Stateless engine components, shared by all requests.
 */
@Slf4j
@Configuration
public class AuditEngineConfig {

    @Bean
    public PrimitiveCatalog primitiveCatalog(AuditProperties props) {
        PrimitiveCatalog catalog = PrimitiveCatalog.withExtensions(props.getPrimitives());
        log.info("Primitive catalog ready: {} name(s)", catalog.size());
        return catalog;
    }

    @Bean
    public ContractParser contractParser(PrimitiveCatalog catalog) {
        return new ContractParser(catalog);
    }

    @Bean
    public SemanticModelBuilder semanticModelBuilder() {
        return new SemanticModelBuilder();
    }

    @Bean
    public AuditPolicy auditPolicy(AuditProperties props) {
        return props.toPolicy();
    }

    @Bean
    public DetectorSet detectorSet(List<Detector> detectors) {
        log.info("Detectors registered: {}", detectors.stream().map(Detector::rule).toList());
        return new DetectorSet(detectors);
    }

    @Bean
    public ReportComposer reportComposer(AuditPolicy policy) {
        return new ReportComposer(policy);
    }

    @Bean
    public ReportCanonicalizer reportCanonicalizer() {
        return new ReportCanonicalizer();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
