package com.qgen;

import lombok.extern.slf4j.Slf4j;
import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan("com.qgen.config")
@MapperScan(basePackages = "com.qgen.mapper")
@Slf4j
public class QgenAuditApplication {

    public static void main(String[] args) {
        log.info("Starting Q-Gen audit application");
        SpringApplication.run(QgenAuditApplication.class, args);
        log.info("Q-Gen audit application started");
    }

}
