package com.retail.backoffice.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class ReportConfig {

    private static final Logger logger = LoggerFactory.getLogger(ReportConfig.class);

    /** Zone that report days, hours and weeks are cut in. */
    @Bean
    public ZoneId reportZone(@Value("${reports.zone-id:UTC}") String zoneId) {
        ZoneId zone = ZoneId.of(zoneId);
        logger.info("Reports use business time zone {}", zone);
        return zone;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
