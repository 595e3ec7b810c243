package com.ylm.attendance.payroll.config;

import com.ylm.attendance.payroll.model.PayrollConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(PayrollProperties.class)
public class PayrollConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(PayrollConfiguration.class);

    @Bean
    public PayrollConfig payrollConfig(PayrollProperties properties) {
        PayrollConfig config = properties.toConfig();
        logger.info("Payroll configuration loaded: {}", config);
        return config;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
