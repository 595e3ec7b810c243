package com.ylm.attendance.payroll.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI payrollOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Attendance Payroll API")
                        .description("Salary reports computed from attendance punch records")
                        .version("1.0.0"));
    }
}
