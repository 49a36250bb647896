package com.riskmgmt.quant.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI quantRiskEngineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Quantitative Risk Analysis API")
                        .version("1.0.0")
                        .description(
                                "Stateless quantitative analysis of qualitative risk records.\n\n" +
                                "**Assessment Pipeline:**\n" +
                                "1. Submit risks via `POST /assessments`\n" +
                                "2. Monte Carlo simulation per risk (seeded, reproducible)\n" +
                                "3. Percentiles, confidence intervals and Value-at-Risk\n" +
                                "4. For two or more risks: correlation matrix, network metrics, clusters, systemic indicators\n" +
                                "5. Ranked treatment recommendations (MITIGATION, TRANSFER, AVOIDANCE, ACCEPTANCE)\n\n" +
                                "**Distribution Families:** `TRIANGULAR` (default), `LOG_NORMAL`, `NORMAL`, `UNIFORM`, `BETA`\n\n" +
                                "Identical risks, parameters, framework and seed always return the identical report.")
                        .contact(new Contact().name("Risk Analytics Team")));
    }
}
