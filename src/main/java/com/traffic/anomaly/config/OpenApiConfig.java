package com.traffic.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI trafficAnomalyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Traffic Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Traffic anomaly detection from two signal sources.\n\n" +
                                "**PromQL rules:**\n" +
                                "1. Register a rule: query template with `{{var}}` placeholders, threshold, comparison\n" +
                                "2. Evaluate via `POST /evaluations/{name}` with context variables (e.g. `ip`, `path`)\n" +
                                "3. Context variables override the rule's defaults and are substituted into the template\n" +
                                "4. The backend result is compared against the threshold; score = |value - threshold|\n\n" +
                                "Backend failures never fail an evaluation: they come back as a non-anomalous verdict " +
                                "whose `details` names the problem. A circuit breaker stops querying a failing backend " +
                                "for a cooldown period.\n\n" +
                                "**Seasonal baselines:**\n" +
                                "- Observations update hour-of-day, day-of-week and week-of-year EWMA buckets\n" +
                                "- Threshold = mean + sensitivity * stddev; confidence reaches 1.0 after 10 observations\n" +
                                "- Bucket keys use the configured `baseline.zone-id` calendar")
                        .contact(new Contact().name("Traffic Anomaly Detection Team")));
    }
}
