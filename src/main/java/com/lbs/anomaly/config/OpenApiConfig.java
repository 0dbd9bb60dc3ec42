package com.lbs.anomaly.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI anomalyDetectionOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("LBS Anomaly Detection API")
                        .version("1.0.0")
                        .description(
                                "Anomaly detection over dimensional sales metrics.\n\n" +
                                "**Detection run:**\n" +
                                "1. Resolve enabled detector configurations (or build one from request parameters)\n" +
                                "2. Serve sections from the result cache when the same configuration ran recently\n" +
                                "3. Run the remaining detectors concurrently, each isolated from the others' failures\n" +
                                "4. Classify severity (LOW, MEDIUM, HIGH, CRITICAL) and describe every anomaly\n" +
                                "5. Merge sections into one response; failed or timed-out sections carry an error\n\n" +
                                "**Detector kinds:**\n" +
                                "- `time_series` moving-average bands or trend/seasonality forecast intervals\n" +
                                "- `statistical` z-score, IQR or isolation forest across dimension values\n" +
                                "- `comparative` year-over-year, month-over-month, quarter-over-quarter change\n" +
                                "- `day_on_day` daily change for the top-N dimension values")
                        .contact(new Contact().name("LBS Analytics Team")));
    }
}
