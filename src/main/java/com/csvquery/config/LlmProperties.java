package com.csvquery.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Data
@Component
@ConfigurationProperties(prefix = "app.llm")
public class LlmProperties {

    /** OpenAI-compatible API root, e.g. https://api.openai.com/v1 */
    private String baseUrl = "https://api.openai.com/v1";

    private String apiKey = "";

    private String model = "gpt-4o-mini";

    private Duration timeout = Duration.ofSeconds(60);

    private int sqlMaxTokens = 500;

    private double summaryTemperature = 0.1;

    private int summaryMaxChars = 1500;
}
