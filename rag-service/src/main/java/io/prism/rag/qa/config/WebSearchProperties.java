package io.prism.rag.qa.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Bound from {@code prism.web-search.*}. The {@code web_search} tool is only registered when
 * {@code enabled} is true.
 */
@Data
@ConfigurationProperties(prefix = "prism.web-search")
public class WebSearchProperties {

    private boolean enabled = false;

    private String url = "https://api.tavily.com";

    private String apiKey;

    private int maxResults = 5;

    private Duration timeout = Duration.ofSeconds(15);
}
