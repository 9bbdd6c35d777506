package net.proxymachine.config;

import net.proxymachine.repository.CardIndexHandle;
import net.proxymachine.support.retry.FetchRetryPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.ObjectMapper;

/**
 * Wires the explicit index handle, the shared retry policy and the JSON mapper.
 */
@Configuration
public class CardIndexConfig {

    @Bean(destroyMethod = "close")
    public CardIndexHandle cardIndexHandle(CardIndexProperties properties) {
        return new CardIndexHandle(properties.getPath(), properties.getReaderPoolSize());
    }

    @Bean
    public FetchRetryPolicy fetchRetryPolicy(FetchProperties properties) {
        return new FetchRetryPolicy(FetchRetryPolicy.RetryConfig.from(properties));
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }
}
