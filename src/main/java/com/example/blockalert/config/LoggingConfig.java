package com.example.blockalert.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.server.WebFilter;
import reactor.core.publisher.Mono;

@Configuration
public class LoggingConfig {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfig.class);

    /**
     * Debug-level request/response logging. SSE streams log once on subscribe and once on completion.
     */
    @Bean
    public WebFilter requestLoggingFilter() {
        return (exchange, chain) -> {
            if (!log.isDebugEnabled()) {
                return chain.filter(exchange);
            }
            long startTime = System.currentTimeMillis();
            String path = exchange.getRequest().getURI().getPath();
            String method = exchange.getRequest().getMethod().name();

            log.debug("Incoming request: {} {} from {}", method, path, exchange.getRequest().getRemoteAddress());

            return chain.filter(exchange)
                    .then(Mono.fromRunnable(() -> log.debug("Outgoing response: {} {} - {} in {}ms",
                            method,
                            path,
                            exchange.getResponse().getStatusCode(),
                            System.currentTimeMillis() - startTime)));
        };
    }
}
