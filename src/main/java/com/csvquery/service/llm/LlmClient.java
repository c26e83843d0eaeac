package com.csvquery.service.llm;

import com.csvquery.config.LlmProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Blocking wrapper over the chat completions endpoint.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmClient {

    private final WebClient llmWebClient;
    private final LlmProperties properties;

    public String complete(String system, String user, double temperature, Integer maxTokens) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", properties.getModel());
        body.put("temperature", temperature);
        body.put("messages", List.of(
                Map.of("role", "system", "content", system),
                Map.of("role", "user", "content", user)
        ));
        if (maxTokens != null) {
            body.put("max_tokens", maxTokens);
        }

        Map<?, ?> resp = llmWebClient.post()
                .uri("/chat/completions")
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, errorResp ->
                        errorResp.bodyToMono(String.class).flatMap(err -> {
                            log.error("LLM call failed {}: {}", errorResp.statusCode(), err);
                            return Mono.error(new IllegalStateException("LLM returned " + errorResp.statusCode()));
                        })
                )
                .bodyToMono(Map.class)
                .block(properties.getTimeout());

        if (resp == null) {
            throw new IllegalStateException("Empty LLM response");
        }
        return extractContent(resp);
    }

    /** choices[0].message.content, or an empty string when the shape is unexpected. */
    static String extractContent(Map<?, ?> resp) {
        if (!(resp.get("choices") instanceof List<?> choices) || choices.isEmpty()) return "";
        if (!(choices.get(0) instanceof Map<?, ?> choice)) return "";
        if (!(choice.get("message") instanceof Map<?, ?> message)) return "";
        Object content = message.get("content");
        return content == null ? "" : content.toString().trim();
    }
}
