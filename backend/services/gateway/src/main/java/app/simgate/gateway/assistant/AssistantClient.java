package app.simgate.gateway.assistant;

import app.simgate.gateway.error.GatewayErrorKind;
import app.simgate.gateway.error.GatewayException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/**
 * Forwards a single user message to the hosted model over the Anthropic Messages API.
 */
@Component
public class AssistantClient {
    private static final Logger log = LoggerFactory.getLogger(AssistantClient.class);

    private static final String DEFAULT_API_VERSION = "2023-06-01";
    private static final int DEFAULT_MAX_TOKENS = 1024;

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final AssistantProps props;

    public AssistantClient(RestClient assistantRestClient,
                           AssistantProps props,
                           ObjectMapper objectMapper) {
        this.restClient = assistantRestClient;
        this.objectMapper = objectMapper;
        this.props = props;
    }

    public boolean isConfigured() {
        return StringUtils.hasText(props.apiKey()) && StringUtils.hasText(props.model());
    }

    public AssistantReply send(String message) {
        if (!isConfigured()) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Assistant is not configured");
        }

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", props.model());
        payload.put("max_tokens", props.maxTokens() != null && props.maxTokens() > 0
                ? props.maxTokens() : DEFAULT_MAX_TOKENS);
        if (StringUtils.hasText(props.systemPrompt())) {
            payload.put("system", props.systemPrompt());
        }
        ArrayNode messages = payload.putArray("messages");
        ObjectNode user = messages.addObject();
        user.put("role", "user");
        ArrayNode content = user.putArray("content");
        ObjectNode text = content.addObject();
        text.put("type", "text");
        text.put("text", message);

        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", props.apiKey())
                    .header("anthropic-version", StringUtils.hasText(props.apiVersion())
                            ? props.apiVersion() : DEFAULT_API_VERSION)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientResponseException ex) {
            log.warn("Assistant backend rejected request status={}", ex.getStatusCode().value());
            throw GatewayException.upstream(GatewayErrorKind.UPSTREAM_ERROR,
                    "Assistant backend failed with status " + ex.getStatusCode().value(),
                    ex.getStatusCode().value(), Map.of(), ex);
        } catch (ResourceAccessException ex) {
            log.warn("Assistant backend unreachable error={}", ex.getMessage());
            throw GatewayException.upstream(GatewayErrorKind.UPSTREAM_UNAVAILABLE,
                    "Assistant backend could not be reached", null, Map.of(), ex);
        }

        if (response == null) {
            throw GatewayException.of(GatewayErrorKind.UPSTREAM_ERROR, "Assistant response is empty");
        }
        return new AssistantReply(extractText(response), response.path("model").asText(props.model()));
    }

    static String extractText(JsonNode response) {
        StringBuilder sb = new StringBuilder();
        for (JsonNode block : response.path("content")) {
            if ("text".equals(block.path("type").asText()) && block.hasNonNull("text")) {
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append(block.get("text").asText());
            }
        }
        return sb.toString();
    }
}
