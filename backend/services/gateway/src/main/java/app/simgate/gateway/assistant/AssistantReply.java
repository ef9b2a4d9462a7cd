package app.simgate.gateway.assistant;

public record AssistantReply(
        String reply,
        String model
) {
}
