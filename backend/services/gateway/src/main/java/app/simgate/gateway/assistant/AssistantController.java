package app.simgate.gateway.assistant;

import app.simgate.gateway.security.CurrentCallerProvider;
import jakarta.validation.Valid;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/assistant")
public class AssistantController {

    private final AssistantClient assistantClient;
    private final CurrentCallerProvider currentCallerProvider;

    public AssistantController(AssistantClient assistantClient, CurrentCallerProvider currentCallerProvider) {
        this.assistantClient = assistantClient;
        this.currentCallerProvider = currentCallerProvider;
    }

    @PostMapping("/messages")
    public AssistantReply send(Authentication authentication, @Valid @RequestBody AssistantRequest request) {
        currentCallerProvider.requireCredential(authentication);
        return assistantClient.send(request.message());
    }
}
