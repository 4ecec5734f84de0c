package fr.lapetina.chatgateway.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.chatgateway.domain.model.ChatRequest;

import java.util.List;

/**
 * Chat completion request body, in the OpenAI wire format.
 * Sampling parameters are accepted and ignored; the upstream does not take them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChatCompletionRequest {

    private String model;
    private List<Message> messages;
    private boolean stream;
    private Double temperature;

    @JsonProperty("max_tokens")
    private Integer maxTokens;

    @JsonProperty("top_p")
    private Double topP;

    // Getters and setters
    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public List<Message> getMessages() { return messages; }
    public void setMessages(List<Message> messages) { this.messages = messages; }

    public boolean isStream() { return stream; }
    public void setStream(boolean stream) { this.stream = stream; }

    public Double getTemperature() { return temperature; }
    public void setTemperature(Double temperature) { this.temperature = temperature; }

    public Integer getMaxTokens() { return maxTokens; }
    public void setMaxTokens(Integer maxTokens) { this.maxTokens = maxTokens; }

    public Double getTopP() { return topP; }
    public void setTopP(Double topP) { this.topP = topP; }

    /**
     * Converts to the domain request. Structural checks happen in the pipeline.
     */
    public ChatRequest toChatRequest() {
        List<ChatRequest.Message> domainMessages = null;
        if (messages != null) {
            domainMessages = messages.stream()
                    .map(m -> m == null
                            ? new ChatRequest.Message(null, null)
                            : new ChatRequest.Message(m.getRole(), m.getContent()))
                    .toList();
        }

        return ChatRequest.builder()
                .model(model)
                .messages(domainMessages)
                .stream(stream)
                .build();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {
        private String role;
        private String content;

        public Message() {
        }

        public Message(String role, String content) {
            this.role = role;
            this.content = content;
        }

        public String getRole() { return role; }
        public void setRole(String role) { this.role = role; }

        public String getContent() { return content; }
        public void setContent(String content) { this.content = content; }
    }
}
