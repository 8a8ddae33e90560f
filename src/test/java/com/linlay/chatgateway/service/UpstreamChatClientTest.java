package com.linlay.chatgateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.chatgateway.FakeUpstreamServer;
import com.linlay.chatgateway.FakeUpstreamServer.CapturedRequest;
import com.linlay.chatgateway.config.UpstreamLogProperties;
import com.linlay.chatgateway.config.UpstreamProperties;
import com.linlay.chatgateway.stream.model.StreamObservation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

import static com.linlay.chatgateway.FakeUpstreamServer.cumulative;
import static com.linlay.chatgateway.FakeUpstreamServer.delta;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UpstreamChatClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private FakeUpstreamServer upstream;
    private UpstreamChatClient client;

    @BeforeEach
    void setUp() throws Exception {
        upstream = new FakeUpstreamServer();
        client = newClient(upstream.baseUrl());
    }

    @AfterEach
    void tearDown() {
        upstream.close();
    }

    @Test
    void createConversationShouldSendSkillAndLanguages() throws Exception {
        String conversationId = client.createConversation("BSL").block();

        assertThat(conversationId).isEqualTo("conv-1");
        CapturedRequest request = upstream.requests().get(0);
        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.path()).isEqualTo("/chat_api/v1/conversations/");
        assertThat(request.authorization()).isEqualTo("test-token");
        JsonNode body = objectMapper.readTree(request.body());
        assertThat(body.path("is_chat").asBoolean()).isTrue();
        assertThat(body.path("skill_name").asText()).isEqualTo("custom");
        assertThat(body.path("ui_language").asText()).isEqualTo("russian");
        assertThat(body.path("programming_language").asText()).isEqualTo("BSL");
    }

    @Test
    void createConversationFailureShouldCarryStatus() {
        upstream.createStatus(403);

        assertThatThrownBy(() -> client.createConversation(null).block())
                .isInstanceOfSatisfying(UpstreamApiException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(403);
                    assertThat(ex.getMessage()).isEqualTo("Conversation create error: 403");
                });
    }

    @Test
    void streamMessageShouldAccumulateDeltasAndStopAtFinished() throws Exception {
        upstream.streamEvents(List.of(
                "{\"role\":\"user\",\"uuid\":\"u-1\",\"finished\":true,\"content\":{\"text\":\"Привет\"}}",
                delta("Hel", false),
                delta("lo", false),
                delta(" world", true),
                delta(" ignored", false)
        ));

        List<StreamObservation> observations = client.streamMessage("conv-9", "Привет", "parent-1")
                .collectList()
                .block();

        assertThat(observations).extracting(StreamObservation::text)
                .containsExactly("Hel", "Hello", "Hello world");
        assertThat(observations.get(2).finished()).isTrue();
        assertThat(observations.get(0).messageId()).isEqualTo("msg-1");

        CapturedRequest request = upstream.requestsTo("/messages").get(0);
        assertThat(request.path()).isEqualTo("/chat_api/v1/conversations/conv-9/messages");
        assertThat(request.accept()).contains("text/event-stream");
        JsonNode body = objectMapper.readTree(request.body());
        assertThat(body.path("content").path("content").path("instruction").asText()).isEqualTo("Привет");
        assertThat(body.path("content").has("tools")).isTrue();
        assertThat(body.path("parent_uuid").asText()).isEqualTo("parent-1");
        assertThat(body.path("role").asText()).isEqualTo("user");
    }

    @Test
    void sendMessageFullShouldReturnFinalCumulativeText() {
        upstream.streamEvents(List.of(
                cumulative("Hello", false),
                cumulative("Hello", false),
                cumulative("Hello! ", true)
        ));

        assertThat(client.sendMessageFull("conv-1", "hi", null).block()).isEqualTo("Hello!");
    }

    @Test
    void messageErrorStatusShouldSurfaceImmediately() {
        upstream.messageStatus(429);

        assertThatThrownBy(() -> client.streamMessage("conv-1", "hi", null).collectList().block())
                .isInstanceOfSatisfying(UpstreamApiException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(429));
    }

    @Test
    void transportFailureShouldHaveNoStatus() throws Exception {
        FakeUpstreamServer stopped = new FakeUpstreamServer();
        String deadUrl = stopped.baseUrl();
        stopped.close();
        UpstreamChatClient unreachable = newClient(deadUrl);

        assertThatThrownBy(() -> unreachable.streamMessage("conv-1", "hi", null).collectList().block())
                .isInstanceOfSatisfying(UpstreamApiException.class, ex -> {
                    assertThat(ex.getStatusCode()).isNull();
                    assertThat(ex.getMessage()).startsWith("Network error sending message");
                });
    }

    @Test
    void feedbackShouldAcceptNoContent() {
        upstream.feedbackStatus(204);

        client.sendFeedback("msg-1", 1).block();

        CapturedRequest request = upstream.requestsTo("/like").get(0);
        assertThat(request.path()).isEqualTo("/chat_api/v1/feedbacks/msg-1/like");
        assertThat(request.body()).isEqualTo("{\"score\":1}");
    }

    @Test
    void feedbackFailureShouldCarryStatus() {
        upstream.feedbackStatus(500);

        assertThatThrownBy(() -> client.sendFeedback("msg-1", -1).block())
                .isInstanceOfSatisfying(UpstreamApiException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(500));
    }

    private UpstreamChatClient newClient(String baseUrl) {
        UpstreamProperties properties = new UpstreamProperties();
        properties.setBaseUrl(baseUrl);
        properties.setToken("test-token");
        return new UpstreamChatClient(WebClient.builder(), properties, new UpstreamLogProperties(), objectMapper);
    }
}
