package com.example.omnichat.autoreply;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.example.omnichat.domain.ChatMessage;
import com.example.omnichat.domain.MessageRole;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

class HttpReplyGeneratorTest {

    private static final String ENDPOINT = "http://replies.local/generate";

    private MockRestServiceServer server;
    private HttpReplyGenerator generator;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        generator = new HttpReplyGenerator(builder.build(), ENDPOINT);
    }

    @Test
    void sendsHistoryAndReadsReply() {
        server.expect(requestTo(ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.companyId").value("acme"))
                .andExpect(jsonPath("$.conversationId").value("c1"))
                .andExpect(jsonPath("$.messages[0].role").value("USER"))
                .andExpect(jsonPath("$.messages[0].text").value("Do you ship to Lisbon?"))
                .andRespond(withSuccess("{\"answer\":\"Yes, in 3 days.\",\"model\":\"kb-v2\"}", MediaType.APPLICATION_JSON));

        GeneratedReply reply = generator.generate("acme", "c1", List.of(ChatMessage.builder()
                .id(1L)
                .role(MessageRole.USER)
                .text("Do you ship to Lisbon?")
                .createdAt(Instant.parse("2024-05-01T09:00:00Z"))
                .build()));

        assertThat(reply.text()).isEqualTo("Yes, in 3 days.");
        assertThat(reply.model()).isEqualTo("kb-v2");
        server.verify();
    }

    @Test
    void serverErrorsPropagateToTheGate() {
        server.expect(requestTo(ENDPOINT)).andRespond(withServerError());

        assertThatThrownBy(() -> generator.generate("acme", "c1", List.of())).isInstanceOf(RestClientException.class);
    }
}
