package com.precare.risk.insight;

import com.precare.risk.model.RiskResultSet;
import com.precare.risk.testsupport.KnowledgeBaseFixture;
import com.precare.risk.testsupport.PatientRecords;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ClaudeInsightClientTest {

    private HttpClient httpClient;
    private HttpResponse<String> response;
    private ClaudeInsightClient client;
    private RiskResultSet results;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        httpClient = mock(HttpClient.class);
        response = mock(HttpResponse.class);
        client = new ClaudeInsightClient(httpClient);
        ReflectionTestUtils.setField(client, "endpoint", "https://insights.test/v1/messages");
        ReflectionTestUtils.setField(client, "apiKey", "test-key");
        ReflectionTestUtils.setField(client, "model", "claude-test");
        ReflectionTestUtils.setField(client, "anthropicVersion", "2023-06-01");
        ReflectionTestUtils.setField(client, "temperature", 0.1);
        ReflectionTestUtils.setField(client, "timeoutMs", 2000L);
        results = new KnowledgeBaseFixture().aggregator().calculateAllRisks(PatientRecords.sarahJohnson());
    }

    @Test
    void riskInsights_returnsFirstTextBlock() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("""
                {"id": "msg_1", "type": "message", "role": "assistant",
                 "content": [{"type": "text", "text": "  Prioritise glucose control.  "}]}
                """);
        doReturn(response).when(httpClient).send(any(), any());

        Optional<String> text = client.riskInsights(PatientRecords.sarahJohnson(), results);

        assertThat(text).contains("Prioritise glucose control.");
    }

    @Test
    void request_carriesApiHeadersAndTimeout() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"content\": [{\"type\": \"text\", \"text\": \"ok\"}]}");
        doReturn(response).when(httpClient).send(any(), any());

        client.personalizedRecommendations(PatientRecords.sarahJohnson(), "Stroke");

        ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(captor.capture(), any());
        HttpRequest request = captor.getValue();
        assertThat(request.method()).isEqualTo("POST");
        assertThat(request.uri()).hasToString("https://insights.test/v1/messages");
        assertThat(request.headers().firstValue("x-api-key")).contains("test-key");
        assertThat(request.headers().firstValue("anthropic-version")).contains("2023-06-01");
        assertThat(request.timeout()).contains(Duration.ofMillis(2000));
    }

    @Test
    void nonOkStatus_isEmpty() throws Exception {
        when(response.statusCode()).thenReturn(529);
        doReturn(response).when(httpClient).send(any(), any());

        assertThat(client.riskInsights(PatientRecords.sarahJohnson(), results)).isEmpty();
    }

    @Test
    void responseWithoutText_isEmpty() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"content\": [{\"type\": \"tool_use\", \"id\": \"t1\"}]}");
        doReturn(response).when(httpClient).send(any(), any());

        assertThat(client.riskInsights(PatientRecords.sarahJohnson(), results)).isEmpty();
    }

    @Test
    void transportFailure_isEmpty() throws Exception {
        doThrow(new IOException("connection reset")).when(httpClient).send(any(), any());

        assertThat(client.riskInsights(PatientRecords.sarahJohnson(), results)).isEmpty();
    }

    @Test
    void missingApiKey_skipsTheCall() {
        ReflectionTestUtils.setField(client, "apiKey", "");

        assertThat(client.riskInsights(PatientRecords.sarahJohnson(), results)).isEmpty();
        verifyNoInteractions(httpClient);
    }
}
