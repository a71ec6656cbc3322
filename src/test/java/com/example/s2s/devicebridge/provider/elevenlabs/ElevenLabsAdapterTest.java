package com.example.s2s.devicebridge.provider.elevenlabs;

import com.example.s2s.devicebridge.audio.AudioFrame;
import com.example.s2s.devicebridge.provider.AdapterState;
import com.example.s2s.devicebridge.provider.ProviderCredentials;
import com.example.s2s.devicebridge.provider.ProviderEvent;
import com.example.s2s.devicebridge.provider.RecordingListener;
import com.example.s2s.devicebridge.provider.UpstreamStub;
import com.example.s2s.devicebridge.provider.UpstreamUnavailableException;
import com.google.gson.JsonObject;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ElevenLabsAdapterTest {

    private static final String METADATA = "{\"type\":\"conversation_initiation_metadata\","
        + "\"conversation_initiation_metadata_event\":{\"conversation_id\":\"conv_1\","
        + "\"agent_output_audio_format\":\"pcm_22050\",\"user_input_audio_format\":\"pcm_16000\"}}";

    private MockWebServer server;
    private OkHttpClient client;
    private ElevenLabsAdapter adapter;
    private RecordingListener events;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new OkHttpClient();
        adapter = new ElevenLabsAdapter(
            new ElevenLabsConfig(server.url("/").toString(), "xi-config", "agent-default"),
            client, Duration.ofSeconds(5));
        events = new RecordingListener();
        adapter.onEvent(events);
    }

    @AfterEach
    void tearDown() throws IOException {
        adapter.close();
        client.dispatcher().executorService().shutdown();
        server.shutdown();
    }

    private UpstreamStub enqueueConversation() {
        String socketUrl = server.url("/convai/socket?token=signed").toString().replaceFirst("^http", "ws");
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"signed_url\":\"" + socketUrl + "\"}"));
        UpstreamStub upstream = new UpstreamStub()
            .replyTo("conversation_initiation_client_data", METADATA);
        server.enqueue(new MockResponse().withWebSocketUpgrade(upstream));
        return upstream;
    }

    @Test
    void shouldFetchSignedUrlThenInitiateConversation() throws Exception {
        // Arrange
        UpstreamStub upstream = enqueueConversation();

        // Act
        adapter.connect(new ProviderCredentials("xi-key", "agent-42"), "Hey buddy", "Talk like a pirate")
            .block(Duration.ofSeconds(5));

        // Assert
        assertThat(adapter.state()).isEqualTo(AdapterState.READY);

        RecordedRequest signed = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(signed.getRequestUrl().encodedPath()).isEqualTo("/v1/convai/conversation/get-signed-url");
        assertThat(signed.getRequestUrl().queryParameter("agent_id")).isEqualTo("agent-42");
        assertThat(signed.getHeader("xi-api-key")).isEqualTo("xi-key");

        RecordedRequest upgrade = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(upgrade.getRequestUrl().queryParameter("token")).isEqualTo("signed");

        JsonObject initiation = upstream.next();
        JsonObject agent = initiation.getAsJsonObject("conversation_config_override").getAsJsonObject("agent");
        assertThat(agent.get("first_message").getAsString()).isEqualTo("Hey buddy");
        assertThat(agent.getAsJsonObject("prompt").get("prompt").getAsString()).isEqualTo("Talk like a pirate");
    }

    @Test
    void shouldUseNegotiatedOutputRateForAgentAudio() throws Exception {
        UpstreamStub upstream = enqueueConversation();
        adapter.connect(new ProviderCredentials("xi-key", null), null, null).block(Duration.ofSeconds(5));
        String audio = Base64.getEncoder().encodeToString(new byte[] {5, 0, 6, 0});

        upstream.send("{\"type\":\"audio\",\"audio_event\":{\"audio_base_64\":\"" + audio + "\",\"event_id\":1}}");

        assertThat(events.next().type()).isEqualTo(ProviderEvent.Type.TURN_STARTED);
        AudioFrame frame = events.next().audio();
        assertThat(frame.sampleRate()).isEqualTo(22050);
        assertThat(frame.data()).containsExactly(5, 0, 6, 0);
    }

    @Test
    void shouldFrameTurnsAroundTranscriptAndAgentResponse() throws Exception {
        // Arrange
        UpstreamStub upstream = enqueueConversation();
        adapter.connect(new ProviderCredentials("xi-key", null), null, null).block(Duration.ofSeconds(5));

        // Act
        upstream.send("{\"type\":\"user_transcript\",\"user_transcription_event\":{\"user_transcript\":\"Tell me a joke\"}}");
        upstream.send("{\"type\":\"agent_response\",\"agent_response_event\":{\"agent_response\":\"Why did the chicken...\"}}");

        // Assert
        ProviderEvent user = events.next();
        assertThat(user.type()).isEqualTo(ProviderEvent.Type.USER_UTTERANCE_TRANSCRIBED);
        assertThat(user.text()).isEqualTo("Tell me a joke");
        assertThat(events.next().type()).isEqualTo(ProviderEvent.Type.TURN_STARTED);
        assertThat(events.next().text()).isEqualTo("Why did the chicken...");
        assertThat(events.next().type()).isEqualTo(ProviderEvent.Type.TURN_COMPLETED);
    }

    @Test
    void shouldAnswerPings() throws Exception {
        UpstreamStub upstream = enqueueConversation();
        adapter.connect(new ProviderCredentials("xi-key", null), null, null).block(Duration.ofSeconds(5));

        upstream.send("{\"type\":\"ping\",\"ping_event\":{\"event_id\":7,\"ping_ms\":30}}");

        JsonObject pong = upstream.next("pong");
        assertThat(pong.get("event_id").getAsLong()).isEqualTo(7L);
    }

    @Test
    void shouldEndSessionOnConversationEnd() throws Exception {
        UpstreamStub upstream = enqueueConversation();
        adapter.connect(new ProviderCredentials("xi-key", null), null, null).block(Duration.ofSeconds(5));

        upstream.send("{\"type\":\"conversation_end\"}");

        assertThat(events.next(ProviderEvent.Type.SESSION_ENDED)).isNotNull();
    }

    @Test
    void shouldFailConnectWhenSignedUrlIsRefused() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"detail\":\"invalid key\"}"));

        assertThatThrownBy(() -> adapter.connect(new ProviderCredentials("xi-bad", null), null, null)
                .block(Duration.ofSeconds(5)))
            .isInstanceOf(UpstreamUnavailableException.class)
            .hasMessageContaining("401");
        assertThat(adapter.state()).isEqualTo(AdapterState.CLOSED);
    }

    @Test
    void shouldFailConnectWhenSignedUrlIsMissing() {
        server.enqueue(new MockResponse().setBody("{}"));

        assertThatThrownBy(() -> adapter.connect(new ProviderCredentials("xi-key", null), null, null)
                .block(Duration.ofSeconds(5)))
            .isInstanceOf(UpstreamUnavailableException.class)
            .hasMessageContaining("signed_url");
    }

    @Test
    void shouldParsePcmRatesAndFallBackOtherwise() {
        assertThat(ElevenLabsAdapter.parseRate("pcm_16000", 8000)).isEqualTo(16000);
        assertThat(ElevenLabsAdapter.parseRate("pcm_44100", 8000)).isEqualTo(44100);
        assertThat(ElevenLabsAdapter.parseRate("ulaw_8000", 16000)).isEqualTo(16000);
        assertThat(ElevenLabsAdapter.parseRate(null, 16000)).isEqualTo(16000);
    }
}
