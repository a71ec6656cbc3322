package com.example.s2s.devicebridge.provider.hume;

import com.example.s2s.devicebridge.audio.AudioFrame;
import com.example.s2s.devicebridge.audio.Pcm16;
import com.example.s2s.devicebridge.audio.TestWav;
import com.example.s2s.devicebridge.provider.AdapterState;
import com.example.s2s.devicebridge.provider.ProviderCredentials;
import com.example.s2s.devicebridge.provider.ProviderEvent;
import com.example.s2s.devicebridge.provider.RecordingListener;
import com.example.s2s.devicebridge.provider.UpstreamStub;
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

class HumeEviAdapterTest {

    private MockWebServer server;
    private OkHttpClient client;
    private HumeEviAdapter adapter;
    private UpstreamStub upstream;
    private RecordingListener events;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        client = new OkHttpClient();
        String url = server.url("/v0/evi/chat").toString().replaceFirst("^http", "ws");
        adapter = new HumeEviAdapter(new HumeConfig(url, "hume-config-key", "default-config"),
            client, Duration.ofSeconds(5), 16000);
        upstream = new UpstreamStub();
        server.enqueue(new MockResponse().withWebSocketUpgrade(upstream));
        events = new RecordingListener();
        adapter.onEvent(events);
    }

    @AfterEach
    void tearDown() throws IOException {
        adapter.close();
        client.dispatcher().executorService().shutdown();
        server.shutdown();
    }

    @Test
    void shouldBeReadyOnOpenAfterSendingSettingsAndOpeningText() throws Exception {
        // Act
        adapter.connect(new ProviderCredentials("hume-key", "personality-config"), "Hi!", "Be playful")
            .block(Duration.ofSeconds(5));

        // Assert
        assertThat(adapter.state()).isEqualTo(AdapterState.READY);

        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(request.getRequestUrl().queryParameter("api_key")).isEqualTo("hume-key");
        assertThat(request.getRequestUrl().queryParameter("config_id")).isEqualTo("personality-config");

        JsonObject settings = upstream.next();
        assertThat(settings.get("type").getAsString()).isEqualTo("session_settings");
        assertThat(settings.get("system_prompt").getAsString()).isEqualTo("Be playful");
        JsonObject audio = settings.getAsJsonObject("audio");
        assertThat(audio.get("encoding").getAsString()).isEqualTo("linear16");
        assertThat(audio.get("sample_rate").getAsInt()).isEqualTo(16000);
        assertThat(audio.get("channels").getAsInt()).isEqualTo(1);

        JsonObject input = upstream.next();
        assertThat(input.get("type").getAsString()).isEqualTo("user_input");
        assertThat(input.get("text").getAsString()).isEqualTo("Hi!");
    }

    @Test
    void shouldUnwrapWavOutputToMonoPcm() throws Exception {
        // Arrange
        adapter.connect(new ProviderCredentials("hume-key", null), null, null).block(Duration.ofSeconds(5));
        byte[] wav = TestWav.pcm16(48000, 2, new short[] {100, 300, -100, -300});

        // Act
        upstream.send("{\"type\":\"audio_output\",\"data\":\"" + Base64.getEncoder().encodeToString(wav) + "\"}");
        upstream.send("{\"type\":\"assistant_message\",\"message\":{\"role\":\"assistant\",\"content\":\"Hello friend\"}}");
        upstream.send("{\"type\":\"assistant_end\"}");

        // Assert
        assertThat(events.next().type()).isEqualTo(ProviderEvent.Type.TURN_STARTED);
        AudioFrame frame = events.next().audio();
        assertThat(frame.sampleRate()).isEqualTo(48000);
        assertThat(frame.channels()).isEqualTo(1);
        assertThat(frame.samples()).containsExactly((short) 200, (short) -200);
        assertThat(events.next().text()).isEqualTo("Hello friend");
        assertThat(events.next().type()).isEqualTo(ProviderEvent.Type.TURN_COMPLETED);
    }

    @Test
    void shouldSkipUnreadableAudioChunks() throws Exception {
        adapter.connect(new ProviderCredentials("hume-key", null), null, null).block(Duration.ofSeconds(5));
        String notWav = Base64.getEncoder().encodeToString("definitely not a wav".getBytes());

        upstream.send("{\"type\":\"audio_output\",\"data\":\"" + notWav + "\"}");
        upstream.send("{\"type\":\"user_message\",\"message\":{\"role\":\"user\",\"content\":\"Are you there?\"}}");

        ProviderEvent event = events.next();
        assertThat(event.type()).isEqualTo(ProviderEvent.Type.USER_UTTERANCE_TRANSCRIBED);
        assertThat(event.text()).isEqualTo("Are you there?");
        assertThat(adapter.state()).isEqualTo(AdapterState.READY);
    }

    @Test
    void shouldReportErrorsAfterReadiness() throws Exception {
        adapter.connect(new ProviderCredentials("hume-key", null), null, null).block(Duration.ofSeconds(5));

        upstream.send("{\"type\":\"error\",\"code\":\"E0714\",\"message\":\"Rate limited\"}");

        ProviderEvent event = events.next();
        assertThat(event.type()).isEqualTo(ProviderEvent.Type.UPSTREAM_ERROR);
        assertThat(event.code()).isEqualTo("E0714");
        assertThat(event.text()).isEqualTo("Rate limited");
    }

    @Test
    void shouldSendMicrophoneAudioAsLinear16() throws Exception {
        adapter.connect(new ProviderCredentials("hume-key", null), null, null).block(Duration.ofSeconds(5));
        byte[] pcm = Pcm16.toBytes(new short[] {1, 2, 3, 4});

        adapter.sendAudio(AudioFrame.pcm16Mono(pcm, 16000));

        JsonObject input = upstream.next("audio_input");
        assertThat(Base64.getDecoder().decode(input.get("data").getAsString())).isEqualTo(pcm);
    }
}
