package com.example.s2s.devicebridge;

import com.example.s2s.devicebridge.audio.AssetTranscoder;
import com.example.s2s.devicebridge.audio.FrameEncoder;
import com.example.s2s.devicebridge.audio.GainLimiter;
import com.example.s2s.devicebridge.directory.DeviceRecord;
import com.example.s2s.devicebridge.directory.FakeUserDirectory;
import com.example.s2s.devicebridge.directory.Personality;
import com.example.s2s.devicebridge.directory.PromptBuilder;
import com.example.s2s.devicebridge.directory.UserRecord;
import com.example.s2s.devicebridge.playback.PlaybackController;
import com.example.s2s.devicebridge.provider.FakeProviderAdapter;
import com.example.s2s.devicebridge.provider.ProviderCredentials;
import com.example.s2s.devicebridge.provider.ProviderDefinition;
import com.example.s2s.devicebridge.provider.ProviderRegistry;
import com.example.s2s.devicebridge.registry.ConnectionKey;
import com.example.s2s.devicebridge.registry.ConnectionRegistry;
import com.example.s2s.devicebridge.session.SessionOrchestrator;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;

class DeviceBridgeServerTest {

    private static final FrameEncoder.Factory PASS_THROUGH = () -> frame -> frame;

    private final FakeUserDirectory directory = new FakeUserDirectory();
    private final ConnectionRegistry registry = new ConnectionRegistry();
    private final List<FakeProviderAdapter> adapters = new CopyOnWriteArrayList<>();
    private final VirtualTimeScheduler meterScheduler = VirtualTimeScheduler.create();
    private DeviceBridgeServer server;
    private OkHttpClient client;
    private String baseUrl;

    @BeforeEach
    void setUp() throws InterruptedException {
        BridgeConfig config = new BridgeConfig(Map.of());
        ProviderRegistry providers = new ProviderRegistry()
            .register(new ProviderDefinition("fake", () -> {
                FakeProviderAdapter adapter = new FakeProviderAdapter();
                adapters.add(adapter);
                return adapter;
            }, new ProviderCredentials("k", null)));
        PlaybackController playback = new PlaybackController(source -> new byte[0],
            new AssetTranscoder(config.getAudioFormat(), GainLimiter.unity()), PASS_THROUGH,
            config.getAudioFormat(), Duration.ZERO, Schedulers.immediate());
        SessionOrchestrator orchestrator = new SessionOrchestrator(config, directory, providers, registry, playback,
            new PromptBuilder("p"), PASS_THROUGH, meterScheduler, Schedulers.immediate(), Clock.systemUTC());

        directory.withUser("token-1", UserRecord.builder("user-1")
            .personality(new Personality("k", "fake", null, "t", null, null, null, 1.0))
            .device(DeviceRecord.of("dev-1"))
            .build());

        CountDownLatch started = new CountDownLatch(1);
        server = new DeviceBridgeServer(new InetSocketAddress("localhost", 0), orchestrator) {
            @Override
            public void onStart() {
                super.onStart();
                started.countDown();
            }
        };
        server.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        baseUrl = "ws://localhost:" + server.getPort();
        client = new OkHttpClient();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        client.dispatcher().executorService().shutdown();
        server.stop(1000);
        meterScheduler.dispose();
    }

    private DeviceClient connect(String path, String token) {
        Request.Builder request = new Request.Builder().url(baseUrl + path);
        if (token != null) {
            request.header("Authorization", "Bearer " + token);
        }
        DeviceClient device = new DeviceClient();
        client.newWebSocket(request.build(), device);
        return device;
    }

    @Test
    void shouldParseConnectionPaths() {
        assertThat(DeviceBridgeServer.isPrimaryPath("/")).isTrue();
        assertThat(DeviceBridgeServer.isPrimaryPath("/?fw=1.2")).isTrue();
        assertThat(DeviceBridgeServer.isPrimaryPath("/other")).isFalse();
        assertThat(DeviceBridgeServer.commandChannelDeviceId("/ws/device/dev-1/asset")).isEqualTo("dev-1");
        assertThat(DeviceBridgeServer.commandChannelDeviceId("/ws/device/dev-1/asset/?x=1")).isEqualTo("dev-1");
        assertThat(DeviceBridgeServer.commandChannelDeviceId("/ws/device//asset")).isNull();
        assertThat(DeviceBridgeServer.commandChannelDeviceId("/")).isNull();
    }

    @Test
    void shouldAnswerUnauthorizedWhenTheTokenIsMissing() throws Exception {
        DeviceClient anonymous = connect("/", null);

        assertThat(anonymous.failed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(anonymous.refusalStatus).isEqualTo(401);
        assertThat(adapters).isEmpty();
        assertThat(registry.lookup(ConnectionKey.primary("dev-1"))).isEmpty();
    }

    @Test
    void shouldAnswerUnauthorizedWhenTheTokenIsUnknown() throws Exception {
        DeviceClient wrongToken = connect("/", "nope");

        assertThat(wrongToken.failed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(wrongToken.refusalStatus).isEqualTo(401);
        assertThat(adapters).isEmpty();
    }

    @Test
    void shouldRefuseCommandChannelsOfOtherDevices() throws Exception {
        DeviceClient intruder = connect("/ws/device/dev-2/asset", "token-1");

        assertThat(intruder.failed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(intruder.refusalStatus).isEqualTo(401);
        assertThat(registry.lookup(ConnectionKey.commandChannel("dev-2"))).isEmpty();
    }

    @Test
    void shouldAnswerNotFoundForUnknownPaths() throws Exception {
        DeviceClient lost = connect("/elsewhere", "token-1");

        assertThat(lost.failed.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(lost.refusalStatus).isEqualTo(404);
        assertThat(adapters).isEmpty();
    }

    @Test
    void shouldKeepServingAfterARefusal() throws Exception {
        DeviceClient refused = connect("/", "nope");
        assertThat(refused.failed.await(5, TimeUnit.SECONDS)).isTrue();

        DeviceClient device = connect("/", "token-1");

        assertThat(device.next().get("type").getAsString()).isEqualTo("auth");
    }

    @Test
    void shouldBridgeAnAuthenticatedDevice() throws Exception {
        // Arrange
        DeviceClient device = connect("/", "token-1");
        JsonObject auth = device.next();
        assertThat(auth.get("type").getAsString()).isEqualTo("auth");

        // Act
        adapters.get(0).ready();
        JsonObject created = device.next();
        device.socket.send(ByteString.of((byte) 7, (byte) 0));

        // Assert
        assertThat(created.get("msg").getAsString()).isEqualTo("SESSION.CREATED");
        awaitCondition(() -> adapters.get(0).sent.size() == 1);
        assertThat(adapters.get(0).sent.get(0).data()).containsExactly(7, 0);
        assertThat(registry.lookup(ConnectionKey.primary("dev-1"))).isPresent();
    }

    @Test
    void shouldTearDownWhenTheDeviceDisconnects() throws Exception {
        DeviceClient device = connect("/", "token-1");
        device.next();
        adapters.get(0).ready();

        device.socket.close(1000, "bye");

        awaitCondition(() -> registry.lookup(ConnectionKey.primary("dev-1")).isEmpty());
        awaitCondition(() -> adapters.get(0).closeCalls == 1);
        assertThat(directory.persistCalls).hasSize(1);
    }

    @Test
    void shouldForwardCommandsFromTheCommandChannel() throws Exception {
        DeviceClient device = connect("/", "token-1");
        device.next();
        DeviceClient command = connect("/ws/device/dev-1/asset", "token-1");
        awaitCondition(() -> registry.lookup(ConnectionKey.commandChannel("dev-1")).isPresent());
        awaitCondition(() -> command.socket != null);

        command.socket.send("{\"type\":\"asset_command\",\"command\":\"pause\"}");

        JsonObject forwarded = command.next();
        assertThat(forwarded.get("type").getAsString()).isEqualTo("asset_command");
        assertThat(forwarded.get("command").getAsString()).isEqualTo("pause");
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            Thread.sleep(20);
        }
    }

    private static class DeviceClient extends WebSocketListener {
        private final BlockingQueue<JsonObject> messages = new LinkedBlockingQueue<>();
        private final CountDownLatch failed = new CountDownLatch(1);
        private volatile WebSocket socket;
        private volatile int refusalStatus = -1;

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            socket = webSocket;
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            messages.add(JsonParser.parseString(text).getAsJsonObject());
        }

        @Override
        public void onClosing(WebSocket webSocket, int code, String reason) {
            webSocket.close(1000, null);
        }

        @Override
        public void onFailure(WebSocket webSocket, Throwable t, Response response) {
            if (response != null) {
                refusalStatus = response.code();
            }
            failed.countDown();
        }

        JsonObject next() throws InterruptedException {
            JsonObject message = messages.poll(5, TimeUnit.SECONDS);
            if (message == null) {
                throw new AssertionError("no message within 5s");
            }
            return message;
        }
    }
}
