/*
 *
 * This program is free software; you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation; either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, write to the Free Software Foundation, Inc.,
 * 51 Franklin Street, Fifth Floor, Boston, MA 02110-1301 USA.
 */


package com.example.s2s.devicebridge.playback;

import com.example.s2s.devicebridge.audio.AssetTranscoder;
import com.example.s2s.devicebridge.audio.DeviceAudioFormat;
import com.example.s2s.devicebridge.audio.FrameEncoder;
import com.example.s2s.devicebridge.audio.TranscodeException;
import com.example.s2s.devicebridge.registry.DeviceChannel;
import com.example.s2s.devicebridge.session.DeviceMessages;
import com.example.s2s.devicebridge.session.Session;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Scheduler;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Streams stored assets to devices at real-time pace.
 *
 * Each {@link #play} takes a new stream token from the session; a running
 * loop re-checks its token before every frame and stops as soon as it is no
 * longer current. Nothing here blocks the caller.
 *
 * A paused stream remembers its asset and the next frame to send, so
 * {@link #resume} continues where the device left off. Playing, stopping or
 * cancelling forgets it.
 */
public class PlaybackController {
    private static final Logger LOG = LoggerFactory.getLogger(PlaybackController.class);

    private final AssetResolver resolver;
    private final AssetTranscoder transcoder;
    private final FrameEncoder.Factory encoderFactory;
    private final Scheduler scheduler;
    private final long paceMillis;
    private final long frameMillis;
    private final Map<Session, StreamCursor> active = new ConcurrentHashMap<>();
    private final Map<Session, StreamCursor> paused = new ConcurrentHashMap<>();

    /**
     * @param safetyMargin how much earlier than real time each frame is sent
     * @param scheduler    runs the blocking stream loops (bounded elastic in production)
     */
    public PlaybackController(AssetResolver resolver, AssetTranscoder transcoder, FrameEncoder.Factory encoderFactory,
                              DeviceAudioFormat format, Duration safetyMargin, Scheduler scheduler) {
        this.resolver = resolver;
        this.transcoder = transcoder;
        this.encoderFactory = encoderFactory;
        this.scheduler = scheduler;
        this.frameMillis = format.frameDuration().toMillis();
        this.paceMillis = Math.max(0, format.frameDuration().minus(safetyMargin).toMillis());
    }

    /**
     * Supersedes any stream in progress and starts streaming {@code source}.
     *
     * @return the token of the new stream
     */
    public long play(Session session, AssetSource source) {
        paused.remove(session);
        return start(session, source, 0);
    }

    /**
     * Halts the stream in progress and remembers its position.
     *
     * @return false if nothing was playing
     */
    public boolean pause(Session session) {
        StreamCursor cursor;
        long token;
        synchronized (session.playbackLock()) {
            cursor = active.remove(session);
            boolean live = cursor != null && session.isCurrent(cursor.token);
            token = session.advanceToken();
            if (!live) {
                LOG.debug("Nothing to pause for {}", session.getDeviceId());
                return false;
            }
            paused.put(session, cursor);
        }
        LOG.info("⏸ Stream {} paused for {} at frame {}", cursor.token, session.getDeviceId(), cursor.nextFrame);
        send(session, token, DeviceMessages.assetStatus("paused", cursor.source.getAssetId(), token,
            positionSeconds(cursor.nextFrame)));
        return true;
    }

    /**
     * Continues the paused stream from its next frame.
     *
     * @return the token of the resumed stream, or -1 if nothing was paused
     */
    public long resume(Session session) {
        StreamCursor cursor = paused.remove(session);
        if (cursor == null) {
            LOG.debug("Nothing to resume for {}", session.getDeviceId());
            return -1;
        }
        return start(session, cursor.source, cursor.nextFrame);
    }

    /**
     * Stops the stream in progress, if any, and forgets a paused one.
     */
    public void stop(Session session) {
        paused.remove(session);
        long token;
        synchronized (session.playbackLock()) {
            active.remove(session);
            token = session.advanceToken();
        }
        LOG.info("⏹ Playback stopped for {} (token now {})", session.getDeviceId(), token);
        send(session, token, DeviceMessages.assetStatus("stopped", null, token));
    }

    /**
     * Invalidates all playback state of a closing session without telling the device.
     */
    public void cancel(Session session) {
        synchronized (session.playbackLock()) {
            session.advanceToken();
            active.remove(session);
            paused.remove(session);
        }
    }

    private long start(Session session, AssetSource source, int fromFrame) {
        StreamCursor cursor;
        synchronized (session.playbackLock()) {
            cursor = new StreamCursor(source, session.advanceToken(), fromFrame);
            active.put(session, cursor);
        }
        LOG.info("▶ Stream {} for {}: {} from frame {}", cursor.token, session.getDeviceId(), source, fromFrame);
        scheduler.schedule(() -> stream(session, cursor));
        return cursor.token;
    }

    private void stream(Session session, StreamCursor cursor) {
        long token = cursor.token;
        AssetSource source = cursor.source;
        if (!session.isCurrent(token)) {
            return;
        }
        List<byte[]> frames;
        FrameEncoder encoder;
        try {
            frames = transcoder.toFrames(resolver.fetch(source));
            encoder = encoderFactory.create();
        } catch (IOException | TranscodeException e) {
            LOG.error("❌ Cannot play {} on {}: {}", source, session.getDeviceId(), e.getMessage());
            active.remove(session, cursor);
            send(session, token, DeviceMessages.error(DeviceMessages.ASSET_UNAVAILABLE, e.getMessage()));
            return;
        }

        int first = cursor.nextFrame;
        JsonObject playing = first > 0
            ? DeviceMessages.assetStatus("playing", source.getAssetId(), token, positionSeconds(first))
            : DeviceMessages.assetStatus("playing", source.getAssetId(), token);
        if (!send(session, token, playing)) {
            return;
        }

        int sent = 0;
        int failed = 0;
        for (int i = first; i < frames.size(); i++) {
            byte[] packet;
            try {
                packet = encoder.encode(frames.get(i));
            } catch (TranscodeException e) {
                failed++;
                LOG.debug("Skipping frame {} of stream {}: {}", i, token, e.getMessage());
                continue;
            }
            synchronized (session.playbackLock()) {
                if (!session.isCurrent(token) || session.isClosing()) {
                    LOG.info("Stream {} superseded after {} frames", token, sent);
                    return;
                }
                session.getChannel().sendBinary(packet);
                cursor.nextFrame = i + 1;
            }
            sent++;
            if (!pace()) {
                return;
            }
        }
        if (failed > 0) {
            LOG.warn("⚠ Stream {} skipped {} frames that failed to encode", token, failed);
        }
        active.remove(session, cursor);
        LOG.info("✓ Stream {} finished: {} frames", token, sent);
        send(session, token, DeviceMessages.assetStatus("finished", source.getAssetId(), token));
    }

    /**
     * Sends a control message if {@code token} is still current.
     */
    private boolean send(Session session, long token, JsonObject message) {
        synchronized (session.playbackLock()) {
            if (!session.isCurrent(token) || session.isClosing()) {
                return false;
            }
            DeviceChannel channel = session.getChannel();
            return channel.sendText(message.toString());
        }
    }

    private int positionSeconds(int frame) {
        return (int) (frame * frameMillis / 1000);
    }

    private boolean pace() {
        if (paceMillis == 0) {
            return true;
        }
        try {
            Thread.sleep(paceMillis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static final class StreamCursor {
        private final AssetSource source;
        private final long token;
        // guarded by the session's playback lock
        private int nextFrame;

        private StreamCursor(AssetSource source, long token, int nextFrame) {
            this.source = source;
            this.token = token;
            this.nextFrame = nextFrame;
        }
    }
}
