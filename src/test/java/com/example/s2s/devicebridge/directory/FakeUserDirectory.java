package com.example.s2s.devicebridge.directory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory directory keyed by bearer token.
 */
public class FakeUserDirectory implements UserDirectory {
    public final Map<String, UserRecord> usersByToken = new ConcurrentHashMap<>();
    public final Map<String, Long> persistedSeconds = new ConcurrentHashMap<>();
    public final List<Long> persistCalls = new CopyOnWriteArrayList<>();
    public final List<String> conversation = new CopyOnWriteArrayList<>();
    public final List<String> assetStatuses = new CopyOnWriteArrayList<>();
    public volatile Integer volume;

    public FakeUserDirectory withUser(String token, UserRecord user) {
        usersByToken.put(token, user);
        return this;
    }

    @Override
    public UserRecord resolveUser(String bearerToken) throws AuthFailureException {
        UserRecord user = usersByToken.get(bearerToken);
        if (user == null) {
            throw new AuthFailureException("Unknown token");
        }
        return user;
    }

    @Override
    public void persistUsageSeconds(String userId, long seconds) {
        persistedSeconds.put(userId, seconds);
        persistCalls.add(seconds);
    }

    @Override
    public void recordConversation(UserRecord user, String role, String content) {
        conversation.add(role + ": " + content);
    }

    @Override
    public void recordAssetStatus(String deviceId, String status, Integer position) {
        assetStatuses.add(deviceId + " " + status + " " + position);
    }

    @Override
    public Optional<Integer> currentVolume(UserRecord user) {
        return Optional.ofNullable(volume);
    }
}
