package com.joinwatch.tracker.monitor.detect;

import com.joinwatch.tracker.monitor.http.PlatformClient;
import com.joinwatch.tracker.monitor.http.PlatformResponse;
import com.joinwatch.tracker.monitor.http.RemoteCallException;
import com.joinwatch.tracker.monitor.model.ChannelInfo;
import com.joinwatch.tracker.monitor.model.CommunityInfo;
import com.joinwatch.tracker.monitor.model.CommunityTarget;
import com.joinwatch.tracker.monitor.model.MessageView;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * One poll round for one community. Remote reads shared between strategies are fetched once,
 * including a failed fetch, which every later strategy sees as the same failure.
 */
public class PollContext {
    private final CommunityTarget target;
    private final DetectionState state;
    private final PlatformClient platformClient;
    private final Instant now;
    private final Map<String, Integer> emittedByStrategy = new HashMap<>();
    private final Map<String, PlatformResponse<List<MessageView>>> messagesByChannel = new HashMap<>();
    private PlatformResponse<CommunityInfo> communityInfo;
    private PlatformResponse<List<ChannelInfo>> channels;
    private RemoteCallException deferredFailure;

    public PollContext(CommunityTarget target, DetectionState state, PlatformClient platformClient, Instant now) {
        this.target = target;
        this.state = state;
        this.platformClient = platformClient;
        this.now = now;
    }

    public CommunityTarget target() {
        return target;
    }

    public String communityId() {
        return target.id();
    }

    public DetectionState state() {
        return state;
    }

    public PlatformClient platformClient() {
        return platformClient;
    }

    public Instant now() {
        return now;
    }

    public CommunityInfo communityInfo() {
        if (communityInfo == null) {
            communityInfo = platformClient.fetchCommunity(target.id());
        }
        return communityInfo.payloadOrThrow();
    }

    public List<ChannelInfo> channels() {
        if (channels == null) {
            channels = platformClient.listChannels(target.id());
        }
        List<ChannelInfo> payload = channels.payloadOrThrow();
        return payload == null ? List.of() : payload;
    }

    public List<MessageView> recentMessages(String channelId, int limit) {
        PlatformResponse<List<MessageView>> response = messagesByChannel.computeIfAbsent(
            channelId,
            id -> platformClient.fetchRecentMessages(id, limit)
        );
        List<MessageView> payload = response.payloadOrThrow();
        return payload == null ? List.of() : payload;
    }

    /**
     * Community name from the platform when already fetched this round, else the registry name.
     */
    public String communityName() {
        if (communityInfo != null && communityInfo.isOk() && communityInfo.payload() != null) {
            String name = communityInfo.payload().name();
            if (name != null && !name.isBlank()) {
                return name;
            }
        }
        return target.displayName();
    }

    void recordEmitted(String strategyName, int count) {
        emittedByStrategy.merge(strategyName, count, Integer::sum);
    }

    public int emittedBy(String strategyName) {
        return emittedByStrategy.getOrDefault(strategyName, 0);
    }

    /**
     * Records a throttling failure hit by a strategy that still produced a usable result. The
     * detector handles it after the strategy returns, as if the strategy had thrown it.
     */
    public void deferFailure(RemoteCallException failure) {
        if (deferredFailure == null) {
            deferredFailure = failure;
        }
    }

    RemoteCallException takeDeferredFailure() {
        RemoteCallException failure = deferredFailure;
        deferredFailure = null;
        return failure;
    }
}
