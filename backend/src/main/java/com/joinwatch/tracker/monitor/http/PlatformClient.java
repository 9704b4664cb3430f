package com.joinwatch.tracker.monitor.http;

import com.joinwatch.tracker.monitor.model.AuditEntryView;
import com.joinwatch.tracker.monitor.model.ChannelInfo;
import com.joinwatch.tracker.monitor.model.CommunityInfo;
import com.joinwatch.tracker.monitor.model.MemberView;
import com.joinwatch.tracker.monitor.model.MessageView;

import java.util.List;

/**
 * Read and send operations against the community platform. Implementations never throw for
 * remote failures; the status is carried in the returned {@link PlatformResponse}.
 */
public interface PlatformClient {
    PlatformResponse<List<CommunityInfo>> listCommunities();

    PlatformResponse<CommunityInfo> fetchCommunity(String communityId);

    PlatformResponse<List<ChannelInfo>> listChannels(String communityId);

    PlatformResponse<List<MessageView>> fetchRecentMessages(String channelId, int limit);

    /**
     * A page of the community member list. Usually FORBIDDEN without the member-list privilege.
     */
    PlatformResponse<List<MemberView>> listMembers(String communityId, int limit);

    PlatformResponse<List<AuditEntryView>> fetchAuditLog(String communityId, int actionType, int limit);

    PlatformResponse<MemberView> fetchUser(String userId);

    PlatformResponse<String> sendDirectMessage(String recipientId, String content);
}
