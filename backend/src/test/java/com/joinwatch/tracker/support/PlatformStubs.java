package com.joinwatch.tracker.support;

import com.joinwatch.tracker.monitor.http.PlatformClient;
import com.joinwatch.tracker.monitor.http.PlatformResponse;
import com.joinwatch.tracker.monitor.http.PlatformStatus;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

public final class PlatformStubs {
    private PlatformStubs() {
    }

    /**
     * Member list and audit log answer the way they do for an account without moderation rights.
     */
    public static void denyMemberLookups(PlatformClient platformClient) {
        when(platformClient.listMembers(anyString(), anyInt()))
            .thenReturn(PlatformResponse.failure(PlatformStatus.FORBIDDEN, 403, "Missing Access"));
        when(platformClient.fetchAuditLog(anyString(), anyInt(), anyInt()))
            .thenReturn(PlatformResponse.failure(PlatformStatus.FORBIDDEN, 403, "Missing Permissions"));
    }
}
