package com.joinwatch.tracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "monitor")
public class MonitorProperties {
    private static final String DEFAULT_USER_AGENT = "join-watch/0.1 (+contact)";
    private static final String DEFAULT_API_BASE_URL = "https://discord.com/api/v10";

    private String userAgent;
    private String apiBaseUrl = DEFAULT_API_BASE_URL;
    private String authToken;
    private int globalConcurrency = 4;
    private int minRequestSpacingMs = 1000;
    private int requestTimeoutSeconds = 20;
    private int requestMaxRetries = 2;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5000;
    private Detector detector = new Detector();
    private Communities communities = new Communities();
    private Dedup dedup = new Dedup();
    private Dispatch dispatch = new Dispatch();
    private Notifications notifications = new Notifications();
    private Retention retention = new Retention();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public String getApiBaseUrl() {
        return normalizeBaseUrl(apiBaseUrl);
    }

    public void setApiBaseUrl(String apiBaseUrl) {
        this.apiBaseUrl = normalizeBaseUrl(apiBaseUrl);
    }

    public String getAuthToken() {
        return authToken;
    }

    public void setAuthToken(String authToken) {
        this.authToken = authToken == null ? null : authToken.trim();
    }

    public int getGlobalConcurrency() {
        return Math.max(1, globalConcurrency);
    }

    public void setGlobalConcurrency(int globalConcurrency) {
        this.globalConcurrency = Math.max(1, globalConcurrency);
    }

    public int getMinRequestSpacingMs() {
        return Math.max(0, minRequestSpacingMs);
    }

    public void setMinRequestSpacingMs(int minRequestSpacingMs) {
        this.minRequestSpacingMs = Math.max(0, minRequestSpacingMs);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = requestMaxRetries;
    }

    public int getRequestRetryBaseDelayMs() {
        return requestRetryBaseDelayMs;
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
    }

    public int getRequestRetryMaxDelayMs() {
        return requestRetryMaxDelayMs;
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    public Detector getDetector() {
        return detector;
    }

    public void setDetector(Detector detector) {
        this.detector = detector;
    }

    public Communities getCommunities() {
        return communities;
    }

    public void setCommunities(Communities communities) {
        this.communities = communities;
    }

    public Dedup getDedup() {
        return dedup;
    }

    public void setDedup(Dedup dedup) {
        this.dedup = dedup;
    }

    public Dispatch getDispatch() {
        return dispatch;
    }

    public void setDispatch(Dispatch dispatch) {
        this.dispatch = dispatch;
    }

    public Notifications getNotifications() {
        return notifications;
    }

    public void setNotifications(Notifications notifications) {
        this.notifications = notifications;
    }

    public Retention getRetention() {
        return retention;
    }

    public void setRetention(Retention retention) {
        this.retention = retention;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    static String normalizeBaseUrl(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_API_BASE_URL;
        }
        String value = candidate.trim();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    public static class Detector {
        private boolean enabled = true;
        private int workerThreads = 4;
        private int pollIntervalSeconds = 7;
        private int heartbeatStaleMinutes = 5;
        private int rateLimitBackoffSeconds = 30;
        private int maxChannels = 5;
        private int messagesPerChannel = 20;
        private int activityWindowSeconds = 300;
        private int newAccountDays = 30;
        private boolean identityLookup = true;
        private int memberLookupLimit = 10;
        private int auditLogLimit = 5;
        private List<String> countFields = new ArrayList<>(List.of("approximate_member_count", "member_count"));
        private String presenceField = "approximate_presence_count";
        private List<String> priorityChannelKeywords = new ArrayList<>(
            List.of("welcome", "general", "chat", "lobby", "main", "join", "new", "member")
        );

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWorkerThreads() {
            return Math.max(1, workerThreads);
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = Math.max(1, workerThreads);
        }

        public int getPollIntervalSeconds() {
            return Math.max(1, pollIntervalSeconds);
        }

        public void setPollIntervalSeconds(int pollIntervalSeconds) {
            this.pollIntervalSeconds = Math.max(1, pollIntervalSeconds);
        }

        public int getHeartbeatStaleMinutes() {
            return Math.max(1, heartbeatStaleMinutes);
        }

        public void setHeartbeatStaleMinutes(int heartbeatStaleMinutes) {
            this.heartbeatStaleMinutes = Math.max(1, heartbeatStaleMinutes);
        }

        public int getRateLimitBackoffSeconds() {
            return Math.max(1, rateLimitBackoffSeconds);
        }

        public void setRateLimitBackoffSeconds(int rateLimitBackoffSeconds) {
            this.rateLimitBackoffSeconds = Math.max(1, rateLimitBackoffSeconds);
        }

        public int getMaxChannels() {
            return Math.max(1, maxChannels);
        }

        public void setMaxChannels(int maxChannels) {
            this.maxChannels = Math.max(1, maxChannels);
        }

        public int getMessagesPerChannel() {
            return Math.max(1, Math.min(messagesPerChannel, 100));
        }

        public void setMessagesPerChannel(int messagesPerChannel) {
            this.messagesPerChannel = Math.max(1, Math.min(messagesPerChannel, 100));
        }

        public boolean isIdentityLookup() {
            return identityLookup;
        }

        public void setIdentityLookup(boolean identityLookup) {
            this.identityLookup = identityLookup;
        }

        public int getMemberLookupLimit() {
            return Math.max(1, Math.min(memberLookupLimit, 1000));
        }

        public void setMemberLookupLimit(int memberLookupLimit) {
            this.memberLookupLimit = Math.max(1, Math.min(memberLookupLimit, 1000));
        }

        public int getAuditLogLimit() {
            return Math.max(1, Math.min(auditLogLimit, 100));
        }

        public void setAuditLogLimit(int auditLogLimit) {
            this.auditLogLimit = Math.max(1, Math.min(auditLogLimit, 100));
        }

        public int getActivityWindowSeconds() {
            return Math.max(1, activityWindowSeconds);
        }

        public void setActivityWindowSeconds(int activityWindowSeconds) {
            this.activityWindowSeconds = Math.max(1, activityWindowSeconds);
        }

        public int getNewAccountDays() {
            return Math.max(1, newAccountDays);
        }

        public void setNewAccountDays(int newAccountDays) {
            this.newAccountDays = Math.max(1, newAccountDays);
        }

        public List<String> getCountFields() {
            return countFields;
        }

        public void setCountFields(List<String> countFields) {
            this.countFields = countFields == null ? new ArrayList<>() : new ArrayList<>(countFields);
        }

        public String getPresenceField() {
            return presenceField;
        }

        public void setPresenceField(String presenceField) {
            this.presenceField = presenceField;
        }

        public List<String> getPriorityChannelKeywords() {
            return priorityChannelKeywords;
        }

        public void setPriorityChannelKeywords(List<String> priorityChannelKeywords) {
            this.priorityChannelKeywords = priorityChannelKeywords == null
                ? new ArrayList<>()
                : new ArrayList<>(priorityChannelKeywords);
        }
    }

    public static class Communities {
        private boolean autoDiscover = true;
        private int maxCommunities = 100;
        private int refreshMinutes = 10;
        private List<String> excluded = new ArrayList<>();
        private List<String> eventStream = new ArrayList<>();

        public boolean isAutoDiscover() {
            return autoDiscover;
        }

        public void setAutoDiscover(boolean autoDiscover) {
            this.autoDiscover = autoDiscover;
        }

        public int getMaxCommunities() {
            return Math.max(1, maxCommunities);
        }

        public void setMaxCommunities(int maxCommunities) {
            this.maxCommunities = Math.max(1, maxCommunities);
        }

        public int getRefreshMinutes() {
            return Math.max(1, refreshMinutes);
        }

        public void setRefreshMinutes(int refreshMinutes) {
            this.refreshMinutes = Math.max(1, refreshMinutes);
        }

        public List<String> getExcluded() {
            return excluded;
        }

        public void setExcluded(List<String> excluded) {
            this.excluded = excluded == null ? new ArrayList<>() : new ArrayList<>(excluded);
        }

        public List<String> getEventStream() {
            return eventStream;
        }

        public void setEventStream(List<String> eventStream) {
            this.eventStream = eventStream == null ? new ArrayList<>() : new ArrayList<>(eventStream);
        }
    }

    public static class Dedup {
        private int windowHours = 24;

        public int getWindowHours() {
            return Math.max(1, windowHours);
        }

        public void setWindowHours(int windowHours) {
            this.windowHours = Math.max(1, windowHours);
        }
    }

    public static class Dispatch {
        private boolean workerEnabled = true;
        private int maxAttempts = 3;
        private List<Integer> retryBackoffSeconds = new ArrayList<>(List.of(30, 120, 600));
        private int tokenCapacity = 5;
        private int tokensPerRefill = 1;
        private int refillIntervalMs = 1000;
        private int acquireTimeoutMs = 10000;
        private int retryScanIntervalSeconds = 15;

        public boolean isWorkerEnabled() {
            return workerEnabled;
        }

        public void setWorkerEnabled(boolean workerEnabled) {
            this.workerEnabled = workerEnabled;
        }

        public int getMaxAttempts() {
            return Math.max(2, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(2, maxAttempts);
        }

        public List<Integer> getRetryBackoffSeconds() {
            if (retryBackoffSeconds == null || retryBackoffSeconds.isEmpty()) {
                return List.of(30);
            }
            return retryBackoffSeconds;
        }

        public void setRetryBackoffSeconds(List<Integer> retryBackoffSeconds) {
            this.retryBackoffSeconds = retryBackoffSeconds == null ? new ArrayList<>() : new ArrayList<>(retryBackoffSeconds);
        }

        public int getTokenCapacity() {
            return Math.max(1, tokenCapacity);
        }

        public void setTokenCapacity(int tokenCapacity) {
            this.tokenCapacity = Math.max(1, tokenCapacity);
        }

        public int getTokensPerRefill() {
            return Math.max(1, tokensPerRefill);
        }

        public void setTokensPerRefill(int tokensPerRefill) {
            this.tokensPerRefill = Math.max(1, tokensPerRefill);
        }

        public int getRefillIntervalMs() {
            return Math.max(1, refillIntervalMs);
        }

        public void setRefillIntervalMs(int refillIntervalMs) {
            this.refillIntervalMs = Math.max(1, refillIntervalMs);
        }

        public int getAcquireTimeoutMs() {
            return Math.max(0, acquireTimeoutMs);
        }

        public void setAcquireTimeoutMs(int acquireTimeoutMs) {
            this.acquireTimeoutMs = Math.max(0, acquireTimeoutMs);
        }

        public int getRetryScanIntervalSeconds() {
            return Math.max(1, retryScanIntervalSeconds);
        }

        public void setRetryScanIntervalSeconds(int retryScanIntervalSeconds) {
            this.retryScanIntervalSeconds = Math.max(1, retryScanIntervalSeconds);
        }
    }

    public static class Notifications {
        private String targetUserId;
        private boolean detailedFormat = true;
        private boolean errorNoticesEnabled = true;
        private boolean ignoreBots = true;
        private boolean ignoreSystem = true;
        private int minimumAccountAgeDays = 0;
        private UserDetails userDetails = new UserDetails();

        public String getTargetUserId() {
            return targetUserId;
        }

        public void setTargetUserId(String targetUserId) {
            this.targetUserId = targetUserId == null ? null : targetUserId.trim();
        }

        public boolean isDetailedFormat() {
            return detailedFormat;
        }

        public void setDetailedFormat(boolean detailedFormat) {
            this.detailedFormat = detailedFormat;
        }

        public boolean isErrorNoticesEnabled() {
            return errorNoticesEnabled;
        }

        public void setErrorNoticesEnabled(boolean errorNoticesEnabled) {
            this.errorNoticesEnabled = errorNoticesEnabled;
        }

        public boolean isIgnoreBots() {
            return ignoreBots;
        }

        public void setIgnoreBots(boolean ignoreBots) {
            this.ignoreBots = ignoreBots;
        }

        public boolean isIgnoreSystem() {
            return ignoreSystem;
        }

        public void setIgnoreSystem(boolean ignoreSystem) {
            this.ignoreSystem = ignoreSystem;
        }

        public int getMinimumAccountAgeDays() {
            return Math.max(0, minimumAccountAgeDays);
        }

        public void setMinimumAccountAgeDays(int minimumAccountAgeDays) {
            this.minimumAccountAgeDays = Math.max(0, minimumAccountAgeDays);
        }

        public UserDetails getUserDetails() {
            return userDetails;
        }

        public void setUserDetails(UserDetails userDetails) {
            this.userDetails = userDetails;
        }
    }

    public static class UserDetails {
        private boolean includeUsername = true;
        private boolean includeDisplayName = true;
        private boolean includeUserId = true;
        private boolean includeAccountAge = true;
        private boolean includeAvatar = true;
        private boolean includeJoinDate = true;

        public boolean isIncludeUsername() {
            return includeUsername;
        }

        public void setIncludeUsername(boolean includeUsername) {
            this.includeUsername = includeUsername;
        }

        public boolean isIncludeDisplayName() {
            return includeDisplayName;
        }

        public void setIncludeDisplayName(boolean includeDisplayName) {
            this.includeDisplayName = includeDisplayName;
        }

        public boolean isIncludeUserId() {
            return includeUserId;
        }

        public void setIncludeUserId(boolean includeUserId) {
            this.includeUserId = includeUserId;
        }

        public boolean isIncludeAccountAge() {
            return includeAccountAge;
        }

        public void setIncludeAccountAge(boolean includeAccountAge) {
            this.includeAccountAge = includeAccountAge;
        }

        public boolean isIncludeAvatar() {
            return includeAvatar;
        }

        public void setIncludeAvatar(boolean includeAvatar) {
            this.includeAvatar = includeAvatar;
        }

        public boolean isIncludeJoinDate() {
            return includeJoinDate;
        }

        public void setIncludeJoinDate(boolean includeJoinDate) {
            this.includeJoinDate = includeJoinDate;
        }
    }

    public static class Retention {
        private boolean enabled = true;
        private int days = 90;
        private int cleanupIntervalHours = 24;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getDays() {
            return Math.max(1, days);
        }

        public void setDays(int days) {
            this.days = Math.max(1, days);
        }

        public int getCleanupIntervalHours() {
            return Math.max(1, cleanupIntervalHours);
        }

        public void setCleanupIntervalHours(int cleanupIntervalHours) {
            this.cleanupIntervalHours = Math.max(1, cleanupIntervalHours);
        }
    }
}
