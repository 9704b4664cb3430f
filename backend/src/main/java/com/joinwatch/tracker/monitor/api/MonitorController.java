package com.joinwatch.tracker.monitor.api;

import com.joinwatch.tracker.monitor.http.PlatformResponse;
import com.joinwatch.tracker.monitor.model.AdmissionResult;
import com.joinwatch.tracker.monitor.model.CommunityTarget;
import com.joinwatch.tracker.monitor.model.JoinRecord;
import com.joinwatch.tracker.monitor.model.MonitorStatusResponse;
import com.joinwatch.tracker.monitor.model.SubjectSnapshot;
import com.joinwatch.tracker.monitor.service.CommunityRegistryService;
import com.joinwatch.tracker.monitor.service.DetectorDaemonService;
import com.joinwatch.tracker.monitor.service.EventStreamListener;
import com.joinwatch.tracker.monitor.service.JoinExportService;
import com.joinwatch.tracker.monitor.service.MonitorStatusService;
import com.joinwatch.tracker.monitor.service.NotificationDispatcher;
import com.joinwatch.tracker.monitor.util.SnowflakeUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.springframework.http.HttpStatus.BAD_GATEWAY;
import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class MonitorController {
    private final MonitorStatusService statusService;
    private final JoinExportService exportService;
    private final CommunityRegistryService registry;
    private final DetectorDaemonService detectorDaemonService;
    private final EventStreamListener eventStreamListener;
    private final NotificationDispatcher dispatcher;

    public MonitorController(
        MonitorStatusService statusService,
        JoinExportService exportService,
        CommunityRegistryService registry,
        DetectorDaemonService detectorDaemonService,
        EventStreamListener eventStreamListener,
        NotificationDispatcher dispatcher
    ) {
        this.statusService = statusService;
        this.exportService = exportService;
        this.registry = registry;
        this.detectorDaemonService = detectorDaemonService;
        this.eventStreamListener = eventStreamListener;
        this.dispatcher = dispatcher;
    }

    @GetMapping("/status")
    public MonitorStatusResponse status() {
        return statusService.getStatus();
    }

    @GetMapping("/joins/recent")
    public List<JoinRecord> recentJoins(
        @RequestParam(name = "hours", required = false) Integer hours,
        @RequestParam(name = "communityId", required = false) String communityId,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return statusService.getRecentJoins(hours, communityId, limit);
    }

    @GetMapping("/joins/export")
    public ResponseEntity<String> exportJoins(@RequestParam(name = "hours", required = false) Integer hours) {
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"joins.csv\"")
            .contentType(new MediaType("text", "csv"))
            .body(exportService.exportCsv(hours));
    }

    @GetMapping("/communities")
    public List<CommunityTarget> communities() {
        return registry.listAll();
    }

    @PostMapping("/communities/{id}/exclude")
    public Map<String, Object> excludeCommunity(@PathVariable("id") String id) {
        requireCommunity(id);
        boolean changed = detectorDaemonService.excludeCommunity(id);
        return Map.of("communityId", id, "excluded", true, "changed", changed);
    }

    @PostMapping("/communities/{id}/include")
    public Map<String, Object> includeCommunity(@PathVariable("id") String id) {
        requireCommunity(id);
        boolean changed = detectorDaemonService.includeCommunity(id);
        return Map.of("communityId", id, "excluded", false, "changed", changed);
    }

    @PostMapping("/events/member-joined")
    public MemberJoinedResponse memberJoined(@RequestBody MemberJoinedRequest request) {
        if (request == null || isBlank(request.communityId()) || isBlank(request.subjectId())) {
            throw new ResponseStatusException(BAD_REQUEST, "communityId and subjectId are required");
        }
        SubjectSnapshot snapshot = new SubjectSnapshot(
            request.username(),
            request.displayName(),
            request.accountCreatedAt() != null
                ? request.accountCreatedAt()
                : SnowflakeUtils.creationTime(request.subjectId()),
            request.avatarUrl(),
            Boolean.TRUE.equals(request.bot()),
            Boolean.TRUE.equals(request.system()),
            false
        );
        Optional<AdmissionResult> result = eventStreamListener.accept(
            request.communityId().trim(),
            request.subjectId().trim(),
            snapshot,
            request.observedAt()
        );
        return result
            .map(admission -> new MemberJoinedResponse(true, admission.decision(), admission.joinRecordId()))
            .orElseGet(() -> new MemberJoinedResponse(false, null, null));
    }

    @PostMapping("/notifications/test")
    public Map<String, Object> sendTestNotification() {
        PlatformResponse<String> response = dispatcher.sendTestNotification();
        if (!response.isOk()) {
            throw new ResponseStatusException(BAD_GATEWAY, "Test notification failed: " + response.status());
        }
        return Map.of("status", response.status().name(), "messageId", response.payload());
    }

    private void requireCommunity(String id) {
        if (registry.find(id) == null) {
            throw new ResponseStatusException(NOT_FOUND, "Unknown community " + id);
        }
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
