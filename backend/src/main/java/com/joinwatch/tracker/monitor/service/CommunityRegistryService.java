package com.joinwatch.tracker.monitor.service;

import com.joinwatch.tracker.config.MonitorProperties;
import com.joinwatch.tracker.monitor.http.PlatformClient;
import com.joinwatch.tracker.monitor.http.PlatformResponse;
import com.joinwatch.tracker.monitor.model.CommunityInfo;
import com.joinwatch.tracker.monitor.model.CommunityTarget;
import com.joinwatch.tracker.monitor.model.MonitoringMode;
import com.joinwatch.tracker.monitor.persistence.CommunityRepository;
import com.joinwatch.tracker.monitor.persistence.DetectionStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Known communities and how each is watched. Rows are never deleted; exclusion is a flag.
 */
@Service
public class CommunityRegistryService {
    private static final Logger log = LoggerFactory.getLogger(CommunityRegistryService.class);

    private final CommunityRepository repository;
    private final DetectionStateRepository stateRepository;
    private final PlatformClient platformClient;
    private final MonitorProperties.Communities config;
    private final Clock clock;

    public CommunityRegistryService(
        CommunityRepository repository,
        DetectionStateRepository stateRepository,
        PlatformClient platformClient,
        MonitorProperties properties,
        Clock clock
    ) {
        this.repository = repository;
        this.stateRepository = stateRepository;
        this.platformClient = platformClient;
        this.config = properties.getCommunities();
        this.clock = clock;
    }

    /**
     * Pulls the community list from the platform and records new communities and mode changes.
     *
     * @return number of communities seen on the platform, or -1 when discovery failed or is off
     */
    public int discover() {
        if (!config.isAutoDiscover()) {
            return -1;
        }
        PlatformResponse<List<CommunityInfo>> response = platformClient.listCommunities();
        if (!response.isOk() || response.payload() == null) {
            log.warn("Community discovery failed: {} {}", response.status(), response.message());
            return -1;
        }
        List<CommunityInfo> communities = response.payload();
        int limit = Math.min(communities.size(), config.getMaxCommunities());
        if (communities.size() > limit) {
            log.warn("Found {} communities; watching the first {}", communities.size(), limit);
        }
        for (CommunityInfo info : communities.subList(0, limit)) {
            register(info.id(), info.name(), modeFor(info.id(), repository.findById(info.id())));
        }
        return communities.size();
    }

    /**
     * Creates the community if unknown and updates name or mode if they changed. A configured
     * exclusion is applied to new rows only; later changes go through {@link #exclude(String)}.
     */
    public CommunityTarget register(String id, String displayName, MonitoringMode mode) {
        CommunityTarget existing = repository.findById(id);
        if (existing == null) {
            CommunityTarget created = new CommunityTarget(id, displayName, mode, config.getExcluded().contains(id));
            repository.upsert(created, clock.instant());
            log.info("Registered community {} ({}) as {}{}", id, displayName, mode, created.excluded() ? ", excluded" : "");
            return created;
        }
        String name = displayName == null ? existing.displayName() : displayName;
        if (existing.monitoringMode() != mode || !Objects.equals(existing.displayName(), name)) {
            CommunityTarget updated = new CommunityTarget(id, name, mode, existing.excluded());
            repository.upsert(updated, clock.instant());
            if (existing.monitoringMode() != mode) {
                log.info("Community {} monitoring mode changed {} -> {}", id, existing.monitoringMode(), mode);
            }
            return updated;
        }
        return existing;
    }

    public List<CommunityTarget> listAll() {
        return repository.findAll();
    }

    public List<CommunityTarget> pollTargets() {
        Set<String> excludedByConfig = new HashSet<>(config.getExcluded());
        return repository.findAll().stream()
            .filter(CommunityTarget::isPolled)
            .filter(target -> !excludedByConfig.contains(target.id()))
            .limit(config.getMaxCommunities())
            .toList();
    }

    public CommunityTarget find(String id) {
        return repository.findById(id);
    }

    public boolean isExcluded(String id) {
        if (config.getExcluded().contains(id)) {
            return true;
        }
        CommunityTarget target = repository.findById(id);
        return target != null && target.excluded();
    }

    public boolean exclude(String id) {
        boolean changed = repository.setExcluded(id, true, clock.instant());
        if (changed) {
            int removed = stateRepository.deleteByCommunity(id);
            log.info("Excluded community {} and dropped {} detection baseline(s)", id, removed);
        }
        return changed;
    }

    public boolean include(String id) {
        boolean changed = repository.setExcluded(id, false, clock.instant());
        if (changed) {
            log.info("Included community {}", id);
        }
        return changed;
    }

    /**
     * Configured event-stream communities rely on events alone. A community that already
     * receives events without being configured for them keeps them and is polled as well.
     */
    private MonitoringMode modeFor(String id, CommunityTarget existing) {
        if (config.getEventStream().contains(id)) {
            return MonitoringMode.EVENT_STREAM;
        }
        if (existing != null && existing.monitoringMode().includesEventStream()) {
            return MonitoringMode.BOTH;
        }
        return MonitoringMode.HEURISTIC;
    }
}
