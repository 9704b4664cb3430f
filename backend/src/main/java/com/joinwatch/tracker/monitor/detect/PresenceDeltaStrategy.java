package com.joinwatch.tracker.monitor.detect;

import com.joinwatch.tracker.config.MonitorProperties;
import com.joinwatch.tracker.monitor.model.CommunityInfo;
import com.joinwatch.tracker.monitor.model.JoinCandidate;
import com.joinwatch.tracker.monitor.model.SubjectSnapshot;
import com.joinwatch.tracker.monitor.util.PlaceholderIds;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Online-presence growth, a weak signal used only when population counts reported nothing this round.
 */
@Component
public class PresenceDeltaStrategy extends AbstractDeltaStrategy {
    public static final String NAME = "presence-delta";

    private final MonitorProperties properties;

    public PresenceDeltaStrategy(MonitorProperties properties) {
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<JoinCandidate> detect(PollContext context) {
        String field = properties.getDetector().getPresenceField();
        if (field == null || field.isBlank()) {
            return List.of();
        }
        CommunityInfo info = context.communityInfo();
        long delta = observe(context, info, field);
        if (delta <= 0 || context.emittedBy(CountDeltaStrategy.NAME) > 0) {
            return List.of();
        }
        List<JoinCandidate> candidates = new ArrayList<>();
        for (long i = 1; i <= delta; i++) {
            candidates.add(JoinCandidate.inferred(
                PlaceholderIds.forPresence(context.communityId(), context.now(), i),
                context.communityId(),
                context.communityName(),
                NAME,
                SubjectSnapshot.synthetic("online member #" + i),
                context.now()
            ));
        }
        return candidates;
    }
}
