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
 * Population growth. Several count fields usually report the same growth, so the largest
 * delta across fields is taken as the number of new members. Members that can be identified
 * are reported under their real id; the rest become placeholders bound to this poll.
 */
@Component
public class CountDeltaStrategy extends AbstractDeltaStrategy {
    public static final String NAME = "count-delta";

    private final MonitorProperties properties;
    private final JoinIdentityResolver identityResolver;

    public CountDeltaStrategy(MonitorProperties properties, JoinIdentityResolver identityResolver) {
        this.properties = properties;
        this.identityResolver = identityResolver;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<JoinCandidate> detect(PollContext context) {
        CommunityInfo info = context.communityInfo();
        long growth = 0L;
        for (String field : properties.getDetector().getCountFields()) {
            growth = Math.max(growth, observe(context, info, field));
        }
        if (growth <= 0) {
            return List.of();
        }
        List<JoinCandidate> candidates = new ArrayList<>();
        for (JoinIdentityResolver.ResolvedMember member : identityResolver.resolve(context, growth)) {
            candidates.add(JoinCandidate.inferred(
                member.subjectId(),
                context.communityId(),
                context.communityName(),
                NAME,
                member.snapshot(),
                context.now()
            ));
        }
        long unknown = growth - candidates.size();
        for (long index = 1; index <= unknown; index++) {
            candidates.add(JoinCandidate.inferred(
                PlaceholderIds.forPopulationGrowth(context.communityId(), context.now(), index),
                context.communityId(),
                context.communityName(),
                NAME,
                SubjectSnapshot.synthetic("new member " + index + " of " + growth),
                context.now()
            ));
        }
        return candidates;
    }
}
