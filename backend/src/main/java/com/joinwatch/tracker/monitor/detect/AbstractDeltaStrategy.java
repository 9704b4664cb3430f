package com.joinwatch.tracker.monitor.detect;

import com.joinwatch.tracker.monitor.model.CommunityInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

abstract class AbstractDeltaStrategy implements DetectionStrategy {
    private static final Logger log = LoggerFactory.getLogger(AbstractDeltaStrategy.class);

    /**
     * Compares one population field against its stored baseline and moves the baseline to the
     * current value. A missing field leaves the baseline untouched; an unusable baseline is reset
     * without reporting growth.
     *
     * @return the positive growth since the last poll, or 0
     */
    protected long observe(PollContext context, CommunityInfo info, String field) {
        Long current = info.count(field);
        if (current == null) {
            return 0L;
        }
        DetectionState state = context.state();
        Long baseline = state.baseline(name(), field);
        state.updateBaseline(name(), field, current);
        if (baseline == null) {
            log.debug("Seeded {} baseline {}={} for community {}", name(), field, current, context.communityId());
            return 0L;
        }
        if (baseline < 0 || current < 0) {
            log.warn(
                "Reset corrupt {} baseline {} for community {} (was {}, now {})",
                name(),
                field,
                context.communityId(),
                baseline,
                current
            );
            return 0L;
        }
        return Math.max(0L, current - baseline);
    }
}
