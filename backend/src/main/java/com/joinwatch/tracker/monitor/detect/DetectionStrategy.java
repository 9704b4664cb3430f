package com.joinwatch.tracker.monitor.detect;

import com.joinwatch.tracker.monitor.model.JoinCandidate;

import java.util.List;

public interface DetectionStrategy {
    String name();

    /**
     * Runs one poll round for the context's community. Remote failures surface as
     * {@link com.joinwatch.tracker.monitor.http.RemoteCallException} subclasses.
     */
    List<JoinCandidate> detect(PollContext context);
}
