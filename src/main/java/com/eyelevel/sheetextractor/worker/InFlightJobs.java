package com.eyelevel.sheetextractor.worker;

import com.eyelevel.sheetextractor.store.ClaimedJob;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Jobs currently running in this process, with the queue handle of the message that delivered them.
 */
@Component
public class InFlightJobs {

    public record InFlightJob(ClaimedJob claim, String ackHandle) {
    }

    private final Map<UUID, InFlightJob> jobs = new ConcurrentHashMap<>();

    public void register(final ClaimedJob claim, final String ackHandle) {
        jobs.put(claim.jobId(), new InFlightJob(claim, ackHandle));
    }

    public void remove(final UUID jobId) {
        jobs.remove(jobId);
    }

    public List<InFlightJob> snapshot() {
        return List.copyOf(jobs.values());
    }

    public boolean isEmpty() {
        return jobs.isEmpty();
    }
}
