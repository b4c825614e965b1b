package com.github.stormino.clipper.service;

import com.github.stormino.clipper.config.ClipperProperties;
import com.github.stormino.clipper.model.Artifact;
import com.github.stormino.clipper.model.Job;
import com.github.stormino.clipper.model.JobView;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.Optional;

/**
 * Read side of the job pipeline. Never mutates a job.
 * A job record is dropped as soon as its clip is retrieved or expires.
 */
@Slf4j
@Service
public class JobStatusService implements ArtifactListener {

    private final JobRegistry registry;
    private final JobEventBroadcaster broadcaster;
    private final String downloadUrlPrefix;

    public JobStatusService(JobRegistry registry, JobEventBroadcaster broadcaster,
                            ArtifactStore artifactStore, ClipperProperties properties) {
        this.registry = registry;
        this.broadcaster = broadcaster;
        this.downloadUrlPrefix = properties.getArtifacts().getDownloadUrlPrefix();
        artifactStore.addListener(this);
    }

    public Optional<JobView> getStatus(@NonNull String jobId) {
        return registry.find(jobId).map(this::view);
    }

    /**
     * Open an event stream for a job, starting with its current snapshot.
     */
    public Optional<SseEmitter> subscribe(@NonNull String jobId) {
        return registry.find(jobId).map(job -> {
            SseEmitter emitter = broadcaster.subscribe(view(job));
            // The job may have finished between the snapshot and the registration
            if (job.isTerminal()) {
                broadcaster.publish(view(job));
            }
            return emitter;
        });
    }

    /**
     * Push the job's current snapshot to its subscribers.
     */
    public void publish(@NonNull Job job) {
        broadcaster.publish(view(job));
    }

    @Override
    public void onArtifactRetrieved(Artifact artifact) {
        registry.remove(artifact.getJobId());
    }

    @Override
    public void onArtifactExpired(Artifact artifact) {
        registry.remove(artifact.getJobId());
    }

    private JobView view(Job job) {
        return JobView.of(job, downloadUrlPrefix);
    }
}
