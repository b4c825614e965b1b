package com.github.stormino.clipper.service;

import com.github.stormino.clipper.model.JobStatus;
import com.github.stormino.clipper.model.JobView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Pushes job snapshots to server-sent event subscribers.
 * Subscriptions end when the job reaches a terminal state.
 */
@Slf4j
@Service
public class JobEventBroadcaster {

    static final String EVENT_NAME = "status";
    private static final long EMITTER_TIMEOUT_MS = 10 * 60 * 1000L;

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<SseEmitter>> emitters = new ConcurrentHashMap<>();

    /**
     * Register a subscriber and send it the current snapshot.
     */
    public SseEmitter subscribe(JobView current) {
        SseEmitter emitter = new SseEmitter(EMITTER_TIMEOUT_MS);
        String jobId = current.getJobId();

        if (isTerminal(current)) {
            sendAndComplete(emitter, current);
            return emitter;
        }

        emitters.computeIfAbsent(jobId, k -> new CopyOnWriteArrayList<>()).add(emitter);
        emitter.onCompletion(() -> removeEmitter(jobId, emitter));
        emitter.onTimeout(() -> removeEmitter(jobId, emitter));
        emitter.onError(e -> removeEmitter(jobId, emitter));

        try {
            emitter.send(SseEmitter.event().name(EVENT_NAME).data(current));
        } catch (IOException e) {
            log.debug("Failed to send initial event for job {}: {}", jobId, e.getMessage());
            removeEmitter(jobId, emitter);
        }
        log.debug("SSE subscriber registered for job {}", jobId);
        return emitter;
    }

    /**
     * Broadcast a snapshot to the job's subscribers.
     */
    public void publish(JobView view) {
        String jobId = view.getJobId();
        List<SseEmitter> emitterList = isTerminal(view) ? emitters.remove(jobId) : emitters.get(jobId);
        if (emitterList == null || emitterList.isEmpty()) {
            return;
        }

        for (SseEmitter emitter : emitterList) {
            if (isTerminal(view)) {
                sendAndComplete(emitter, view);
                continue;
            }
            try {
                emitter.send(SseEmitter.event().name(EVENT_NAME).data(view));
            } catch (IOException | IllegalStateException e) {
                log.debug("Failed to send SSE event for job {}: {}", jobId, e.getMessage());
                removeEmitter(jobId, emitter);
            }
        }
    }

    public int getActiveConnections() {
        return emitters.values().stream()
                .mapToInt(CopyOnWriteArrayList::size)
                .sum();
    }

    private void sendAndComplete(SseEmitter emitter, JobView view) {
        try {
            emitter.send(SseEmitter.event().name(EVENT_NAME).data(view));
            emitter.complete();
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send final SSE event for job {}: {}", view.getJobId(), e.getMessage());
            emitter.completeWithError(e);
        }
    }

    private void removeEmitter(String jobId, SseEmitter emitter) {
        CopyOnWriteArrayList<SseEmitter> emitterList = emitters.get(jobId);
        if (emitterList != null) {
            emitterList.remove(emitter);
            if (emitterList.isEmpty()) {
                emitters.remove(jobId, emitterList);
            }
        }
    }

    private static boolean isTerminal(JobView view) {
        return view.getStatus() == JobStatus.DONE || view.getStatus() == JobStatus.ERROR;
    }
}
