package com.github.stormino.clipper.controller;

import com.github.stormino.clipper.exception.NotFoundException;
import com.github.stormino.clipper.model.ClipRequest;
import com.github.stormino.clipper.model.Job;
import com.github.stormino.clipper.model.JobCreatedResponse;
import com.github.stormino.clipper.model.JobView;
import com.github.stormino.clipper.service.AdmissionService;
import com.github.stormino.clipper.service.JobStatusService;
import com.github.stormino.clipper.util.ClientIdResolver;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.net.URI;

@Slf4j
@RestController
@RequestMapping("/jobs")
@RequiredArgsConstructor
public class JobController {

    static final String JOB_NOT_FOUND = "Job not found or has expired.";

    private final AdmissionService admissionService;
    private final JobStatusService statusService;

    /**
     * Submit a clip request
     */
    @PostMapping
    public ResponseEntity<JobCreatedResponse> createJob(@Valid @RequestBody ClipRequest request,
                                                        HttpServletRequest httpRequest) {
        String clientId = ClientIdResolver.resolve(request.getClientId(), httpRequest);
        Job job = admissionService.admit(request, clientId);
        return ResponseEntity.created(URI.create("/jobs/" + job.getId()))
                .body(new JobCreatedResponse(job.getId()));
    }

    /**
     * Poll job status
     */
    @GetMapping("/{jobId}")
    public ResponseEntity<JobView> getJob(@PathVariable String jobId) {
        return statusService.getStatus(jobId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new NotFoundException(JOB_NOT_FOUND));
    }

    /**
     * Stream job status changes
     */
    @GetMapping("/{jobId}/events")
    public SseEmitter streamJob(@PathVariable String jobId) {
        log.debug("New SSE connection for job {}", jobId);
        return statusService.subscribe(jobId)
                .orElseThrow(() -> new NotFoundException(JOB_NOT_FOUND));
    }
}
