package com.github.stormino.clipper.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Read-only projection of a {@link Job} as exposed to pollers.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobView {

    String jobId;
    JobStatus status;
    Integer progress;
    ErrorKind errorKind;
    String errorReason;
    String message;
    String downloadUrl;
    Instant createdAt;
    Instant startedAt;
    Instant completedAt;

    /**
     * Project a job.
     *
     * @param job Job to project
     * @param downloadUrlPrefix Prefix the retrieval handle is appended to
     * @return View of the job's current state
     */
    public static JobView of(Job job, String downloadUrlPrefix) {
        JobStatus status = job.getStatus();

        JobViewBuilder builder = JobView.builder()
                .jobId(job.getId())
                .status(status)
                .createdAt(job.getSubmittedAt())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt());

        switch (status) {
            case QUEUED:
            case WORKING:
                builder.progress(job.getProgress());
                break;
            case DONE:
                builder.progress(100);
                String handle = job.getRetrievalHandle();
                if (handle != null) {
                    builder.downloadUrl(downloadUrlPrefix + handle);
                }
                break;
            case ERROR:
                builder.errorKind(job.getErrorKind())
                        .errorReason(job.getErrorReason())
                        .message(job.getErrorMessage());
                break;
            default:
                break;
        }

        return builder.build();
    }
}
