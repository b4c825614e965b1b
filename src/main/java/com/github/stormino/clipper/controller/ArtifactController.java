package com.github.stormino.clipper.controller;

import com.github.stormino.clipper.exception.NotFoundException;
import com.github.stormino.clipper.model.RetrievedArtifact;
import com.github.stormino.clipper.service.ArtifactStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.nio.file.Files;
import java.util.regex.Pattern;

@Slf4j
@RestController
@RequestMapping("/clips")
@RequiredArgsConstructor
public class ArtifactController {

    static final String CLIP_NOT_FOUND = "Clip not found, already downloaded or expired.";

    private static final Pattern HANDLE_PATTERN = Pattern.compile("[A-Za-z0-9_-]{43}");

    private final ArtifactStore artifactStore;

    /**
     * Download a finished clip. Each handle works once.
     */
    @GetMapping("/{handle}")
    public ResponseEntity<StreamingResponseBody> download(@PathVariable String handle) {
        if (!HANDLE_PATTERN.matcher(handle).matches()) {
            throw new NotFoundException(CLIP_NOT_FOUND);
        }
        RetrievedArtifact artifact = artifactStore.retrieve(handle)
                .orElseThrow(() -> new NotFoundException(CLIP_NOT_FOUND));

        StreamingResponseBody body = out -> {
            try (artifact) {
                Files.copy(artifact.getFile(), out);
            }
        };

        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(artifact.getContentType()))
                .contentLength(artifact.getSizeBytes())
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(artifact.getFilename()).build().toString())
                .header(HttpHeaders.CACHE_CONTROL, "no-store")
                .body(body);
    }
}
