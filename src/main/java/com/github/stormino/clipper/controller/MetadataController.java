package com.github.stormino.clipper.controller;

import com.github.stormino.clipper.model.MediaMetadata;
import com.github.stormino.clipper.model.MetadataRequest;
import com.github.stormino.clipper.service.MetadataService;
import com.github.stormino.clipper.util.ClientIdResolver;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
public class MetadataController {

    private final MetadataService metadataService;

    /**
     * Look up a source video before clipping it
     */
    @PostMapping("/metadata")
    public ResponseEntity<MediaMetadata> getMetadata(@Valid @RequestBody MetadataRequest request,
                                                     HttpServletRequest httpRequest) {
        String clientId = ClientIdResolver.resolve(request.getClientId(), httpRequest);
        log.info("Fetching metadata for client {}: {}", clientId, request.getUrl());
        return ResponseEntity.ok(metadataService.probe(request.getUrl(), clientId));
    }
}
