package com.streammeta.metadata.controller;

import com.streammeta.common.model.StreamDescriptor;
import com.streammeta.common.model.StreamSettings;
import com.streammeta.common.model.StreamType;
import com.streammeta.metadata.dto.ApiResponse;
import com.streammeta.metadata.dto.StreamListResponse;
import com.streammeta.metadata.service.StreamMetadataService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

/**
 * REST Controller for stream metadata.
 * Failures are mapped to responses by {@link com.streammeta.metadata.config.GlobalExceptionHandler}.
 */
@Slf4j
@RestController
@RequestMapping("/api/{orgId}")
@RequiredArgsConstructor
public class StreamController {

    private final StreamMetadataService streamMetadataService;

    /**
     * List streams of an org, optionally of one type
     */
    @GetMapping("/streams")
    public ResponseEntity<StreamListResponse> listStreams(
            @PathVariable String orgId,
            @RequestParam(name = "type", required = false) StreamType streamType,
            @RequestParam(name = "fetchSchema", defaultValue = "false") boolean fetchSchema) {

        log.debug("Listing streams for org: {}", orgId);
        List<StreamDescriptor> streams =
                streamMetadataService.listStreams(orgId, Optional.ofNullable(streamType), fetchSchema);
        return ResponseEntity.ok(new StreamListResponse(streams));
    }

    @GetMapping("/{streamName}/schema")
    public ResponseEntity<StreamDescriptor> getStream(
            @PathVariable String orgId,
            @PathVariable String streamName,
            @RequestParam(name = "type", defaultValue = "logs") StreamType streamType) {

        return ResponseEntity.ok(streamMetadataService.getStream(orgId, streamName, streamType));
    }

    @PostMapping("/{streamName}/settings")
    public ResponseEntity<ApiResponse> saveSettings(
            @PathVariable String orgId,
            @PathVariable String streamName,
            @RequestParam(name = "type", defaultValue = "logs") StreamType streamType,
            @RequestBody StreamSettings settings) {

        log.info("Received settings for stream: {}/{}/{}", orgId, streamType, streamName);
        streamMetadataService.saveStreamSettings(orgId, streamName, streamType, settings);
        return ResponseEntity.ok(ApiResponse.ok(""));
    }

    /**
     * Delete a stream. A failure names the teardown stage that needs a retry.
     */
    @DeleteMapping("/{streamName}")
    public ResponseEntity<ApiResponse> deleteStream(
            @PathVariable String orgId,
            @PathVariable String streamName,
            @RequestParam(name = "type", defaultValue = "logs") StreamType streamType) {

        log.info("Received request to delete stream: {}/{}/{}", orgId, streamType, streamName);
        streamMetadataService.deleteStream(orgId, streamName, streamType);
        return ResponseEntity.ok(ApiResponse.ok("stream deleted"));
    }
}
