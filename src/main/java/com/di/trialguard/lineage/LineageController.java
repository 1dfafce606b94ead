package com.di.trialguard.lineage;

import com.di.trialguard.lineage.openlineage.OpenLineageEventMapper;
import io.openlineage.client.OpenLineageClientUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for recording lineage events and walking the lineage graph.
 */
@RestController
@RequestMapping("/api/lineage")
@RequiredArgsConstructor
public class LineageController {

    private final LineageService lineageService;
    private final OpenLineageEventMapper openLineageEventMapper;

    /** Stores a finalized event. 201 with the stored event; 400 when the id is already taken. */
    @PostMapping(value = "/events",
            consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<LineageEvent> record(@RequestBody LineageEvent event) {
        return ResponseEntity.status(HttpStatus.CREATED).body(lineageService.record(event));
    }

    @GetMapping(value = "/events/{eventId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<LineageEvent> event(@PathVariable String eventId) {
        return lineageService.find(eventId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /** The stored event as an OpenLineage run event, serialized by the OpenLineage client. */
    @GetMapping(value = "/events/{eventId}/openlineage", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> openLineage(@PathVariable String eventId) {
        return lineageService.find(eventId)
                .map(openLineageEventMapper::toRunEvent)
                .map(OpenLineageClientUtils::toJson)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Events that contributed to {@code location}, nearest first unless {@code chronological}.
     * Depth defaults to {@code trialguard.lineage.default-depth} and is capped at {@code max-depth}.
     */
    @GetMapping(value = "/upstream", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<LineageEvent>> upstream(@RequestParam String location,
                                                       @RequestParam(required = false) Integer depth,
                                                       @RequestParam(defaultValue = "false") boolean chronological) {
        return ResponseEntity.ok(lineageService.getUpstream(location, depth, chronological));
    }

    @GetMapping(value = "/downstream", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<LineageEvent>> downstream(@RequestParam String location,
                                                         @RequestParam(required = false) Integer depth,
                                                         @RequestParam(defaultValue = "false") boolean chronological) {
        return ResponseEntity.ok(lineageService.getDownstream(location, depth, chronological));
    }
}
