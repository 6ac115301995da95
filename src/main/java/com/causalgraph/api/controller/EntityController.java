package com.causalgraph.api.controller;

import com.causalgraph.api.dto.request.TemporalEntityRequest;
import com.causalgraph.domain.model.TemporalEntity;
import com.causalgraph.graph.EvictionResult;
import com.causalgraph.mapper.GraphDtoMapper;
import com.causalgraph.service.TemporalGraphService;
import jakarta.validation.Valid;
import java.time.Instant;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for entity ingestion and temporal lookup.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/entities} -- ingest an entity (409 on a reused id)</li>
 *   <li>{@code GET /api/entities/{id}} -- fetch one entity</li>
 *   <li>{@code GET /api/entities?from&to} -- entities with {@code from <= timestamp < to}</li>
 *   <li>{@code POST /api/entities/evict?before} -- evict older entities with their relations</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/entities")
public class EntityController {

    private final TemporalGraphService temporalGraphService;
    private final GraphDtoMapper graphDtoMapper = Mappers.getMapper(GraphDtoMapper.class);

    public EntityController(TemporalGraphService temporalGraphService) {
        this.temporalGraphService = temporalGraphService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TemporalEntity addEntity(@RequestBody @Valid TemporalEntityRequest request) {
        TemporalEntity entity = graphDtoMapper.toDomain(request);
        temporalGraphService.addEntity(entity);
        return entity;
    }

    @GetMapping("/{id}")
    public TemporalEntity getEntity(@PathVariable String id) {
        return temporalGraphService.getEntity(id);
    }

    @GetMapping
    public List<TemporalEntity> getEntitiesInWindow(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return temporalGraphService.entitiesInWindow(from, to);
    }

    @PostMapping("/evict")
    public EvictionResult evictBefore(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant before) {
        return temporalGraphService.evictBefore(before);
    }
}
