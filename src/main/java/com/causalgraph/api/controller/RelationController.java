package com.causalgraph.api.controller;

import com.causalgraph.api.dto.request.TemporalRelationRequest;
import com.causalgraph.domain.model.TemporalRelation;
import com.causalgraph.mapper.GraphDtoMapper;
import com.causalgraph.service.TemporalGraphService;
import jakarta.validation.Valid;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for relations.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/relations} -- add a relation (422 if an endpoint is not stored)</li>
 *   <li>{@code GET /api/relations/{entityId}/outgoing} -- relations leaving the entity</li>
 *   <li>{@code GET /api/relations/{entityId}/incoming} -- relations entering the entity</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/relations")
public class RelationController {

    private final TemporalGraphService temporalGraphService;
    private final GraphDtoMapper graphDtoMapper = Mappers.getMapper(GraphDtoMapper.class);

    public RelationController(TemporalGraphService temporalGraphService) {
        this.temporalGraphService = temporalGraphService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TemporalRelation addRelation(@RequestBody @Valid TemporalRelationRequest request) {
        TemporalRelation relation = graphDtoMapper.toDomain(request);
        temporalGraphService.addRelation(relation);
        return relation;
    }

    @GetMapping("/{entityId}/outgoing")
    public List<TemporalRelation> getOutgoing(@PathVariable String entityId) {
        return temporalGraphService.outgoingRelations(entityId);
    }

    @GetMapping("/{entityId}/incoming")
    public List<TemporalRelation> getIncoming(@PathVariable String entityId) {
        return temporalGraphService.incomingRelations(entityId);
    }
}
