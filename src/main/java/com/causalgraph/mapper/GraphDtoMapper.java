package com.causalgraph.mapper;

import com.causalgraph.api.dto.request.TemporalEntityRequest;
import com.causalgraph.api.dto.request.TemporalRelationRequest;
import com.causalgraph.domain.model.TemporalEntity;
import com.causalgraph.domain.model.TemporalRelation;
import java.time.Duration;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper from REST request DTOs to domain objects. Durations travel as milliseconds.
 */
@Mapper
public interface GraphDtoMapper {

    @Mapping(source = "durationMillis", target = "duration", qualifiedByName = "millisToDuration")
    TemporalEntity toDomain(TemporalEntityRequest request);

    @Mapping(source = "causalLagMillis", target = "causalLag", qualifiedByName = "millisToDuration")
    TemporalRelation toDomain(TemporalRelationRequest request);

    @Named("millisToDuration")
    default Duration millisToDuration(Long millis) {
        return millis != null ? Duration.ofMillis(millis) : null;
    }
}
