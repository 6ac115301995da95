package com.causalgraph.mapper;

import com.causalgraph.domain.model.CausalChain;
import com.causalgraph.domain.model.TemporalEntity;
import com.causalgraph.domain.model.TemporalPattern;
import com.causalgraph.domain.model.TemporalRelation;
import com.causalgraph.entity.CausalChainRecord;
import com.causalgraph.entity.TemporalEntityRecord;
import com.causalgraph.entity.TemporalPatternRecord;
import com.causalgraph.entity.TemporalRelationRecord;
import java.time.Duration;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper from the graph's domain objects to their archive rows.
 *
 * <p>Maps, lists and signatures become JSON text via {@link JsonHelper}; durations become
 * milliseconds. The archive is write-only from the graph's side, so there is no reverse mapping.
 */
@Mapper
public interface GraphRecordMapper {

    @Mapping(source = "properties", target = "propertiesJson", qualifiedByName = "toJson")
    @Mapping(source = "metadata", target = "metadataJson", qualifiedByName = "toJson")
    @Mapping(source = "duration", target = "durationMillis", qualifiedByName = "durationToMillis")
    TemporalEntityRecord toRecord(TemporalEntity entity);

    @Mapping(source = "evidence", target = "evidenceJson", qualifiedByName = "toJson")
    @Mapping(source = "metadata", target = "metadataJson", qualifiedByName = "toJson")
    @Mapping(source = "causalLag", target = "causalLagMillis", qualifiedByName = "durationToMillis")
    TemporalRelationRecord toRecord(TemporalRelation relation);

    @Mapping(source = "entities", target = "entitiesJson", qualifiedByName = "toJson")
    @Mapping(source = "relations", target = "relationsJson", qualifiedByName = "toJson")
    @Mapping(source = "temporalSpan", target = "temporalSpanMillis", qualifiedByName = "durationToMillis")
    CausalChainRecord toRecord(CausalChain chain);

    @Mapping(source = "entitiesInvolved", target = "entitiesJson", qualifiedByName = "toJson")
    @Mapping(source = "temporalSignature", target = "signatureJson", qualifiedByName = "toJson")
    TemporalPatternRecord toRecord(TemporalPattern pattern);

    List<TemporalEntityRecord> toEntityRecords(List<TemporalEntity> entities);

    List<TemporalRelationRecord> toRelationRecords(List<TemporalRelation> relations);

    List<CausalChainRecord> toChainRecords(List<CausalChain> chains);

    List<TemporalPatternRecord> toPatternRecords(List<TemporalPattern> patterns);

    @Named("toJson")
    default String toJson(Object value) {
        return JsonHelper.toJson(value);
    }

    @Named("durationToMillis")
    default Long durationToMillis(Duration duration) {
        return duration != null ? duration.toMillis() : null;
    }
}
