package uk.gegc.reelstudio.features.segment.infra.mapping;

import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;
import uk.gegc.reelstudio.features.segment.api.dto.SegmentDto;
import uk.gegc.reelstudio.features.segment.domain.model.VideoSegment;

import java.util.List;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.ERROR)
public interface SegmentMapper {
    SegmentDto toDto(VideoSegment entity);
    List<SegmentDto> toDtos(List<VideoSegment> entities);
}
