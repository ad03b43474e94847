package com.nosota.mvault.mapper;

import com.nosota.mvault.api.response.ProposalResponse;
import com.nosota.mvault.model.Proposal;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper for Proposal entity to ProposalResponse conversion.
 */
@Mapper
public interface ProposalMapper {

    ProposalMapper INSTANCE = Mappers.getMapper(ProposalMapper.class);

    ProposalResponse toResponse(Proposal proposal);

    List<ProposalResponse> toResponseList(List<Proposal> proposals);
}
