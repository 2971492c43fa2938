package com.nosota.msale.mapper;

import com.nosota.msale.api.dto.AllocationDTO;
import com.nosota.msale.api.dto.SaleEventDTO;
import com.nosota.msale.model.Allocation;
import com.nosota.msale.model.SaleEvent;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper for vesting allocations and audit events.
 */
@Mapper
public interface SaleMapper {

    SaleMapper INSTANCE = Mappers.getMapper(SaleMapper.class);

    /**
     * Maps Allocation entity to AllocationDTO. The allocation index becomes the DTO's {@code index}.
     *
     * @param allocation Allocation entity
     * @return AllocationDTO
     */
    @Mapping(target = "index", source = "allocationIndex")
    AllocationDTO toDTO(Allocation allocation);

    List<AllocationDTO> toAllocationDTOList(List<Allocation> allocations);

    SaleEventDTO toDTO(SaleEvent event);

    List<SaleEventDTO> toEventDTOList(List<SaleEvent> events);
}
