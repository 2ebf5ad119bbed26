package com.streammeta.metadata.dto;

import com.streammeta.common.model.StreamDescriptor;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for stream listing
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StreamListResponse {

    private List<StreamDescriptor> list;
}
