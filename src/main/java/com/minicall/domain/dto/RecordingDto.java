package com.minicall.domain.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecordingDto {
    private String callId;
    private String status;
    private String url;
    private Long sizeBytes;
    private String error;
}
