package com.minicall.domain.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class SendMessageRequest {
    @NotNull(message = "toUserId is required")
    private Long toUserId;
    @NotBlank(message = "content is required")
    @Size(max = 4096, message = "content_too_long")
    private String content;
    /** text/image/audio/video/file，缺省 text。 */
    private String msgType;
    private String clientMsgId;
}
