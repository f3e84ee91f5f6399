package com.minicall.domain.controller;

import com.baomidou.mybatisplus.extension.plugins.pagination.Page;
import com.minicall.auth.web.AuthContext;
import com.minicall.common.api.ApiCodes;
import com.minicall.common.api.Result;
import com.minicall.domain.dto.CallRecordDto;
import com.minicall.domain.dto.RecordingDto;
import com.minicall.domain.entity.CallRecordEntity;
import com.minicall.domain.service.CallRecordService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RequiredArgsConstructor
@RestController
@RequestMapping("/call/record")
public class CallRecordController {

    private final CallRecordService callRecordService;

    @GetMapping("/cursor")
    public Result<List<CallRecordDto>> cursor(@RequestParam(required = false) Long limit,
                                              @RequestParam(required = false) Long lastId) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        long safeLimit = limit == null ? 20 : Math.min(Math.max(limit, 1), 100);
        return Result.ok(callRecordService.cursorByUserId(userId, safeLimit, lastId));
    }

    @GetMapping("/list")
    public Result<Page<CallRecordDto>> list(@RequestParam(required = false) Long pageNo,
                                            @RequestParam(required = false) Long pageSize) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        long safePageNo = pageNo == null ? 1 : Math.max(pageNo, 1);
        long safePageSize = pageSize == null ? 20 : Math.min(Math.max(pageSize, 1), 100);
        return Result.ok(callRecordService.pageByUserId(userId, safePageNo, safePageSize));
    }

    /**
     * 录制状态与地址，只对通话参与方可见。
     */
    @GetMapping("/{callId}/recording")
    public Result<RecordingDto> recording(@PathVariable String callId) {
        Long userId = AuthContext.getUserId();
        if (userId == null) {
            return Result.fail(ApiCodes.UNAUTHORIZED, "unauthorized");
        }
        CallRecordEntity call = callRecordService.getByCallId(callId);
        if (call == null) {
            return Result.fail(ApiCodes.NOT_FOUND, "call_not_found");
        }
        if (!call.isParticipant(userId)) {
            return Result.fail(ApiCodes.FORBIDDEN, "not_call_participant");
        }
        RecordingDto dto = new RecordingDto();
        dto.setCallId(call.getCallId());
        dto.setStatus(call.getRecordingStatus() == null ? null : call.getRecordingStatus().getDesc());
        dto.setUrl(call.getRecordingUrl());
        dto.setSizeBytes(call.getRecordingSizeBytes());
        dto.setError(call.getRecordingError());
        return Result.ok(dto);
    }
}
