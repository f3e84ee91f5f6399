package com.minicall.domain.controller;

import com.minicall.common.api.Result;
import com.minicall.domain.config.WebRtcProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RequiredArgsConstructor
@RestController
@RequestMapping("/call")
public class WebRtcConfigController {

    private final WebRtcProperties props;

    @GetMapping("/webrtc-config")
    public Result<Map<String, Object>> webrtcConfig() {
        List<Map<String, Object>> iceServers = new ArrayList<>();
        iceServers.add(Map.of("urls", props.stunUrlsEffective()));
        if (props.turnEnabled()) {
            Map<String, Object> turn = new LinkedHashMap<>();
            turn.put("urls", props.turnUrl());
            turn.put("username", props.turnUsername());
            turn.put("credential", props.turnCredential());
            iceServers.add(turn);
        }
        return Result.ok(Map.of("iceServers", iceServers));
    }
}
