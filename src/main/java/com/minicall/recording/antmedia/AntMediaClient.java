package com.minicall.recording.antmedia;

import com.fasterxml.jackson.databind.JsonNode;
import com.minicall.common.error.RemoteServiceException;
import com.minicall.recording.MediaControlClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Ant Media REST 客户端。
 *
 * <p>配置了账号时先调用 /users/authenticate 换取 JWT，缓存 23 小时；认证失败按无认证处理。</p>
 */
@Slf4j
@Component
public class AntMediaClient implements MediaControlClient {

    private static final String SERVICE = "ant-media";
    static final Duration TOKEN_TTL = Duration.ofHours(23);

    private final RestTemplate restTemplate;
    private final AntMediaProperties props;
    private final Clock clock;

    private final AtomicReference<Token> token = new AtomicReference<>();

    public AntMediaClient(@Qualifier("mcMediaRestTemplate") RestTemplate restTemplate,
                          AntMediaProperties props,
                          Clock clock) {
        this.restTemplate = restTemplate;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public void createStream(String streamId, String streamName) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", streamName);
        body.put("streamId", streamId);
        body.put("mp4Enabled", 1);
        body.put("webMEnabled", 0);
        exchange("create stream " + streamId, props.restUrlEffective() + "/broadcasts/create", HttpMethod.POST, body);
        log.info("media stream created: streamId={}", streamId);
    }

    @Override
    public void stopStream(String streamId) {
        exchange("stop stream " + streamId, props.restUrlEffective() + "/broadcasts/" + streamId + "/stop",
                HttpMethod.POST, Map.of());
        log.info("media stream stopped: streamId={}", streamId);
    }

    @Override
    public void deleteStream(String streamId) {
        exchange("delete stream " + streamId, props.restUrlEffective() + "/broadcasts/" + streamId,
                HttpMethod.DELETE, null);
        log.info("media stream deleted: streamId={}", streamId);
    }

    @Override
    public byte[] downloadArtifact(String streamId, String fileName) {
        String url = props.serverUrlEffective() + "/streams/" + fileName;
        try {
            byte[] bytes = restTemplate.getForObject(url, byte[].class);
            log.debug("artifact downloaded: streamId={}, file={}, bytes={}", streamId, fileName, bytes == null ? 0 : bytes.length);
            return bytes;
        } catch (HttpClientErrorException.NotFound e) {
            return null;
        } catch (RestClientException e) {
            throw new RemoteServiceException(SERVICE, "download " + fileName + " failed: " + e.getMessage(), e);
        }
    }

    private void exchange(String op, String url, HttpMethod method, Object body) {
        try {
            restTemplate.exchange(url, method, new HttpEntity<>(body, headers()), String.class);
        } catch (RestClientException e) {
            throw new RemoteServiceException(SERVICE, op + " failed: " + e.getMessage(), e);
        }
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String jwt = currentToken();
        if (jwt != null) {
            headers.setBearerAuth(jwt);
        }
        return headers;
    }

    /**
     * @return 有效的 JWT；未配置账号或认证失败时为 null
     */
    String currentToken() {
        if (!props.authEnabled()) {
            return null;
        }
        Instant now = clock.instant();
        Token cached = token.get();
        if (cached != null && now.isBefore(cached.expiresAt())) {
            return cached.value();
        }
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            Map<String, String> body = Map.of("email", props.email(), "password", props.password());
            JsonNode resp = restTemplate.postForObject(props.restUrlEffective() + "/users/authenticate",
                    new HttpEntity<>(body, headers), JsonNode.class);
            String jwt = resp == null ? null : resp.path("jwtToken").asText(null);
            if (jwt == null || jwt.isBlank()) {
                log.warn("media server authenticate returned no token, continue without auth");
                return null;
            }
            token.set(new Token(jwt, now.plus(TOKEN_TTL)));
            log.info("media server authenticated");
            return jwt;
        } catch (RestClientException e) {
            // 部分部署没有认证端点
            log.warn("media server authenticate failed, continue without auth: {}", e.toString());
            return null;
        }
    }

    private record Token(String value, Instant expiresAt) {
    }
}
