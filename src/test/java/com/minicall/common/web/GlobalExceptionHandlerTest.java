package com.minicall.common.web;

import com.minicall.common.api.ApiCodes;
import com.minicall.common.api.Result;
import com.minicall.common.error.InvalidRequestException;
import com.minicall.common.error.RemoteServiceException;
import io.jsonwebtoken.JwtException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void handleNoResourceFound_ShouldReturn404ResultEnvelope() {
        ResponseEntity<Result<Void>> resp = handler.handleNoResourceFound(new NoResourceFoundException(HttpMethod.GET, "call/unknown"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(resp.getBody()).isNotNull();
        assertThat(resp.getBody().ok()).isFalse();
        assertThat(resp.getBody().code()).isEqualTo(ApiCodes.NOT_FOUND);
    }

    @Test
    void handleInvalidRequest_ShouldReturn400WithMessage() {
        ResponseEntity<Result<Void>> resp = handler.handleInvalidRequest(new InvalidRequestException("toUserId is required"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(resp.getBody().code()).isEqualTo(ApiCodes.BAD_REQUEST);
        assertThat(resp.getBody().message()).isEqualTo("toUserId is required");
    }

    @Test
    void handleJwt_ShouldReturn401() {
        ResponseEntity<Result<Void>> resp = handler.handleJwt(new JwtException("expired"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(resp.getBody().code()).isEqualTo(ApiCodes.UNAUTHORIZED);
    }

    @Test
    void handleRemote_ShouldReturn502() {
        ResponseEntity<Result<Void>> resp = handler.handleRemote(new RemoteServiceException("oss", "down"));

        assertThat(resp.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(resp.getBody().code()).isEqualTo(ApiCodes.REMOTE_ERROR);
    }
}
