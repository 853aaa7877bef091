package com.basekit.authservice.utils;

import com.basekit.authservice.dto.MessageResponse;
import com.basekit.authservice.dto.SignupResponse;
import com.basekit.authservice.model.ApiResponse;
import com.basekit.authservice.model.PageMeta;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.MethodParameter;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SuccessEnvelopeAdviceTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private SuccessEnvelopeAdvice advice;
    private MockHttpServletRequest servletRequest;

    @BeforeEach
    void setUp() {
        advice = new SuccessEnvelopeAdvice(Clock.fixed(NOW, ZoneOffset.UTC));
        servletRequest = new MockHttpServletRequest("POST", "/auth/signup");
        servletRequest.setAttribute(RequestIdFilter.ATTRIBUTE, "req-1");
    }

    static class Handlers {
        @ResponseMessage("Signup processed")
        SignupResponse signup() { return null; }

        @ResponseMessage("Login successful")
        Object login() { return null; }

        Object unannotated() { return null; }
    }

    private MethodParameter returnOf(String method) throws NoSuchMethodException {
        return new MethodParameter(Handlers.class.getDeclaredMethod(method), -1);
    }

    private ApiResponse<?> wrap(Object body, String method) throws NoSuchMethodException {
        Object wrapped = advice.beforeBodyWrite(body, returnOf(method), MediaType.APPLICATION_JSON,
                MappingJackson2HttpMessageConverter.class,
                new ServletServerHttpRequest(servletRequest),
                new ServletServerHttpResponse(new MockHttpServletResponse()));
        assertThat(wrapped).isInstanceOf(ApiResponse.class);
        return (ApiResponse<?>) wrapped;
    }

    @Test
    void bodyMessage_OverridesAnnotation() throws Exception {
        SignupResponse body = SignupResponse.builder()
                .message("User created successfully, but OTP sending failed. Please try to resend OTP.")
                .otpSent(false)
                .build();

        ApiResponse<?> envelope = wrap(body, "signup");

        assertThat(envelope.message()).isEqualTo("User created successfully, but OTP sending failed. Please try to resend OTP.");
        assertThat(envelope.data()).isSameAs(body);
        assertThat(envelope.timestamp()).isEqualTo(NOW);
        assertThat(envelope.requestId()).isEqualTo("req-1");
        assertThat(envelope.meta()).isNull();
    }

    @Test
    void messageOnlyBody_LiftedWithoutData() throws Exception {
        ApiResponse<?> envelope = wrap(new MessageResponse("Password reset successfully"), "unannotated");

        assertThat(envelope.message()).isEqualTo("Password reset successfully");
        assertThat(envelope.data()).isNull();
    }

    @Test
    void plainBody_UsesAnnotation() throws Exception {
        ApiResponse<?> envelope = wrap(List.of("x"), "login");

        assertThat(envelope.message()).isEqualTo("Login successful");
        assertThat(envelope.data()).isEqualTo(List.of("x"));
    }

    @Test
    void noAnnotation_DefaultsToOk() throws Exception {
        assertThat(wrap(List.of(), "unannotated").message()).isEqualTo("OK");
    }

    @Test
    void page_ContentAsDataAndOneBasedMeta() throws Exception {
        PageImpl<String> page = new PageImpl<>(List.of("c", "d"), PageRequest.of(1, 2), 5);

        ApiResponse<?> envelope = wrap(page, "unannotated");

        assertThat(envelope.data()).isEqualTo(List.of("c", "d"));
        assertThat(envelope.meta()).isEqualTo(new PageMeta(2, 2, 5, 3));
    }

    @Test
    void alreadyWrapped_PassedThrough() throws Exception {
        ApiResponse<String> existing = new ApiResponse<>(NOW, "other", "OK", "data", null);

        Object result = advice.beforeBodyWrite(existing, returnOf("login"), MediaType.APPLICATION_JSON,
                MappingJackson2HttpMessageConverter.class,
                new ServletServerHttpRequest(servletRequest),
                new ServletServerHttpResponse(new MockHttpServletResponse()));

        assertThat(result).isSameAs(existing);
    }

    @Test
    void plainTextConverter_NotWrapped() throws Exception {
        assertThat(advice.supports(returnOf("login"), StringHttpMessageConverter.class)).isFalse();
        assertThat(advice.supports(returnOf("login"), MappingJackson2HttpMessageConverter.class)).isTrue();
    }
}
