package com.basekit.authservice.utils;

import com.basekit.authservice.dto.MessageResponse;
import com.basekit.authservice.model.ApiResponse;
import com.basekit.authservice.model.OutcomeMessage;
import com.basekit.authservice.model.PageMeta;
import lombok.RequiredArgsConstructor;
import org.springframework.core.MethodParameter;
import org.springframework.data.domain.Page;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

import java.time.Clock;

/**
 * Wraps JSON bodies of this service's controllers in {@link ApiResponse}.
 * <ul>
 *   <li>message: the body's own {@link OutcomeMessage}, else {@code @ResponseMessage}, else "OK"</li>
 *   <li>data: the body, or a page's content; omitted for a bare {@link MessageResponse}</li>
 *   <li>meta: page numbers when the body is a {@link Page}</li>
 * </ul>
 * Errors never pass through here; they are written as problem+json by {@link ErrorResponseWriter}.
 */
@RestControllerAdvice(basePackages = "com.basekit.authservice.controller")
@RequiredArgsConstructor
public class SuccessEnvelopeAdvice implements ResponseBodyAdvice<Object> {

    private static final String DEFAULT_MESSAGE = "OK";

    private final Clock clock;

    @Override
    public boolean supports(@NonNull MethodParameter returnType,
                            @NonNull Class<? extends HttpMessageConverter<?>> converterType) {
        // String bodies (ping) go through the string converter and stay plain text
        return MappingJackson2HttpMessageConverter.class.isAssignableFrom(converterType);
    }

    @Override
    public Object beforeBodyWrite(@Nullable Object body,
                                  @NonNull MethodParameter returnType,
                                  @NonNull MediaType selectedContentType,
                                  @NonNull Class<? extends HttpMessageConverter<?>> selectedConverterType,
                                  @NonNull ServerHttpRequest request,
                                  @NonNull ServerHttpResponse response) {
        if (body == null || body instanceof ApiResponse<?>) return body;

        String message = resolveMessage(body, returnType);
        if (body instanceof Page<?> page) {
            return new ApiResponse<>(clock.instant(), requestId(request), message, page.getContent(), PageMeta.of(page));
        }
        Object data = body instanceof MessageResponse ? null : body;
        return new ApiResponse<>(clock.instant(), requestId(request), message, data, null);
    }

    private String resolveMessage(Object body, MethodParameter returnType) {
        if (body instanceof OutcomeMessage outcome && outcome.message() != null) {
            return outcome.message();
        }
        ResponseMessage ann = returnType.getMethodAnnotation(ResponseMessage.class);
        return ann != null ? ann.value() : DEFAULT_MESSAGE;
    }

    private @Nullable String requestId(ServerHttpRequest request) {
        if (request instanceof ServletServerHttpRequest servletRequest) {
            return RequestIdFilter.of(servletRequest.getServletRequest());
        }
        return null;
    }
}
