package com.riskrails.config;

import com.riskrails.api.dto.response.ApiErrorResponse;
import com.riskrails.api.dto.response.ApiResponse;
import java.time.Clock;
import org.springframework.core.MethodParameter;
import org.springframework.http.MediaType;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyAdvice;

/**
 * Wraps bodies returned by the REST controllers in {@link ApiResponse}, stamped with the
 * request path and the application clock.
 *
 * <p>Scoped to {@code com.riskrails.api.controller}: actuator, the Spring error page and
 * {@code GlobalExceptionHandler} bodies are never wrapped, so an {@link ApiErrorResponse} from
 * a rejected {@code /api/executions} request keeps its own shape. An {@code ExecutionResult}
 * is wrapped whatever its status; a risk rejection is still a successful call.
 */
@RestControllerAdvice(basePackages = "com.riskrails.api.controller")
public class ApiResponseAdvice implements ResponseBodyAdvice<Object> {

    private final Clock clock;

    public ApiResponseAdvice(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean supports(MethodParameter returnType, Class<? extends HttpMessageConverter<?>> converterType) {
        return !StringHttpMessageConverter.class.isAssignableFrom(converterType);
    }

    @Override
    public Object beforeBodyWrite(
            Object body,
            MethodParameter returnType,
            MediaType selectedContentType,
            Class<? extends HttpMessageConverter<?>> selectedConverterType,
            ServerHttpRequest request,
            ServerHttpResponse response) {
        if (body instanceof ApiResponse<?> || body instanceof ApiErrorResponse) {
            return body;
        }
        return ApiResponse.of(body, request.getURI().getPath(), clock.instant());
    }
}
