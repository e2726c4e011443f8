package com.mobifone.compute.common;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.time.Duration;
import java.time.Instant;

/**
 * Logs every {@link LogApi} endpoint call: method, URI, query, request body,
 * response status, duration and client IP.
 */
@Aspect
@Component
@Slf4j
public class LogApiAspect {

    private final ObjectMapper objectMapper;

    public LogApiAspect(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Around("@annotation(com.mobifone.compute.common.LogApi)")
    public Object logApiCall(ProceedingJoinPoint joinPoint) throws Throwable {
        Instant start = Instant.now();

        HttpServletRequest httpServletRequest = currentRequest();
        String endpoint = httpServletRequest != null ? httpServletRequest.getRequestURI() : joinPoint.getSignature().toShortString();
        String httpMethod = httpServletRequest != null ? httpServletRequest.getMethod() : null;
        String requestParams = httpServletRequest != null ? httpServletRequest.getQueryString() : null;
        String ipAddress = httpServletRequest != null ? clientIp(httpServletRequest) : null;

        Object[] args = joinPoint.getArgs();
        String requestBody = args.length > 0 ? toJson(args[0]) : null;

        int responseStatus = HttpStatus.OK.value();
        try {
            Object result = joinPoint.proceed();
            log.debug("Response received: {}", result);
            return result;
        } catch (Exception e) {
            responseStatus = HttpStatus.INTERNAL_SERVER_ERROR.value();
            throw e;
        } finally {
            long tookMs = Duration.between(start, Instant.now()).toMillis();
            log.info("API [{} {}] params={} body={} status={} took={}ms ip={}",
                    httpMethod, endpoint, requestParams, requestBody, responseStatus, tookMs, ipAddress);
        }
    }

    private HttpServletRequest currentRequest() {
        if (RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attributes) {
            return attributes.getRequest();
        }
        return null;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("Cannot serialize request body: {}", e.getMessage());
            return String.valueOf(value);
        }
    }

    // first hop of X-Forwarded-For when behind the load balancer, else the socket peer
    static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
