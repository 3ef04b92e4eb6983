package com.jdc.recipe_store.interceptor;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.UUID;

/**
 * 요청마다 reqId를 MDC에 넣고 REQUEST / RESPONSE 로그를 남깁니다.
 */
@Slf4j
public class RequestLoggingInterceptor implements HandlerInterceptor {

    public static final String REQUEST_ID_KEY = "reqId";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    private static final String START_TIME_ATTR = RequestLoggingInterceptor.class.getName() + ".startTime";

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String reqId = UUID.randomUUID().toString().replace("-", "");
        MDC.put(REQUEST_ID_KEY, reqId);
        request.setAttribute(START_TIME_ATTR, System.nanoTime());
        response.setHeader(REQUEST_ID_HEADER, reqId);

        log.debug("REQUEST method={} uri={} ip={}", request.getMethod(), request.getRequestURI(), request.getRemoteAddr());
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        try {
            int status = response.getStatus();
            Object start = request.getAttribute(START_TIME_ATTR);
            double timeMs = start instanceof Long startNanos ? (System.nanoTime() - startNanos) / 1_000_000.0 : -1;

            if (status < 400) {
                log.info("RESPONSE {} {} status={} time_ms={}", request.getMethod(), request.getRequestURI(), status, String.format("%.2f", timeMs));
            } else if (status < 500) {
                log.warn("RESPONSE {} {} status={} time_ms={}", request.getMethod(), request.getRequestURI(), status, String.format("%.2f", timeMs));
            } else {
                log.error("RESPONSE {} {} status={} time_ms={}", request.getMethod(), request.getRequestURI(), status, String.format("%.2f", timeMs));
            }
        } finally {
            MDC.remove(REQUEST_ID_KEY);
        }
    }
}
