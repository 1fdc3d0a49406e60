package com.imperium.unbuilt.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * 为每个请求分配 requestId（优先沿用 X-Request-Id），写入响应头与 MDC，日志里用 %X{requestId} 关联。
 * userId 同时写入 MDC，方便按用户筛日志。
 */
@Component
public class RequestIdFilter extends OncePerRequestFilter {

    static final String MDC_USER_ID = "userId";

    @Override
    protected void doFilterInternal(HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        String requestId = request.getHeader(RequestIdSupport.HEADER_REQUEST_ID);
        if (requestId == null || requestId.isBlank()) {
            requestId = RequestIdSupport.newRequestId();
        }
        request.setAttribute(RequestIdSupport.ATTR_REQUEST_ID, requestId);
        response.setHeader(RequestIdSupport.HEADER_REQUEST_ID, requestId);
        MDC.put(RequestIdSupport.ATTR_REQUEST_ID, requestId);
        String userId = request.getHeader(CallerHeaders.USER_ID);
        if (userId != null && !userId.isBlank()) {
            MDC.put(MDC_USER_ID, userId);
        }
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(RequestIdSupport.ATTR_REQUEST_ID);
            MDC.remove(MDC_USER_ID);
        }
    }
}
