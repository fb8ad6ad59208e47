package com.edge.dia.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * API 请求日志
 * <p>
 * 只记录 /api/ 下的请求；文档页面与静态资源直接放行。
 */
@Component
public class RequestLoggingFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    private static final int MAX_BODY_LOG = 1000;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        ContentCachingRequestWrapper requestWrapper = new ContentCachingRequestWrapper(request);
        ContentCachingResponseWrapper responseWrapper = new ContentCachingResponseWrapper(response);

        long startTime = System.currentTimeMillis();
        try {
            logger.info(">>> {} {}", request.getMethod(), request.getRequestURI());
            filterChain.doFilter(requestWrapper, responseWrapper);
        } finally {
            long duration = System.currentTimeMillis() - startTime;

            if ("POST".equalsIgnoreCase(request.getMethod()) || "PUT".equalsIgnoreCase(request.getMethod())) {
                byte[] content = requestWrapper.getContentAsByteArray();
                if (content.length > 0) {
                    String body = new String(content, StandardCharsets.UTF_8);
                    if (body.length() > MAX_BODY_LOG) {
                        body = body.substring(0, MAX_BODY_LOG) + "...";
                    }
                    logger.debug("Request Body: {}", body);
                }
            }

            // 必须复制回原始响应，否则客户端收不到数据
            responseWrapper.copyBodyToResponse();

            logger.info("<<< {} {} | {} ms | status {}", request.getMethod(), request.getRequestURI(),
                duration, response.getStatus());
        }
    }
}
