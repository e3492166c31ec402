package com.mealscout.controller;

import com.mealscout.gateway.SocketAuthenticator;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Bearer token check for {@code /api/**}, using the same secret as the socket handshake.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ApiTokenInterceptor implements HandlerInterceptor {

    private final SocketAuthenticator authenticator;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String token = SocketAuthenticator.bearerToken(request.getHeader("Authorization"));
        if (authenticator.isValid(token)) {
            return true;
        }
        log.warn("Rejected {} {} from {}", request.getMethod(), request.getRequestURI(), request.getRemoteAddr());
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        return false;
    }
}
