package com.khaounen.contextauth.config;

import com.khaounen.contextauth.utils.IpUtils;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Exposes the caller's network address to login context capture for the
 * duration of one request.
 */
public class RequestContextFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        try {
            RequestContext.setIp(IpUtils.resolveIp(request));
            filterChain.doFilter(request, response);
        } finally {
            RequestContext.clear();
        }
    }
}
