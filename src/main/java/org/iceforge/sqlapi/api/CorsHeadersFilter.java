package org.iceforge.sqlapi.api;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Cross-origin headers on every response. Preflight requests are answered here with an empty 200.
 */
@Component
public class CorsHeadersFilter extends OncePerRequestFilter {

    static final String ALLOW_ORIGIN = "*";
    static final String ALLOW_HEADERS = "X-Requested-With, X-Prototype-Version, X-CSRF-Token";

    public static void apply(HttpServletResponse response) {
        response.setHeader("Access-Control-Allow-Origin", ALLOW_ORIGIN);
        response.setHeader("Access-Control-Allow-Headers", ALLOW_HEADERS);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        apply(response);
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            response.setStatus(HttpServletResponse.SC_OK);
            return;
        }
        chain.doFilter(request, response);
    }
}
