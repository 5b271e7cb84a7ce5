package com.di.qualitygate.web;

import com.di.qualitygate.util.MdcPropagation;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every {@code /api/etl} request with a {@code requestId} (the caller's {@code X-Request-Id}
 * when it is a plain token, otherwise generated) and its path, so a run started over REST logs
 * under the id the caller sees in the response header. The pipeline adds {@code runId} beneath it.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class EtlRequestMdcFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-Id";
    private static final String API_PREFIX = "/api/etl";
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        String path = request.getRequestURI();
        return path == null || !path.startsWith(API_PREFIX);
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String requestId = requestIdFor(request.getHeader(REQUEST_ID_HEADER));
        response.setHeader(REQUEST_ID_HEADER, requestId);
        try (MdcPropagation.AutoCloseableMdc ignoredId = MdcPropagation.scoped(MdcPropagation.REQUEST_ID, requestId);
             MdcPropagation.AutoCloseableMdc ignoredPath =
                     MdcPropagation.scoped(MdcPropagation.REQUEST_PATH, request.getRequestURI())) {
            filterChain.doFilter(request, response);
        }
    }

    static String requestIdFor(String header) {
        if (header != null && SAFE_ID.matcher(header).matches()) {
            return header;
        }
        return "etl-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
