package by.greenmobile.flatslabcalc.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;

/**
 * Кладёт в MDC данные запроса к расчётному API, чтобы строки лога одного расчёта
 * (prepare → criteria → DDM → EFM) связывались между собой:
 * - rid: id запроса (из X-Request-Id или сгенерированный), возвращается в ответе
 * - method, path
 */
@Component
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String rid = Optional.ofNullable(request.getHeader(HEADER))
                .map(String::trim)
                .filter(h -> !h.isEmpty() && h.length() <= 64)
                .orElseGet(() -> UUID.randomUUID().toString().substring(0, 8));

        response.setHeader(HEADER, rid);
        MDC.put("rid", rid);
        MDC.put("method", request.getMethod());
        MDC.put("path", request.getRequestURI());

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove("rid");
            MDC.remove("method");
            MDC.remove("path");
        }
    }
}
