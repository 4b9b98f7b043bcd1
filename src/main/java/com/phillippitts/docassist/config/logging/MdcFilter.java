package com.phillippitts.docassist.config.logging;

import com.phillippitts.docassist.util.LogSanitizer;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every API request with a correlation id and the docassist endpoint it hit, in Log4j2's
 * ThreadContext. The admission and capability pools copy the context onto their workers, so
 * the id follows an operation from the controller to the model-server call.
 *
 * <p>Values added:</p>
 * <ul>
 *   <li>requestId: the caller's X-Request-ID when it is a plain token of at most 64 characters,
 *       otherwise a generated UUID; always echoed on the response</li>
 *   <li>endpoint: first path segment under {@code /api}, e.g. {@code summaries} or {@code operations}</li>
 *   <li>method: HTTP method</li>
 *   <li>uri: request path without query string, truncated; operation keys are often source URLs</li>
 * </ul>
 *
 * <p>The context is cleared after the request.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String API_PREFIX = "/api/";
    static final int MAX_URI_LENGTH = 120;

    private static final Pattern REQUEST_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = requestId(http.getHeader(REQUEST_ID_HEADER));
                ThreadContext.put("requestId", requestId);
                if (response instanceof HttpServletResponse httpResponse) {
                    httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
                }

                String path = http.getRequestURI();
                String endpoint = endpoint(path);
                if (endpoint != null) {
                    ThreadContext.put("endpoint", endpoint);
                }
                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", LogSanitizer.source(path, MAX_URI_LENGTH));
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    static String requestId(String header) {
        if (header != null && REQUEST_ID.matcher(header.trim()).matches()) {
            return header.trim();
        }
        return UUID.randomUUID().toString();
    }

    /** @return the segment after {@code /api/}, or {@code null} outside the API */
    static String endpoint(String path) {
        if (path == null || !path.startsWith(API_PREFIX) || path.length() == API_PREFIX.length()) {
            return null;
        }
        String rest = path.substring(API_PREFIX.length());
        int slash = rest.indexOf('/');
        return slash < 0 ? rest : rest.substring(0, slash);
    }
}
