package org.iceforge.sqlapi.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import org.iceforge.sqlapi.config.SqlApiProperties;
import org.iceforge.sqlapi.error.SqlApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns any failure into {@code {"error": ["message"]}}.
 * <p>
 * The status is the exception's own hint, or 400 for anything else. Headers set for the
 * successful response are dropped; the body is always inline JSON.
 */
@RestControllerAdvice
public class SqlApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(SqlApiExceptionHandler.class);

    static final int DEFAULT_STATUS = 400;

    private final SqlApiProperties props;
    private final ObjectMapper mapper;

    public SqlApiExceptionHandler(SqlApiProperties props, ObjectMapper mapper) {
        this.props = Objects.requireNonNull(props);
        this.mapper = Objects.requireNonNull(mapper);
    }

    @ExceptionHandler(Exception.class)
    public void handle(Exception e, HttpServletResponse response) throws IOException {
        int status = e instanceof SqlApiException s ? s.httpStatus() : DEFAULT_STATUS;
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        if (!props.isTest()) {
            log.error("Request failed with status {}: {}", status, message, e);
        }

        if (response.isCommitted()) {
            // part of the body is already out; all we can do is end the response early
            log.warn("Response already committed, dropping error body: {}", message);
            return;
        }

        response.reset();
        CorsHeadersFilter.apply(response);
        response.setHeader("Content-Disposition", "inline");
        response.setStatus(status);
        response.setContentType("application/json; charset=utf-8");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", List.of(message));
        if (props.isDevelopment()) {
            body.put("stack", stackTrace(e));
        }
        mapper.writeValue(response.getOutputStream(), body);
    }

    private static String stackTrace(Throwable t) {
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }
}
