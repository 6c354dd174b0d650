package org.iceforge.sqlapi.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.iceforge.sqlapi.dispatch.QueryDispatcher;
import org.iceforge.sqlapi.dispatch.QueryRequest;
import org.iceforge.sqlapi.error.ValidationException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The /sql endpoint. Parameters come from the query string, form bodies and JSON bodies.
 */
@RestController
@RequestMapping("${sqlapi.base-url:/api/{version}}")
public class SqlController {

    private static final TypeReference<Map<String, Object>> JSON_BODY = new TypeReference<>() {};

    private final QueryDispatcher dispatcher;
    private final ObjectMapper mapper;

    public SqlController(QueryDispatcher dispatcher, ObjectMapper mapper) {
        this.dispatcher = Objects.requireNonNull(dispatcher);
        this.mapper = Objects.requireNonNull(mapper);
    }

    @RequestMapping(value = "/sql", method = {RequestMethod.GET, RequestMethod.POST})
    public void sql(HttpServletRequest request, HttpServletResponse response) throws IOException {
        dispatcher.dispatch(toQueryRequest(request, null), new ServletResponseSink(response));
    }

    @RequestMapping(value = "/sql.{ext}", method = {RequestMethod.GET, RequestMethod.POST})
    public void sqlWithExtension(@PathVariable("ext") String ext,
                                 HttpServletRequest request,
                                 HttpServletResponse response) throws IOException {
        dispatcher.dispatch(toQueryRequest(request, ext), new ServletResponseSink(response));
    }

    QueryRequest toQueryRequest(HttpServletRequest request, String pathFormat) throws IOException {
        Map<String, List<String>> params = new LinkedHashMap<>();
        request.getParameterMap().forEach((k, v) -> params.put(k, new ArrayList<>(Arrays.asList(v))));
        if (isJson(request.getContentType())) {
            readJsonBody(request, params);
        }
        return new QueryRequest(params, request.getHeader(HttpHeaders.HOST), pathFormat);
    }

    private void readJsonBody(HttpServletRequest request, Map<String, List<String>> params) throws IOException {
        Map<String, Object> body;
        try (InputStream in = request.getInputStream()) {
            byte[] bytes = in.readAllBytes();
            if (bytes.length == 0) return;
            body = mapper.readValue(bytes, JSON_BODY);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Invalid JSON body: " + e.getOriginalMessage());
        }
        if (body == null) return;
        body.forEach((k, v) -> {
            List<String> values = params.computeIfAbsent(k, x -> new ArrayList<>());
            if (v instanceof Collection<?> c) {
                for (Object o : c) {
                    if (o != null) values.add(o.toString());
                }
            } else if (v != null) {
                values.add(v.toString());
            }
        });
    }

    private static boolean isJson(String contentType) {
        if (contentType == null) return false;
        try {
            return MediaType.APPLICATION_JSON.isCompatibleWith(MediaType.parseMediaType(contentType));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
