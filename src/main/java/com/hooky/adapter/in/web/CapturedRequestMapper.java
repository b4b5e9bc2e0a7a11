package com.hooky.adapter.in.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hooky.application.port.in.CaptureEventUseCase.CaptureRequest;
import com.hooky.domain.model.CapturedEvent;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StreamUtils;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns an arbitrary inbound HTTP request into the fields of a captured event.
 *
 * <p>Bodies are decoded by content type: JSON is parsed (kept as text if malformed),
 * form-urlencoded becomes a map, anything else is text, and an empty body is null.
 */
@Component
public class CapturedRequestMapper {

    private static final Logger log = LoggerFactory.getLogger(CapturedRequestMapper.class);

    private final ObjectMapper objectMapper;

    public CapturedRequestMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public CaptureRequest toCaptureRequest(HttpServletRequest request) throws IOException {
        String queryString = request.getQueryString();
        String path = queryString != null ? request.getRequestURI() + "?" + queryString : request.getRequestURI();
        byte[] body = StreamUtils.copyToByteArray(request.getInputStream());

        return new CaptureRequest(
            request.getMethod(),
            path,
            CapturedEvent.flatten(parseUrlEncoded(queryString, StandardCharsets.UTF_8)),
            CapturedEvent.flatten(headers(request)),
            decodeBody(request.getContentType(), body)
        );
    }

    Object decodeBody(String contentType, byte[] body) {
        if (body == null || body.length == 0) {
            return null;
        }
        MediaType mediaType = parseMediaType(contentType);
        Charset charset = mediaType.getCharset() != null ? mediaType.getCharset() : StandardCharsets.UTF_8;
        String text = new String(body, charset);

        if (isJson(mediaType)) {
            try {
                return objectMapper.readValue(body, Object.class);
            } catch (IOException e) {
                log.debug("Malformed JSON body kept as text: {}", e.getMessage());
                return text;
            }
        }
        if (MediaType.APPLICATION_FORM_URLENCODED.includes(mediaType)) {
            return CapturedEvent.flatten(parseUrlEncoded(text, charset));
        }
        return text;
    }

    static Map<String, List<String>> parseUrlEncoded(String encoded, Charset charset) {
        if (encoded == null || encoded.isEmpty()) {
            return Map.of();
        }
        MultiValueMap<String, String> raw = UriComponentsBuilder.newInstance().query(encoded).build().getQueryParams();
        Map<String, List<String>> params = new LinkedHashMap<>();
        raw.forEach((name, values) -> {
            List<String> decoded = params.computeIfAbsent(decode(name, charset), key -> new ArrayList<>());
            for (String value : values) {
                decoded.add(value != null ? decode(value, charset) : "");
            }
        });
        return params;
    }

    private static String decode(String value, Charset charset) {
        try {
            return UriUtils.decode(value.replace('+', ' '), charset);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }

    private static Map<String, List<String>> headers(HttpServletRequest request) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            List<String> values = headers.computeIfAbsent(name.toLowerCase(Locale.ROOT), key -> new ArrayList<>());
            values.addAll(Collections.list(request.getHeaders(name)));
        }
        return headers;
    }

    private static MediaType parseMediaType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
        try {
            return MediaType.parseMediaType(contentType);
        } catch (InvalidMediaTypeException e) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
    }

    private static boolean isJson(MediaType mediaType) {
        return MediaType.APPLICATION_JSON.includes(mediaType)
            || (mediaType.getSubtype() != null && mediaType.getSubtype().endsWith("+json"));
    }
}
