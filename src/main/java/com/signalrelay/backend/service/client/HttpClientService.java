package com.signalrelay.backend.service.client;

import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

@Service
public class HttpClientService {

    private final RestTemplate restTemplate;

    public HttpClientService(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    /**
     * Make a GET request
     */
    public ResponseEntity<String> get(String url, HttpHeaders headers, Map<String, String> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(url);
        if (params != null) {
            params.forEach(builder::queryParam);
        }

        HttpEntity<String> entity = new HttpEntity<>(headers);
        return restTemplate.exchange(
            builder.build().toUri(),
            HttpMethod.GET,
            entity,
            String.class
        );
    }

    /**
     * Make a POST request with an already serialized JSON body. The body is sent verbatim
     * because the request signature is computed over the exact string.
     */
    public ResponseEntity<String> post(String url, HttpHeaders headers, String jsonBody) {
        HttpEntity<String> entity = new HttpEntity<>(jsonBody, headers);
        return restTemplate.exchange(
            url,
            HttpMethod.POST,
            entity,
            String.class
        );
    }
}
