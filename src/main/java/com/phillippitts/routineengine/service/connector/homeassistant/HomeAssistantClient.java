package com.phillippitts.routineengine.service.connector.homeassistant;

import com.phillippitts.routineengine.service.state.EntityState;
import com.phillippitts.routineengine.service.state.StateQuerySource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal Home Assistant REST API client.
 *
 * <ul>
 *   <li>{@code GET /api/states/{entity}} for entity state</li>
 *   <li>{@code POST /api/services/{domain}/{service}} to call a service</li>
 * </ul>
 *
 * <p>Every request carries the configured long-lived token as a bearer token. HTTP failures
 * surface as {@link org.springframework.web.client.RestClientException}.
 */
public class HomeAssistantClient implements StateQuerySource {

    private static final Logger LOG = LogManager.getLogger(HomeAssistantClient.class);

    public static final String SERVICE_ID = "homeassistant";

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String token;

    public HomeAssistantClient(RestTemplate restTemplate, String baseUrl, String token) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.token = token;
    }

    @Override
    public String service() {
        return SERVICE_ID;
    }

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }

    @Override
    public EntityState getState(String entityId) {
        ResponseEntity<String> response = restTemplate.exchange(
                baseUrl + "/api/states/{entity}", HttpMethod.GET, new HttpEntity<>(headers()), String.class, entityId);
        LOG.debug("Fetched state of {}", entityId);
        return parseState(entityId, response.getBody());
    }

    /**
     * Calls a Home Assistant service and returns the list of states it reports as changed.
     */
    public List<Object> callService(String domain, String service, Map<String, Object> data) {
        JSONObject body = new JSONObject();
        if (data != null) {
            data.forEach((k, v) -> body.put(k, v == null ? JSONObject.NULL : JSONObject.wrap(v)));
        }
        ResponseEntity<String> response = restTemplate.exchange(
                baseUrl + "/api/services/{domain}/{service}", HttpMethod.POST,
                new HttpEntity<>(body.toString(), headers()), String.class, domain, service);
        LOG.debug("Called service {}.{}", domain, service);
        return parseChangedStates(response.getBody());
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (hasToken()) {
            headers.setBearerAuth(token);
        }
        return headers;
    }

    static EntityState parseState(String entityId, String json) {
        if (json == null || json.isBlank()) {
            return new EntityState(entityId, null, Map.of());
        }
        JSONObject obj = new JSONObject(json);
        Object state = obj.isNull("state") ? null : obj.opt("state");
        Map<String, Object> attributes = new LinkedHashMap<>();
        JSONObject attrs = obj.optJSONObject("attributes");
        if (attrs != null) {
            attributes.putAll(attrs.toMap());
        }
        return new EntityState(obj.optString("entity_id", entityId), state, attributes);
    }

    static List<Object> parseChangedStates(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return new ArrayList<>(new JSONArray(json).toList());
        } catch (JSONException e) {
            LOG.debug("Service response is not a JSON array, ignoring body");
            return List.of();
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
