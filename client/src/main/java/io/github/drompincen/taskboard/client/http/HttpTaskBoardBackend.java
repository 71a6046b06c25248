package io.github.drompincen.taskboard.client.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.taskboard.engine.backend.BackendException;
import io.github.drompincen.taskboard.engine.backend.FailureKind;
import io.github.drompincen.taskboard.engine.backend.TaskBoardBackend;
import io.github.drompincen.taskboard.protocol.api.CreateTaskRequest;
import io.github.drompincen.taskboard.protocol.api.StatusDefinitionDto;
import io.github.drompincen.taskboard.protocol.api.TaskDto;
import io.github.drompincen.taskboard.protocol.api.TaskFilter;
import io.github.drompincen.taskboard.protocol.api.TaskSortOrder;
import io.github.drompincen.taskboard.protocol.api.Team;
import io.github.drompincen.taskboard.protocol.api.UpdateTaskStatusRequest;
import io.github.drompincen.taskboard.protocol.api.UserDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * {@link TaskBoardBackend} over the gateway's REST API. A 404 maps to {@link FailureKind#NOT_FOUND},
 * any other non-2xx answer to {@link FailureKind#SERVER_REJECTION}, and anything that prevents an
 * answer (refused connection, timeout) to {@link FailureKind#NETWORK_FAILURE}.
 */
public class HttpTaskBoardBackend implements TaskBoardBackend {

    private static final Logger log = LoggerFactory.getLogger(HttpTaskBoardBackend.class);

    private static final TypeReference<List<TaskDto>> TASK_LIST = new TypeReference<>() {};
    private static final TypeReference<List<StatusDefinitionDto>> STATUS_LIST = new TypeReference<>() {};
    private static final TypeReference<TaskDto> TASK = new TypeReference<>() {};
    private static final TypeReference<UserDto> USER = new TypeReference<>() {};

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Duration requestTimeout;

    public HttpTaskBoardBackend(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl,
                                Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public CompletableFuture<List<TaskDto>> fetchTasks(TaskFilter filter) {
        List<String> params = new ArrayList<>();
        addParam(params, "clientId", filter.clientId());
        addParam(params, "assigneeId", filter.assigneeId());
        addParam(params, "q", filter.searchQuery());
        if (filter.sortBy() != TaskSortOrder.NONE) {
            addParam(params, "sortBy", filter.sortBy().name());
        }
        String query = params.isEmpty() ? "" : "?" + String.join("&", params);
        return send(get("/api/teams/" + filter.team().code() + "/tasks" + query), TASK_LIST);
    }

    @Override
    public CompletableFuture<List<StatusDefinitionDto>> fetchStatusDefinitions(Team team) {
        return send(get("/api/teams/" + team.code() + "/statuses"), STATUS_LIST);
    }

    @Override
    public CompletableFuture<TaskDto> createTask(Team team, CreateTaskRequest request) {
        return send(withBody("POST", "/api/teams/" + team.code() + "/tasks", request), TASK);
    }

    @Override
    public CompletableFuture<TaskDto> updateTaskStatus(String taskId, String newStatus) {
        return send(withBody("PUT", "/api/tasks/" + encode(taskId) + "/status",
                new UpdateTaskStatusRequest(newStatus)), TASK);
    }

    @Override
    public CompletableFuture<Void> deleteTask(String taskId) {
        HttpRequest request = request("/api/tasks/" + encode(taskId)).DELETE().build();
        return this.<Void>send(request, null);
    }

    public CompletableFuture<UserDto> fetchUser(String userId) {
        return send(get("/api/users/" + encode(userId)), USER);
    }

    private <T> CompletableFuture<T> send(HttpRequest request, TypeReference<T> responseType) {
        log.debug("{} {}", request.method(), request.uri());
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .handle((response, error) -> {
                    if (error != null) {
                        BackendException failure = BackendException.from(error);
                        throw new BackendException(FailureKind.NETWORK_FAILURE,
                                request.method() + " " + request.uri() + " failed: " + failure.getMessage(), error);
                    }
                    int status = response.statusCode();
                    if (status == 404) {
                        throw new BackendException(FailureKind.NOT_FOUND,
                                request.method() + " " + request.uri() + " returned 404");
                    }
                    if (status < 200 || status >= 300) {
                        throw new BackendException(FailureKind.SERVER_REJECTION,
                                request.method() + " " + request.uri() + " returned " + status);
                    }
                    return decode(response.body(), responseType);
                });
    }

    private <T> T decode(String body, TypeReference<T> type) {
        if (type == null) {
            return null;
        }
        if (body == null || body.isBlank()) {
            throw new BackendException(FailureKind.SERVER_REJECTION, "Empty response body");
        }
        try {
            return objectMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new BackendException(FailureKind.SERVER_REJECTION, "Unreadable response: " + e.getOriginalMessage(), e);
        }
    }

    private HttpRequest get(String path) {
        return request(path).GET().build();
    }

    private HttpRequest withBody(String method, String path, Object body) {
        try {
            return request(path)
                    .header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize request body for " + path, e);
        }
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Accept", "application/json");
    }

    private static void addParam(List<String> params, String name, String value) {
        if (value != null) {
            params.add(name + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8));
        }
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
