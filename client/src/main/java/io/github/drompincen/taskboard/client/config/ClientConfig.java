package io.github.drompincen.taskboard.client.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.drompincen.taskboard.client.http.HttpTaskBoardBackend;
import io.github.drompincen.taskboard.client.session.BoardSession;
import io.github.drompincen.taskboard.engine.backend.BackendException;
import io.github.drompincen.taskboard.engine.schedule.ExecutorBoardScheduler;
import io.github.drompincen.taskboard.protocol.api.UserDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.CompletionException;

@Configuration
public class ClientConfig {

    private static final Logger log = LoggerFactory.getLogger(ClientConfig.class);

    @Bean
    ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    @Bean
    HttpTaskBoardBackend taskBoardBackend(ObjectMapper objectMapper,
                                          @Value("${taskboard.client.base-url:http://localhost:8080}") String baseUrl,
                                          @Value("${taskboard.client.request-timeout-ms:10000}") long timeoutMs) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(timeoutMs))
                .build();
        return new HttpTaskBoardBackend(httpClient, objectMapper, baseUrl, Duration.ofMillis(timeoutMs));
    }

    @Bean(destroyMethod = "close")
    ExecutorBoardScheduler boardScheduler() {
        return new ExecutorBoardScheduler("board-loop");
    }

    @Bean(destroyMethod = "close")
    BoardSession boardSession(HttpTaskBoardBackend backend, ExecutorBoardScheduler scheduler,
                              @Value("${taskboard.client.user-id}") String userId,
                              @Value("${taskboard.client.poll-interval-ms:3000}") long pollIntervalMs,
                              @Value("${taskboard.client.refresh-debounce-ms:1000}") long debounceMs) {
        UserDto user;
        try {
            user = backend.fetchUser(userId).join();
        } catch (CompletionException e) {
            BackendException failure = BackendException.from(e);
            throw new IllegalStateException("Cannot load board user " + userId + ": " + failure.getMessage(), failure);
        }
        log.info("Signed in as {} ({}, {})", user.name(), user.role(), user.team().code());
        return new BoardSession(backend, scheduler, user,
                Duration.ofMillis(pollIntervalMs), Duration.ofMillis(debounceMs));
    }
}
