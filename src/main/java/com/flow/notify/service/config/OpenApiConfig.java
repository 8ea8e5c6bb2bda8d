package com.flow.notify.service.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.headers.Header;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.media.IntegerSchema;
import io.swagger.v3.oas.models.servers.Server;
import lombok.RequiredArgsConstructor;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;

import java.util.ArrayList;
import java.util.List;

/**
 * API documentation, split into the runtime surface (events and incidents)
 * and the configuration surface (dedup, throttle and escalation resources).
 *
 * The description reflects the pipeline stages switched on in
 * {@link NotifyConfig.Features} and the channels unrouted events go to.
 */
@Configuration
@RequiredArgsConstructor
public class OpenApiConfig {

    private final NotifyConfig notifyConfig;

    @Value("${server.port:8080}")
    private int serverPort;

    @Bean
    public OpenAPI notifyEngineOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Notify Engine Service API")
                        .description(describePipeline())
                        .version("1.0.0"))
                .components(new Components()
                        .addHeaders(HttpHeaders.RETRY_AFTER, new Header()
                                .description("Seconds until a RAISE_ERROR throttle admits the next event")
                                .schema(new IntegerSchema())))
                .servers(List.of(new Server()
                        .url("http://localhost:" + serverPort)
                        .description("Local Development Server")));
    }

    @Bean
    public GroupedOpenApi runtimeApi() {
        return GroupedOpenApi.builder()
                .group("runtime")
                .displayName("Events and incidents")
                .pathsToMatch("/events/**", "/incidents/**")
                .build();
    }

    @Bean
    public GroupedOpenApi configurationApi() {
        return GroupedOpenApi.builder()
                .group("configuration")
                .displayName("Dedup, throttle and escalation configuration")
                .pathsToMatch("/config/**")
                .build();
    }

    String describePipeline() {
        NotifyConfig.Features features = notifyConfig.getFeatures();
        List<String> stages = new ArrayList<>();
        if (features.isDeduplicationEnabled()) {
            stages.add("deduplication");
        }
        if (features.isThrottlingEnabled()) {
            stages.add("throttling");
        }
        if (features.isEscalationEnabled()) {
            stages.add("escalation");
        }
        String active = stages.isEmpty() ? "none (events pass straight to delivery)" : String.join(", ", stages);
        return "Decides whether each detector event is delivered and drives incidents until they are "
                + "acknowledged or resolved. Active stages: " + active + ". Events without explicit channels "
                + "are delivered to: " + String.join(", ", notifyConfig.getDefaultChannels()) + ".";
    }
}
