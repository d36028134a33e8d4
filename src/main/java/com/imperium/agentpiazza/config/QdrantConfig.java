package com.imperium.agentpiazza.config;

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.QdrantGrpcClient;
import io.qdrant.client.grpc.Collections.Distance;
import io.qdrant.client.grpc.Collections.VectorParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 条件性 Qdrant 配置：仅当 {@code app.vector.enabled=true} 时创建客户端，
 * 并在启动后确保 insight 向量集合存在（cosine）。未启用时不会因 Qdrant 不可达而启动失败。
 */
@Configuration
@ConditionalOnProperty(name = "app.vector.enabled", havingValue = "true")
public class QdrantConfig {

    private static final Logger log = LoggerFactory.getLogger(QdrantConfig.class);

    @Value("${app.vector.host:localhost}")
    private String host;

    @Value("${app.vector.port:6334}")
    private int port;

    @Value("${app.vector.use-tls:false}")
    private boolean useTls;

    @Value("${app.vector.api-key:}")
    private String apiKey;

    @Value("${app.vector.collection:insights-index}")
    private String collectionName;

    @Value("${app.vector.dimension:384}")
    private int dimension;

    @Value("${app.vector.startup-timeout:30s}")
    private Duration startupTimeout;

    @Bean(destroyMethod = "close")
    public QdrantClient qdrantClient() {
        QdrantGrpcClient.Builder builder = QdrantGrpcClient.newBuilder(host, port, useTls);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.withApiKey(apiKey);
        }
        return new QdrantClient(builder.build());
    }

    @Bean
    public ApplicationRunner qdrantCollectionInitializer(QdrantClient qdrantClient) {
        return args -> ensureCollection(qdrantClient);
    }

    void ensureCollection(QdrantClient client) {
        if (dimension <= 0) {
            throw new IllegalStateException("app.vector.dimension must be positive, got " + dimension);
        }
        long timeoutMs = startupTimeout.toMillis();
        try {
            boolean exists = client.collectionExistsAsync(collectionName, startupTimeout)
                    .get(timeoutMs, TimeUnit.MILLISECONDS);
            if (exists) {
                log.info("Qdrant collection '{}' already exists", collectionName);
                return;
            }
            VectorParams params = VectorParams.newBuilder()
                    .setSize(dimension)
                    .setDistance(Distance.Cosine)
                    .build();
            client.createCollectionAsync(collectionName, params, startupTimeout)
                    .get(timeoutMs, TimeUnit.MILLISECONDS);
            log.info("Created Qdrant collection '{}' (size={}, distance=cosine)", collectionName, dimension);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while preparing Qdrant collection", e);
        } catch (ExecutionException e) {
            if (isAlreadyExists(e)) {
                log.info("Qdrant collection '{}' was created concurrently", collectionName);
                return;
            }
            throw new IllegalStateException("Failed to prepare Qdrant collection " + collectionName, e);
        } catch (TimeoutException e) {
            throw new IllegalStateException("Timed out preparing Qdrant collection " + collectionName, e);
        }
    }

    private static boolean isAlreadyExists(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof StatusRuntimeException sre && sre.getStatus().getCode() == Status.Code.ALREADY_EXISTS) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
