package com.rebalanceradar.ingestion.adapter.evm;

import com.rebalanceradar.ingestion.adapter.RpcException;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * EVM JSON-RPC client using WebClient.
 */
public class WebClientEvmRpcClient implements EvmRpcClient {

    static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final WebClient webClient;
    private final AtomicLong requestId = new AtomicLong();

    public WebClientEvmRpcClient(WebClient.Builder builder) {
        this.webClient = builder
                .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", requestId.incrementAndGet(),
                "method", method,
                "params", params != null ? params : new Object[]{}
        );
        return webClient.post()
                .uri(endpointUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(REQUEST_TIMEOUT)
                .onErrorMap(WebClientException.class, e -> new RpcException(e.getMessage(), e))
                .onErrorMap(TimeoutException.class, e -> new RpcException(method + " timed out on " + endpointUrl, e));
    }
}
