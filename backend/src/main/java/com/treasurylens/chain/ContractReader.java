package com.treasurylens.chain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.treasurylens.common.EndpointFallback;
import com.treasurylens.common.RetryPolicy;
import com.treasurylens.common.UpstreamException;
import com.treasurylens.domain.Chain;
import com.treasurylens.resilience.CircuitGate;
import com.treasurylens.resilience.GateResult;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Read-only contract calls: eth_call across the chain's endpoint list (first success wins), inside the rpc gate,
 * bounded by the local RPC rate limiter, decoded with the function's ABI outputs.
 */
@Slf4j
public class ContractReader {

    private final EvmRpcClient rpcClient;
    private final ChainEndpoints endpoints;
    private final CircuitGate rpcGate;
    private final RateLimiter rpcRateLimiter;
    private final ObjectMapper objectMapper;

    public ContractReader(EvmRpcClient rpcClient, ChainEndpoints endpoints, CircuitGate rpcGate,
                          RateLimiter rpcRateLimiter, ObjectMapper objectMapper) {
        this.rpcClient = rpcClient;
        this.endpoints = endpoints;
        this.rpcGate = rpcGate;
        this.rpcRateLimiter = rpcRateLimiter;
        this.objectMapper = objectMapper;
    }

    /**
     * Calls a view function and returns its decoded outputs.
     * Errors with MissingEndpointException when the chain has no endpoint, CircuitOpenException when the rpc gate
     * is open, UpstreamException when every endpoint failed or the result does not decode.
     */
    @SuppressWarnings("rawtypes")
    public Mono<List<Type>> call(Chain chain, String to, Function function) {
        return Mono.defer(() -> {
            RetryPolicy policy = endpoints.policyFor(chain);
            String data = FunctionEncoder.encode(function);
            String label = function.getName() + "@" + chain.getId();
            Map<String, Object> variables = Map.of("chainId", chain.getId(), "to", to, "function", function.getName());
            return rpcGate.<String>call(label, variables,
                            () -> EndpointFallback.firstSuccess(policy, label, endpoint -> ethCall(endpoint, to, data)))
                    .flatMap(GateResult::toMono)
                    .map(hex -> decode(hex, function, label));
        });
    }

    /**
     * Single decoded output of a one-value function.
     */
    public <T> Mono<T> callSingle(Chain chain, String to, Function function, Class<T> valueType) {
        return call(chain, to, function).map(outputs -> valueType.cast(outputs.get(0).getValue()));
    }

    private Mono<String> ethCall(String endpoint, String to, String data) {
        long waitNanos = rpcRateLimiter.reservePermission();
        if (waitNanos < 0) {
            return Mono.error(new RpcException("Local RPC limiter timeout before eth_call on " + endpoint));
        }
        List<Object> params = List.of(Map.of("to", to, "data", data), "latest");
        Mono<String> call = rpcClient.call(endpoint, "eth_call", params).map(this::extractResult);
        if (waitNanos == 0) {
            return call;
        }
        log.debug("Local RPC limiter delayed eth_call on {} by {} ms", endpoint, waitNanos / 1_000_000L);
        return Mono.delay(Duration.ofNanos(waitNanos)).then(call);
    }

    private String extractResult(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new RpcException("Malformed JSON-RPC response: " + e.getOriginalMessage(), e);
        }
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new RpcException("eth_call error: " + error.path("message").asText(error.toString()));
        }
        String result = root.path("result").asText(null);
        if (result == null || !result.startsWith("0x")) {
            throw new RpcException("eth_call returned no result");
        }
        return result;
    }

    @SuppressWarnings("rawtypes")
    private static List<Type> decode(String hex, Function function, String label) {
        List<Type> outputs;
        try {
            outputs = FunctionReturnDecoder.decode(hex, function.getOutputParameters());
        } catch (RuntimeException e) {
            throw new UpstreamException(label + " returned undecodable data", e);
        }
        if (outputs.size() != function.getOutputParameters().size()) {
            throw new UpstreamException(label + " returned " + outputs.size() + " value(s), expected "
                    + function.getOutputParameters().size() + " (no contract at address?)");
        }
        return outputs;
    }
}
