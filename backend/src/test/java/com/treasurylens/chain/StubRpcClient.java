package com.treasurylens.chain;

import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Type;
import org.web3j.crypto.Hash;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * Answers eth_call by function signature with ABI-encoded outputs; unknown calls revert.
 */
class StubRpcClient implements EvmRpcClient {

    private final List<Answer> answers = new CopyOnWriteArrayList<>();
    private final Set<String> downEndpoints = ConcurrentHashMap.newKeySet();
    final List<String> calledEndpoints = new CopyOnWriteArrayList<>();

    @SuppressWarnings("rawtypes")
    StubRpcClient respond(String signature, Type... outputs) {
        return respondWhen(signature, data -> true, outputs);
    }

    @SuppressWarnings("rawtypes")
    StubRpcClient respondWhen(String signature, Predicate<String> dataMatcher, Type... outputs) {
        String encoded = "0x" + FunctionEncoder.encodeConstructor(List.of(outputs));
        answers.add(0, new Answer(selector(signature), dataMatcher, encoded));
        return this;
    }

    StubRpcClient respondRaw(String signature, String resultHex) {
        answers.add(0, new Answer(selector(signature), data -> true, resultHex));
        return this;
    }

    static String selector(String signature) {
        return Hash.sha3String(signature).substring(0, 10);
    }

    StubRpcClient down(String endpoint) {
        downEndpoints.add(endpoint);
        return this;
    }

    @Override
    public Mono<String> call(String endpointUrl, String method, Object params) {
        calledEndpoints.add(endpointUrl);
        if (downEndpoints.contains(endpointUrl)) {
            return Mono.error(new RpcException("HTTP 503 from " + endpointUrl));
        }
        Map<?, ?> tx = (Map<?, ?>) ((List<?>) params).get(0);
        String data = (String) tx.get("data");
        List<Answer> snapshot = new ArrayList<>(answers);
        for (Answer answer : snapshot) {
            if (data.startsWith(answer.selector()) && answer.dataMatcher().test(data)) {
                return Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":\"" + answer.result() + "\"}");
            }
        }
        return Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"error\":{\"code\":3,\"message\":\"execution reverted\"}}");
    }

    private record Answer(String selector, Predicate<String> dataMatcher, String result) {
    }
}
