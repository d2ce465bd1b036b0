package com.github.anirbanmu.kookbridge.kook;

import com.github.anirbanmu.kookbridge.kook.json.RestPayloads.ChannelMessageRequest;
import com.github.anirbanmu.kookbridge.kook.json.RestPayloads.DirectMessageRequest;
import com.github.anirbanmu.kookbridge.kook.json.RestPayloads.GatewayIndexResponse;
import com.github.anirbanmu.kookbridge.kook.json.RestPayloads.MessageCreateResponse;
import com.github.anirbanmu.kookbridge.kook.json.RestPayloads.SelfUser;
import com.github.anirbanmu.kookbridge.kook.json.RestPayloads.SelfUserResponse;
import com.github.anirbanmu.kookbridge.log.Log;
import com.github.anirbanmu.kookbridge.util.Http;
import com.github.anirbanmu.kookbridge.util.Json;
import com.github.anirbanmu.kookbridge.util.Threads;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.Semaphore;

public class KookHttpClient implements KookApi {
    private static final String BASE_URL = "https://www.kookapp.cn/api/v3";
    private static final int MAX_BURST = 10;
    private static final int REFILL_MS = 100; // ~10 req/s per bot
    private static final Duration REQUEST_TIMEOUT = Duration.ofMillis(5000);

    private final String token;
    private final Semaphore limiter;

    public KookHttpClient(String token) {
        this.token = token;
        this.limiter = new Semaphore(MAX_BURST);
        startRefillThread();
    }

    private void startRefillThread() {
        Threads.startDaemon("kook-rate-limiter-refill", () -> {
            while (true) {
                try {
                    Thread.sleep(REFILL_MS);
                    if (limiter.availablePermits() < MAX_BURST) {
                        limiter.release();
                    }
                } catch (InterruptedException e) {
                    break;
                } catch (Exception e) {
                    Log.error("rate_limiter.refill_error", e);
                }
            }
        });
    }

    @Override
    public KookResult<String> fetchGatewayEndpoint() {
        KookResult<GatewayIndexResponse> result = send(
            request("/gateway/index?compress=0").GET(), GatewayIndexResponse.class);
        if (result instanceof KookResult.Failure<GatewayIndexResponse> f) {
            return new KookResult.Failure<>(f.message(), f.code(), f.exception());
        }
        GatewayIndexResponse body = ((KookResult.Success<GatewayIndexResponse>) result).value();
        if (body.code() != 0) {
            return new KookResult.Failure<>(describe(body.message(), body.code()), body.code());
        }
        if (body.data() == null || body.data().url() == null || body.data().url().isBlank()) {
            return new KookResult.Failure<>("gateway index returned no url");
        }
        return new KookResult.Success<>(body.data().url());
    }

    @Override
    public KookResult<SelfUser> fetchSelfIdentity() {
        KookResult<SelfUserResponse> result = send(request("/user/me").GET(), SelfUserResponse.class);
        if (result instanceof KookResult.Failure<SelfUserResponse> f) {
            return new KookResult.Failure<>(f.message(), f.code(), f.exception());
        }
        SelfUserResponse body = ((KookResult.Success<SelfUserResponse>) result).value();
        if (body.code() != 0 || body.data() == null) {
            return new KookResult.Failure<>(describe(body.message(), body.code()), body.code());
        }
        return new KookResult.Success<>(body.data());
    }

    @Override
    public KookResult<String> sendChannelMessage(ChannelMessageRequest message) {
        return messageCreated(send(request("/message/create").POST(bodyPublisher(message)), MessageCreateResponse.class));
    }

    @Override
    public KookResult<String> sendDirectMessage(DirectMessageRequest message) {
        return messageCreated(send(request("/direct-message/create").POST(bodyPublisher(message)), MessageCreateResponse.class));
    }

    private static KookResult<String> messageCreated(KookResult<MessageCreateResponse> result) {
        if (result instanceof KookResult.Failure<MessageCreateResponse> f) {
            return new KookResult.Failure<>(f.message(), f.code(), f.exception());
        }
        MessageCreateResponse body = ((KookResult.Success<MessageCreateResponse>) result).value();
        if (body.code() != 0) {
            return new KookResult.Failure<>(describe(body.message(), body.code()), body.code());
        }
        return new KookResult.Success<>(body.data() == null ? null : body.data().msgId());
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder()
            .uri(URI.create(BASE_URL + path))
            .header("Authorization", "Bot " + token)
            .header("Content-Type", "application/json");
    }

    private HttpRequest.BodyPublisher bodyPublisher(Object data) {
        try {
            return HttpRequest.BodyPublishers.ofByteArray(Json.toBytes(data));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to serialize request body", e);
        }
    }

    private <T> KookResult<T> send(HttpRequest.Builder builder, Class<T> responseType) {
        HttpRequest request = builder.timeout(REQUEST_TIMEOUT).build();
        try {
            limiter.acquire();
            HttpResponse<byte[]> response = Http.CLIENT.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (response.statusCode() >= 400) {
                Log.error("http.request_failed", "path", request.uri().getPath(), "status", response.statusCode());
                return new KookResult.Failure<>("KOOK API http error", response.statusCode());
            }
            return new KookResult.Success<>(Json.read(responseType, response.body()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new KookResult.Failure<>("HTTP request interrupted", e);
        } catch (IOException e) {
            return new KookResult.Failure<>("HTTP request failed", e);
        }
    }

    private static String describe(String message, int code) {
        return message == null || message.isBlank() ? "code " + code : message;
    }
}
