package com.wangbin.liveprobe.core.client;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.wangbin.liveprobe.common.domain.entity.DeviceInfo;
import com.wangbin.liveprobe.common.domain.enums.FailureKind;
import com.wangbin.liveprobe.common.domain.enums.LiveState;
import com.wangbin.liveprobe.core.config.ProbeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * StreamHub REST接口客户端（使用Java 11+ HttpClient）
 *
 * 请求顺序：设备特征（缓存）-> 输入列表 -> 选中输入的链路统计和流统计。
 * 链路/流统计只对正在直播的SafeStreams输入请求，失败时忽略。
 */
@Slf4j
@Component
public class StreamHubTelemetryClient implements TelemetryClient {

    private static final String SAFESTREAMS = "SAFESTREAMS";
    private static final String[] INPUT_STATUS_KEYS = {"channelStatus", "channelState"};

    private final ProbeProperties.HttpConfig config;
    private final Clock clock;
    private final HttpClient httpClient;

    // deviceId -> 设备特征信息
    private final Cache<String, JSONObject> characteristicsCache;

    public StreamHubTelemetryClient(ProbeProperties properties, Clock clock) {
        this.config = properties.getHttp();
        this.clock = clock;
        this.httpClient = createHttpClient();
        this.characteristicsCache = Caffeine.newBuilder()
                .maximumSize(1000)
                .expireAfterWrite(Duration.ofSeconds(config.getCharacteristicsTtlSeconds()))
                .build();
    }

    private HttpClient createHttpClient() {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                .followRedirects(HttpClient.Redirect.NEVER);

        // 设备多为自签名证书
        if (config.isTrustAllCertificates()) {
            builder.sslContext(createTrustAllSSLContext());
        }
        return builder.build();
    }

    private SSLContext createTrustAllSSLContext() {
        try {
            TrustManager[] trustAllCerts = new TrustManager[] {
                    new X509TrustManager() {
                        public X509Certificate[] getAcceptedIssuers() { return new X509Certificate[0]; }
                        public void checkClientTrusted(X509Certificate[] certs, String authType) { }
                        public void checkServerTrusted(X509Certificate[] certs, String authType) { }
                    }
            };

            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, trustAllCerts, new SecureRandom());
            return sslContext;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("创建SSL上下文失败", e);
        }
    }

    @Override
    public FetchResult fetch(DeviceInfo device, Duration timeout) {
        if (device.getToken() == null || device.getToken().isBlank()) {
            return FetchResult.failure(FailureKind.PROTOCOL_ERROR, "缺少API令牌");
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        long fetchedAt = clock.millis();
        try {
            JSONObject characteristics = characteristicsCache.getIfPresent(device.getDeviceId());
            if (characteristics == null) {
                characteristics = asObject(getJson(device, "/", deadline), "/");
                characteristicsCache.put(device.getDeviceId(), characteristics);
            }

            List<JSONObject> inputs = normalizeInputs(getJson(device, "/inputs", deadline));
            int index = selectInput(device, inputs);
            JSONObject input = index < inputs.size() ? inputs.get(index) : new JSONObject();

            JSONObject payload = new JSONObject();
            payload.put("timestamp", fetchedAt);
            payload.put("deviceIdentifier", characteristics.getString("identifier"));
            payload.put("channels", characteristics.get("nbChannel"));
            payload.put("inputIndex", index);
            payload.put("input", input);

            if (isLiveSafeStreams(input)) {
                // 接口从1开始编号
                int inputNumber = index + 1;
                putOptional(payload, "linkStats", device, "/inputs/" + inputNumber + "/linkStats", deadline);
                putOptional(payload, "streamStats", device, "/inputs/" + inputNumber + "/streamStats", deadline);
            }
            return FetchResult.success(payload);
        } catch (TelemetryFetchException e) {
            log.debug("拉取设备 {} 状态失败: {} - {}", device.getDeviceId(), e.getFailureKind(), e.getMessage());
            return FetchResult.failure(e.getFailureKind(), e.getMessage());
        }
    }

    @Override
    public void evict(String deviceId) {
        characteristicsCache.invalidate(deviceId);
    }

    private void putOptional(JSONObject payload, String key, DeviceInfo device, String path, long deadline) {
        try {
            Object value = getJson(device, path, deadline);
            if (value instanceof JSONObject) {
                payload.put(key, value);
            }
        } catch (TelemetryFetchException e) {
            log.debug("设备 {} 可选接口 {} 获取失败: {}", device.getDeviceId(), path, e.getMessage());
        }
    }

    // ==================== 输入选择 ====================

    /**
     * 输入列表可能是数组、{"inputs": [...]} 或以序号为键的对象
     */
    List<JSONObject> normalizeInputs(Object body) {
        Object raw = body;
        if (body instanceof JSONObject object && object.containsKey("inputs")) {
            raw = object.get("inputs");
        }
        List<JSONObject> inputs = new ArrayList<>();
        if (raw instanceof JSONArray array) {
            for (int i = 0; i < array.size(); i++) {
                Object item = array.get(i);
                inputs.add(item instanceof JSONObject object ? object : new JSONObject());
            }
        } else if (raw instanceof JSONObject object) {
            List<String> keys = new ArrayList<>(object.keySet());
            keys.sort(Comparator.comparingInt(StreamHubTelemetryClient::numericKey).thenComparing(k -> k));
            for (String key : keys) {
                Object item = object.get(key);
                inputs.add(item instanceof JSONObject child ? child : new JSONObject());
            }
        }
        return inputs;
    }

    /**
     * 优先使用配置的输入，其次是第一个正在直播的输入，否则为0
     */
    int selectInput(DeviceInfo device, List<JSONObject> inputs) {
        Integer configured = device.getInputIndex();
        if (configured != null && configured >= 0 && (inputs.isEmpty() || configured < inputs.size())) {
            return configured;
        }
        for (int i = 0; i < inputs.size(); i++) {
            if (inputStatus(inputs.get(i)).isLive()) {
                return i;
            }
        }
        return 0;
    }

    private boolean isLiveSafeStreams(JSONObject input) {
        String channelType = input.getString("channelType");
        return inputStatus(input).isLive() && channelType != null && channelType.toUpperCase().contains(SAFESTREAMS);
    }

    private LiveState inputStatus(Map<String, Object> input) {
        for (String key : INPUT_STATUS_KEYS) {
            Object value = input.get(key);
            if (value != null) {
                return LiveState.fromStatus(value);
            }
        }
        return LiveState.UNKNOWN;
    }

    private static int numericKey(String key) {
        try {
            return Integer.parseInt(key);
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }

    // ==================== HTTP ====================

    String buildUrl(DeviceInfo device, String path) {
        String relative = path.startsWith("/") ? path.substring(1) : path;
        return device.getBaseUrl() + "/" + relative
                + "?api_key=" + URLEncoder.encode(device.getToken(), StandardCharsets.UTF_8);
    }

    private Object getJson(DeviceInfo device, String path, long deadline) throws TelemetryFetchException {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
            throw new TelemetryFetchException(FailureKind.TIMEOUT, "请求超时: " + path);
        }
        String url = buildUrl(device, path);
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(Duration.ofNanos(remaining))
                    .header("Accept", "application/json")
                    .header("User-Agent", config.getUserAgent())
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new TelemetryFetchException(FailureKind.PROTOCOL_ERROR, "无效的设备地址: " + e.getMessage(), e);
        }

        HttpResponse<String> response = await(httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()),
                remaining, path);
        int status = response.statusCode();
        if (status >= 300 && status < 400) {
            String location = response.headers().firstValue("location").orElse("");
            throw new TelemetryFetchException(FailureKind.PROTOCOL_ERROR,
                    "重定向 " + status + " 到 " + location + ": " + path);
        }
        if (status < 200 || status >= 300) {
            throw new TelemetryFetchException(FailureKind.PROTOCOL_ERROR, "HTTP状态码 " + status + ": " + path);
        }
        return parseBody(response, path);
    }

    private HttpResponse<String> await(CompletableFuture<HttpResponse<String>> future, long remainingNanos,
                                       String path) throws TelemetryFetchException {
        try {
            return future.get(remainingNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TelemetryFetchException(FailureKind.TIMEOUT, "请求超时: " + path, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TelemetryFetchException(FailureKind.TIMEOUT, "请求被中断: " + path, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof HttpTimeoutException) {
                throw new TelemetryFetchException(FailureKind.TIMEOUT, "请求超时: " + path, cause);
            }
            if (cause instanceof IOException) {
                throw new TelemetryFetchException(FailureKind.UNREACHABLE,
                        "设备不可达: " + cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
            }
            throw new TelemetryFetchException(FailureKind.UNREACHABLE, "请求失败: " + cause, cause);
        }
    }

    /**
     * Content-Type不可靠，只要内容像JSON就尝试解析
     */
    private Object parseBody(HttpResponse<String> response, String path) throws TelemetryFetchException {
        String body = response.body() == null ? "" : response.body().trim();
        if (body.startsWith("{") || body.startsWith("[")) {
            try {
                return JSON.parse(body);
            } catch (JSONException e) {
                throw new TelemetryFetchException(FailureKind.PROTOCOL_ERROR, "JSON解析失败: " + path, e);
            }
        }
        String contentType = response.headers().firstValue("content-type").orElse("");
        String preview = body.length() > 200 ? body.substring(0, 200) : body;
        throw new TelemetryFetchException(FailureKind.PROTOCOL_ERROR,
                "非JSON响应 (content-type=" + contentType + "): " + preview.replace('\n', ' '));
    }

    private JSONObject asObject(Object body, String path) throws TelemetryFetchException {
        if (body instanceof JSONObject object) {
            return object;
        }
        throw new TelemetryFetchException(FailureKind.PROTOCOL_ERROR, "响应不是JSON对象: " + path);
    }
}
