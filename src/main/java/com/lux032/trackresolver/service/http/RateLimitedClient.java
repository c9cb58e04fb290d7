package com.lux032.trackresolver.service.http;

import com.lux032.trackresolver.config.ResolverConfig;
import com.lux032.trackresolver.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpHead;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.CloseableHttpResponse;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;

import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 带速率限制和指数退避的 HTTP 客户端
 * 每个上游服务一个实例:
 * 503/429 与网络错误按 RetryPolicy 重试,401/403 抛出 UpstreamAuthException,
 * 其他非 2xx 状态立即抛出 UpstreamStatusException
 */
@Slf4j
public class RateLimitedClient implements Closeable {

    private static final int MAX_LOGGED_BODY = 200;

    private final String service;
    private final CloseableHttpClient httpClient;
    private final RateLimiterState rateLimiter;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final Map<String, String> defaultHeaders;
    private final int timeoutSeconds;

    public RateLimitedClient(String service, CloseableHttpClient httpClient, RateLimiterState rateLimiter,
                             RetryPolicy retryPolicy, Sleeper sleeper, Map<String, String> defaultHeaders,
                             int timeoutSeconds) {
        this.service = service;
        this.httpClient = httpClient;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.defaultHeaders = new LinkedHashMap<>(defaultHeaders);
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * 按配置创建某个服务的客户端
     */
    public static RateLimitedClient create(String service, ResolverConfig config, long minIntervalMs,
                                           Map<String, String> defaultHeaders) {
        return new RateLimitedClient(service, createHttpClient(config), new RateLimiterState(minIntervalMs),
            RetryPolicy.fromConfig(config), Sleeper.SYSTEM, defaultHeaders, config.getHttpTimeoutSeconds());
    }

    /**
     * 创建 HttpClient,支持代理配置
     */
    public static CloseableHttpClient createHttpClient(ResolverConfig config) {
        HttpClientBuilder builder = HttpClients.custom();

        // 设置超时
        RequestConfig requestConfig = RequestConfig.custom()
            .setConnectionRequestTimeout(Timeout.ofSeconds(config.getHttpTimeoutSeconds()))
            .setResponseTimeout(Timeout.ofSeconds(config.getHttpTimeoutSeconds()))
            .build();
        builder.setDefaultRequestConfig(requestConfig);

        // 配置代理
        if (config.isProxyEnabled() && config.getProxyHost() != null && !config.getProxyHost().isEmpty()) {
            HttpHost proxy = new HttpHost(config.getProxyHost(), config.getProxyPort());
            builder.setProxy(proxy);
            log.info(I18nUtil.getMessage("proxy.enabled", config.getProxyHost(), config.getProxyPort()));
        } else if (config.isProxyEnabled()) {
            log.warn(I18nUtil.getMessage("proxy.enabled.no.host"));
        }

        return builder.build();
    }

    public String get(String url) throws IOException {
        return get(url, Collections.emptyMap());
    }

    /**
     * 执行 GET 请求并返回响应体
     * @param headers 附加请求头,会覆盖同名的默认请求头
     */
    public String get(String url, Map<String, String> headers) throws IOException {
        int retryIndex = 0;
        while (true) {
            IOException lastError;
            acquireSlot();

            HttpGet httpGet = new HttpGet(url);
            applyHeaders(httpGet, headers);
            try (CloseableHttpResponse response = httpClient.execute(httpGet)) {
                int statusCode = response.getCode();
                String responseBody = response.getEntity() != null
                    ? EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8)
                    : "";

                if (statusCode >= 200 && statusCode < 300) {
                    log.debug("{} API 响应: {}", service, abbreviate(responseBody));
                    rateLimiter.resetBackoff();
                    return responseBody;
                }
                if (statusCode == 401 || statusCode == 403) {
                    log.warn("{} API 拒绝访问: {}", service, statusCode);
                    throw new UpstreamAuthException(service, statusCode);
                }
                if (!retryPolicy.isThrottled(statusCode)) {
                    log.error("{} API 请求失败: {} - {}", service, statusCode, abbreviate(responseBody));
                    throw new UpstreamStatusException(service, statusCode, abbreviate(responseBody));
                }
                lastError = new UpstreamStatusException(service, statusCode, "throttled");
            } catch (UpstreamException e) {
                throw e;
            } catch (InterruptedIOException e) {
                // 读超时和连接超时也是 InterruptedIOException,只有线程真正被中断时才放弃
                if (Thread.currentThread().isInterrupted()) {
                    throw e;
                }
                lastError = e;
            } catch (ParseException e) {
                throw new UpstreamException(service, "failed to read response body", e);
            } catch (IOException e) {
                lastError = e;
            }

            if (retryIndex >= retryPolicy.getMaxRetries()) {
                log.error("{} 请求失败,已达最大重试次数({}/{})", service, retryIndex, retryPolicy.getMaxRetries());
                throw new RateLimitExceededException(service, retryIndex + 1, lastError);
            }
            long delay = rateLimiter.nextBackoff(retryPolicy, retryIndex);
            retryIndex++;
            log.warn("{} 请求失败(第{}/{}次重试): {} - {}ms后重试",
                service, retryIndex, retryPolicy.getMaxRetries(), lastError.getMessage(), delay);
            pause(delay);
        }
    }

    /**
     * HEAD 请求检查资源是否存在,不跟随重定向
     * 200 和重定向状态视为存在,其余状态视为不存在
     */
    public boolean exists(String url) throws IOException {
        acquireSlot();
        HttpHead httpHead = new HttpHead(url);
        applyHeaders(httpHead, Collections.emptyMap());
        httpHead.setConfig(RequestConfig.custom()
            .setRedirectsEnabled(false)
            .setConnectionRequestTimeout(Timeout.ofSeconds(timeoutSeconds))
            .setResponseTimeout(Timeout.ofSeconds(timeoutSeconds))
            .build());
        try (CloseableHttpResponse response = httpClient.execute(httpHead)) {
            int statusCode = response.getCode();
            return statusCode == 200 || (statusCode >= 301 && statusCode <= 308);
        }
    }

    public String getService() {
        return service;
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }

    private void applyHeaders(HttpUriRequestBase request, Map<String, String> headers) {
        defaultHeaders.forEach(request::setHeader);
        headers.forEach(request::setHeader);
    }

    private void acquireSlot() throws IOException {
        try {
            rateLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("rate limit wait interrupted");
        }
    }

    private void pause(long delayMs) throws IOException {
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("retry wait interrupted");
        }
    }

    private static String abbreviate(String body) {
        if (body == null || body.length() <= MAX_LOGGED_BODY) {
            return body;
        }
        return body.substring(0, MAX_LOGGED_BODY) + "...";
    }
}
