package com.scorebot.data;

import com.scorebot.config.Config;
import com.scorebot.model.Category;
import com.scorebot.model.FailureKind;
import com.scorebot.model.Metric;
import com.scorebot.model.RawMetricBag;
import com.scorebot.model.Symbol;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;

/**
 * Reads one JSON metrics document per symbol from {@code source.base_url} (a format string
 * taking the ticker). Both flat objects and objects grouped by category label are accepted.
 */
public final class HttpMetricSource implements MetricSource {
    private static final Logger LOG = LogManager.getLogger(HttpMetricSource.class);

    private final String baseUrl;
    private final String userAgent;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    public HttpMetricSource(Config config) {
        this(
                config.getString("source.base_url", "http://localhost:8080/metrics/%s"),
                config.getString("source.user_agent", "scorebot/1.0"),
                Duration.ofMillis(Math.max(1_000L, config.getLong("fetch.timeout_ms", 20_000L)))
        );
    }

    public HttpMetricSource(String baseUrl, String userAgent, Duration requestTimeout) {
        this.baseUrl = baseUrl;
        this.userAgent = userAgent == null || userAgent.isBlank() ? "scorebot/1.0" : userAgent;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public RawMetricBag fetch(Symbol symbol) throws FetchException, InterruptedException {
        String ticker = URLEncoder.encode(symbol.ticker(), StandardCharsets.UTF_8);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(String.format(Locale.ROOT, baseUrl, ticker)))
                .header("User-Agent", userAgent)
                .header("Accept", "application/json")
                .timeout(requestTimeout)
                .GET()
                .build();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw RateLimitedFetchClient.classify(e);
        }
        if (response.statusCode() / 100 != 2) {
            throw FetchException.forHttpStatus(response.statusCode(), symbol.ticker());
        }
        return parse(symbol, response.body());
    }

    static RawMetricBag parse(Symbol symbol, String body) throws FetchException {
        String text = body == null ? "" : body.trim();
        if (text.isEmpty()) {
            throw FetchException.permanent("no_data", "empty payload ticker=" + symbol.ticker());
        }
        JSONObject root;
        try {
            root = new JSONObject(text);
        } catch (JSONException e) {
            String sample = text.length() > 120 ? text.substring(0, 120) : text;
            throw new FetchException(
                    FailureKind.PERMANENT,
                    "parse_error",
                    "unexpected payload ticker=" + symbol.ticker() + ": " + sample,
                    e
            );
        }
        RawMetricBag.Builder builder = RawMetricBag.builder(symbol);
        readInto(builder, root);
        for (String key : root.keySet()) {
            Category group = Category.fromLabel(key);
            JSONObject nested = group == null ? null : root.optJSONObject(key);
            if (nested != null) {
                readInto(builder, nested);
            }
        }
        RawMetricBag bag = builder.build();
        if (bag.isEmpty()) {
            throw FetchException.permanent("no_data", "no known metrics ticker=" + symbol.ticker());
        }
        return bag;
    }

    private static void readInto(RawMetricBag.Builder builder, JSONObject object) {
        for (String key : object.keySet()) {
            Metric metric = Metric.fromKey(key);
            if (metric == null) {
                continue;
            }
            Object raw = object.opt(key);
            if (raw instanceof Number number) {
                builder.put(metric, number.doubleValue());
            } else if (raw instanceof String text && !text.isBlank()) {
                try {
                    builder.put(metric, Double.parseDouble(text.trim()));
                } catch (NumberFormatException e) {
                    LOG.debug("Ignoring non-numeric value for {}: {}", key, text);
                }
            }
        }
    }
}
