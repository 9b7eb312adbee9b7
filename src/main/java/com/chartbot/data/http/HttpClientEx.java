package com.chartbot.data.http;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;

/**
 * Thin wrapper over {@link HttpClient}. Non-2xx responses raise {@link HttpStatusException}.
 */
public class HttpClientEx {
    private static final String USER_AGENT = "ChartBot/1.0";

    private final HttpClient client;

    public HttpClientEx() {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(20))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public String getText(String url, Map<String, String> headers, int timeoutSeconds)
            throws IOException, InterruptedException {
        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .GET()
                .header("User-Agent", USER_AGENT);
        applyHeaders(req, headers);
        HttpResponse<String> resp = client.send(req.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) return resp.body();
        throw new HttpStatusException(resp.statusCode(), redact(url), resp.body());
    }

    public String postJson(String url, String json, Map<String, String> headers, int timeoutSeconds)
            throws IOException, InterruptedException {
        HttpResponse<String> resp = client.send(jsonRequest(url, json, headers, timeoutSeconds),
                HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) return resp.body();
        throw new HttpStatusException(resp.statusCode(), redact(url), resp.body());
    }

    /**
     * POSTs JSON and returns the raw response body, for endpoints that answer with binary content.
     */
    public BinaryResponse postJsonForBytes(String url, String json, Map<String, String> headers, int timeoutSeconds)
            throws IOException, InterruptedException {
        HttpResponse<byte[]> resp = client.send(jsonRequest(url, json, headers, timeoutSeconds),
                HttpResponse.BodyHandlers.ofByteArray());
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) {
            String contentType = resp.headers().firstValue("Content-Type").orElse("application/octet-stream");
            return new BinaryResponse(resp.body(), contentType);
        }
        throw new HttpStatusException(resp.statusCode(), redact(url), new String(resp.body(), StandardCharsets.UTF_8));
    }

    /**
     * POSTs a multipart/form-data body with plain text fields and one file part.
     */
    public String postMultipart(
            String url,
            Map<String, String> fields,
            String fileField,
            String fileName,
            String fileMime,
            byte[] fileBytes,
            int timeoutSeconds
    ) throws IOException, InterruptedException {
        String boundary = "----chartbot" + UUID.randomUUID().toString().replace("-", "");
        byte[] body = multipartBody(boundary, fields, fileField, fileName, fileMime, fileBytes);
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                .header("User-Agent", USER_AGENT)
                .build();
        HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) return resp.body();
        throw new HttpStatusException(resp.statusCode(), redact(url), resp.body());
    }

    static byte[] multipartBody(
            String boundary,
            Map<String, String> fields,
            String fileField,
            String fileName,
            String fileMime,
            byte[] fileBytes
    ) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        if (fields != null) {
            for (Map.Entry<String, String> field : fields.entrySet()) {
                if (field.getValue() == null) {
                    continue;
                }
                write(out, "--" + boundary + "\r\n");
                write(out, "Content-Disposition: form-data; name=\"" + field.getKey() + "\"\r\n\r\n");
                write(out, field.getValue() + "\r\n");
            }
        }
        if (fileBytes != null) {
            write(out, "--" + boundary + "\r\n");
            write(out, "Content-Disposition: form-data; name=\"" + fileField + "\"; filename=\"" + fileName + "\"\r\n");
            write(out, "Content-Type: " + fileMime + "\r\n\r\n");
            out.writeBytes(fileBytes);
            write(out, "\r\n");
        }
        write(out, "--" + boundary + "--\r\n");
        return out.toByteArray();
    }

    private HttpRequest jsonRequest(String url, String json, Map<String, String> headers, int timeoutSeconds) {
        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .header("Content-Type", "application/json")
                .header("User-Agent", USER_AGENT);
        applyHeaders(req, headers);
        return req.build();
    }

    private void applyHeaders(HttpRequest.Builder req, Map<String, String> headers) {
        if (headers == null) {
            return;
        }
        for (Map.Entry<String, String> header : headers.entrySet()) {
            if (header.getValue() != null) {
                req.header(header.getKey(), header.getValue());
            }
        }
    }

    private static void write(ByteArrayOutputStream out, String text) {
        out.writeBytes(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Strips query strings and bot tokens so URLs can go into logs and job-log detail.
     */
    static String redact(String url) {
        if (url == null) {
            return "";
        }
        String out = url.replaceAll("(?i)([?&](apikey|api_key|token)=)[^&]+", "$1***");
        return out.replaceAll("/bot[^/]+/", "/bot***/");
    }

    public record BinaryResponse(byte[] body, String contentType) {
    }
}
