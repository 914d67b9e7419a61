package io.fuzzdeck.api.result;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one mutated request, as reported by the engine.
 * <p>
 * Immutable: byte payloads are copied on the way in and on the way out.
 * A failure reason is present if and only if the request did not succeed.
 * Equality compares payloads by content.
 */
public record ResultRecord(
        String uuid,
        boolean ok,
        int statusCode,
        String method,
        String host,
        String contentType,
        List<Header> headers,
        byte[] requestBytes,
        byte[] responseBytes,
        String responseEncoding,
        long bodyLength,
        long durationMs,
        Instant timestamp,
        String failureReason
) {

    public ResultRecord {
        if (uuid == null) {
            throw new IllegalArgumentException("Result uuid must not be null");
        }
        boolean hasReason = failureReason != null && !failureReason.isEmpty();
        if (ok && hasReason) {
            throw new IllegalArgumentException("Successful result must not carry a failure reason");
        }
        if (!ok && !hasReason) {
            throw new IllegalArgumentException("Failed result must carry a failure reason");
        }
        if (bodyLength < 0 || durationMs < 0) {
            throw new IllegalArgumentException("Body length and duration must be non-negative");
        }
        headers = headers == null ? List.of() : List.copyOf(headers);
        requestBytes = requestBytes == null ? new byte[0] : requestBytes.clone();
        responseBytes = responseBytes == null ? new byte[0] : responseBytes.clone();
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    @Override
    public byte[] requestBytes() {
        return requestBytes.clone();
    }

    @Override
    public byte[] responseBytes() {
        return responseBytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResultRecord other)) {
            return false;
        }
        return ok == other.ok
                && statusCode == other.statusCode
                && bodyLength == other.bodyLength
                && durationMs == other.durationMs
                && uuid.equals(other.uuid)
                && Objects.equals(method, other.method)
                && Objects.equals(host, other.host)
                && Objects.equals(contentType, other.contentType)
                && headers.equals(other.headers)
                && Arrays.equals(requestBytes, other.requestBytes)
                && Arrays.equals(responseBytes, other.responseBytes)
                && Objects.equals(responseEncoding, other.responseEncoding)
                && timestamp.equals(other.timestamp)
                && Objects.equals(failureReason, other.failureReason);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(uuid, ok, statusCode, method, host, contentType, headers,
                responseEncoding, bodyLength, durationMs, timestamp, failureReason);
        result = 31 * result + Arrays.hashCode(requestBytes);
        result = 31 * result + Arrays.hashCode(responseBytes);
        return result;
    }

    public Optional<String> failure() {
        return Optional.ofNullable(failureReason);
    }

    public FailureKind failureKind() {
        return ok ? FailureKind.NONE : FailureKind.classify(failureReason);
    }

    public static Builder builder(String uuid) {
        return new Builder(uuid);
    }

    /**
     * One response header, in the order the engine reported it.
     */
    public record Header(String name, String value) {

        public Header {
            if (name == null) {
                throw new IllegalArgumentException("Header name must not be null");
            }
            value = value == null ? "" : value;
        }
    }

    public static final class Builder {
        private final String uuid;
        private boolean ok = true;
        private int statusCode;
        private String method = "";
        private String host = "";
        private String contentType = "";
        private final List<Header> headers = new ArrayList<>();
        private byte[] requestBytes;
        private byte[] responseBytes;
        private String responseEncoding;
        private long bodyLength;
        private long durationMs;
        private Instant timestamp;
        private String failureReason;

        private Builder(String uuid) {
            this.uuid = uuid;
        }

        public Builder succeeded(int statusCode) {
            this.ok = true;
            this.statusCode = statusCode;
            this.failureReason = null;
            return this;
        }

        public Builder failed(String reason) {
            this.ok = false;
            this.failureReason = reason;
            return this;
        }

        public Builder method(String method) {
            this.method = method;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder header(String name, String value) {
            headers.add(new Header(name, value));
            return this;
        }

        public Builder request(byte[] requestBytes) {
            this.requestBytes = requestBytes;
            return this;
        }

        public Builder response(byte[] responseBytes) {
            this.responseBytes = responseBytes;
            this.bodyLength = responseBytes == null ? 0 : responseBytes.length;
            return this;
        }

        public Builder responseEncoding(String responseEncoding) {
            this.responseEncoding = responseEncoding;
            return this;
        }

        public Builder bodyLength(long bodyLength) {
            this.bodyLength = bodyLength;
            return this;
        }

        public Builder durationMs(long durationMs) {
            this.durationMs = durationMs;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public ResultRecord build() {
            return new ResultRecord(uuid, ok, statusCode, method, host, contentType, headers,
                    requestBytes, responseBytes, responseEncoding, bodyLength, durationMs,
                    timestamp, failureReason);
        }
    }
}
