package io.typeflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * Opaque media value (image or audio) referenced either by URL or by an inline base64 payload.
 * Two values built from equal arguments are equal, and {@link #fromJson(JsonNode)} restores
 * exactly what {@link #toJson()} persisted.
 *
 * <p>Immutable and thread-safe.
 */
public final class MediaValue {

    private final MediaKind kind;
    private final String url;
    private final String base64;
    private final String mediaType;

    private MediaValue(MediaKind kind, String url, String base64, String mediaType) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.url = url;
        this.base64 = base64;
        this.mediaType = mediaType;
    }

    public static MediaValue fromUrl(String url, MediaKind kind) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be null or blank");
        }
        return new MediaValue(kind, url, null, null);
    }

    /**
     * @param mediaType MIME type such as {@code image/png}; may be {@code null} when unknown
     */
    public static MediaValue fromBase64(String base64, String mediaType, MediaKind kind) {
        if (base64 == null || base64.isEmpty()) {
            throw new IllegalArgumentException("base64 must not be null or empty");
        }
        return new MediaValue(kind, null, base64, mediaType);
    }

    /**
     * Restores a value persisted by {@link #toJson()}.
     *
     * @throws IllegalArgumentException if the node is not a persisted media value
     */
    public static MediaValue fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("media value must be a JSON object");
        }
        MediaKind kind = MediaKind.fromTypeName(node.path("kind").asText(""))
                .orElseThrow(() -> new IllegalArgumentException("unknown media kind: " + node.path("kind")));
        if (node.hasNonNull("url")) {
            return fromUrl(node.get("url").asText(), kind);
        }
        if (node.hasNonNull("base64")) {
            String mediaType = node.hasNonNull("media_type") ? node.get("media_type").asText() : null;
            return fromBase64(node.get("base64").asText(), mediaType, kind);
        }
        throw new IllegalArgumentException("media value needs either 'url' or 'base64'");
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("kind", kind.typeName());
        if (url != null) {
            node.put("url", url);
        } else {
            node.put("base64", base64);
            if (mediaType != null) {
                node.put("media_type", mediaType);
            }
        }
        return node;
    }

    public MediaKind kind() {
        return kind;
    }

    public boolean isUrl() {
        return url != null;
    }

    /** The URL, or {@code null} for inline values. */
    public String url() {
        return url;
    }

    /** The base64 payload, or {@code null} for URL values. */
    public String base64() {
        return base64;
    }

    /** The MIME type of an inline value, or {@code null}. */
    public String mediaType() {
        return mediaType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MediaValue that)) return false;
        return kind == that.kind
                && Objects.equals(url, that.url)
                && Objects.equals(base64, that.base64)
                && Objects.equals(mediaType, that.mediaType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, url, base64, mediaType);
    }

    @Override
    public String toString() {
        if (url != null) {
            return "MediaValue[" + kind.typeName() + ", url=" + url + "]";
        }
        return "MediaValue[" + kind.typeName() + ", base64(" + base64.length() + " chars)"
                + (mediaType != null ? ", " + mediaType : "") + "]";
    }
}
