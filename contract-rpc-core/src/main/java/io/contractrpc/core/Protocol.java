package io.contractrpc.core;

/**
 * Wire-level constants shared by servers and clients (content types, reserved names and codes).
 *
 * <p>This module intentionally contains no HTTP client/server bindings and no JSON library dependencies.
 */
public final class Protocol {
    private Protocol() {}

    // HTTP headers
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_ACCEPT = "Accept";
    public static final String H_CACHE_CONTROL = "Cache-Control";
    public static final String H_CONNECTION = "Connection";
    public static final String H_UPGRADE = "Upgrade";

    // Content types
    public static final String CT_JSON = "application/json";
    public static final String CT_EVENT_STREAM = "text/event-stream";
    public static final String CT_NDJSON = "application/x-ndjson";
    public static final String CT_FORM_URLENCODED = "application/x-www-form-urlencoded";
    public static final String CT_MULTIPART_FORM = "multipart/form-data";
    public static final String CT_TEXT = "text/plain; charset=utf-8";

    // Message envelope
    public static final String ENVELOPE_TYPE = "type";
    public static final String ENVELOPE_PAYLOAD = "payload";
    /** Reserved server envelope type used to answer invalid client messages. */
    public static final String ERROR_MESSAGE_TYPE = "error";
    public static final String VALIDATION_ERROR_CODE = "VALIDATION_ERROR";
    /** Message type reported when a frame is not a well-formed envelope. */
    public static final String UNKNOWN_MESSAGE_TYPE = "unknown";

    // Chunk frames
    public static final String FRAME_KIND = "kind";
    public static final String FRAME_VALUE = "value";
    public static final String KIND_CHUNK = "chunk";
    public static final String KIND_FINAL = "final";

    // Error bodies
    public static final String ERR_VALIDATION = "Validation Error";
    public static final String ERR_NOT_FOUND = "Not Found";
    public static final String ERR_INTERNAL = "Internal Server Error";
    public static final String ERR_UPGRADE_REQUIRED = "Upgrade Required";
    public static final String ERR_PAYLOAD_TOO_LARGE = "Payload Too Large";

    public static final int STATUS_NO_CONTENT = 204;
}
