package io.pluginwire.message;

import io.pluginwire.codec.ContentCodec;
import io.pluginwire.config.PluginWireConfig;
import io.pluginwire.error.InvalidReplyException;
import io.pluginwire.model.Envelope;
import io.pluginwire.model.ErrorInfo;
import io.pluginwire.model.ExecutionStatus;
import io.pluginwire.model.Header;
import io.pluginwire.model.HubEndpoints;
import io.pluginwire.model.MessageType;
import io.pluginwire.schema.SchemaRegistry;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Produces envelopes for each message type.
 *
 * <p>Replies take routing from their request: source and target are swapped, the session
 * is kept and the request header becomes {@code parent_header}. The builder also enforces
 * the one rule the schema cannot express: an {@code error} status needs an error value.
 */
public final class MessageBuilder {
    public static final String COMMAND = "command";
    public static final String SILENT = "silent";
    public static final String STOP_ON_ERROR = "stop_on_error";
    public static final String STATUS = "status";
    public static final String EXECUTION_COUNT = "execution_count";

    private final ContentCodec codec;
    private final String version;
    private final Clock clock;
    private final Supplier<String> ids;

    public MessageBuilder() {
        this(ContentCodec.standard(), PluginWireConfig.DEFAULT_PROTOCOL_VERSION, Clock.systemUTC(), MessageBuilder::randomId);
    }

    public MessageBuilder(ContentCodec codec, String version, Clock clock, Supplier<String> ids) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.version = Objects.requireNonNull(version, "version");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ids = Objects.requireNonNull(ids, "ids");
    }

    /**
     * Builder stamping the configured protocol version.
     *
     * @throws IllegalArgumentException if the version is not one the standard schema accepts
     */
    public static MessageBuilder fromConfig(PluginWireConfig config, ContentCodec codec) {
        String version = config.protocolVersion();
        List<String> supported = SchemaRegistry.standard().supportedVersions();
        if (!supported.contains(version)) {
            throw new IllegalArgumentException("Unsupported protocol version " + version + ", expected one of " + supported);
        }
        return new MessageBuilder(codec, version, Clock.systemUTC(), MessageBuilder::randomId);
    }

    public ContentCodec codec() {
        return codec;
    }

    public Header header(String source, String target, MessageType type) {
        return header(source, target, type, null);
    }

    /**
     * Fresh header. A {@code null} session starts a new one.
     */
    public Header header(String source, String target, MessageType type, String session) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(type, "type");
        return new Header(
                ids.get(),
                session == null || session.isBlank() ? ids.get() : session,
                clock.instant().toString(),
                source,
                target,
                type.tag(),
                version
        );
    }

    public Envelope connectRequest(String source, String target) {
        return Envelope.of(header(source, target, MessageType.CONNECT_REQUEST), Map.of());
    }

    public Envelope connectReply(Envelope request, Map<String, Object> content) {
        Header header = replyHeader(request, MessageType.CONNECT_REPLY);
        return Envelope.reply(header, request.header(), content);
    }

    public Envelope connectReply(Envelope request, HubEndpoints endpoints) {
        return connectReply(request, endpoints.toContent());
    }

    public Envelope executeRequest(String source, String target, String command) {
        return executeRequest(source, target, command, null, codec.defaultFormat(), false, false);
    }

    public Envelope executeRequest(String source, String target, String command, Object data) {
        return executeRequest(source, target, command, data, codec.defaultFormat(), false, false);
    }

    public Envelope executeRequest(String source, String target, String command, Object data, String format) {
        return executeRequest(source, target, command, data, format, false, false);
    }

    /**
     * @param format payload format identifier; {@code null} stores {@code data} unencoded
     *               and without a {@code mime_type}
     */
    public Envelope executeRequest(
            String source,
            String target,
            String command,
            Object data,
            String format,
            boolean silent,
            boolean stopOnError
    ) {
        Objects.requireNonNull(command, "command");
        Header header = header(source, target, MessageType.EXECUTE_REQUEST);
        Map<String, Object> content = new LinkedHashMap<>();
        content.put(COMMAND, command);
        content.put(SILENT, silent);
        content.put(STOP_ON_ERROR, stopOnError);
        content.putAll(codec.encode(data, format));
        return Envelope.of(header, content);
    }

    public Envelope executeReply(Envelope request, int executionCount) {
        return executeReply(request, executionCount, ExecutionStatus.OK, null, null, codec.defaultFormat());
    }

    public Envelope executeReply(Envelope request, int executionCount, ExecutionStatus status, Object error) {
        return executeReply(request, executionCount, status, error, null, codec.defaultFormat());
    }

    /**
     * Reply to an {@code execute_request}.
     *
     * <p>A non-null {@code error} is stamped on the content whatever the status: an
     * {@link ErrorInfo} as the structured error object, anything else as its text.
     *
     * @throws InvalidReplyException if {@code status} is {@link ExecutionStatus#ERROR} and
     *                               {@code error} is {@code null}
     */
    public Envelope executeReply(
            Envelope request,
            int executionCount,
            ExecutionStatus status,
            Object error,
            Object data,
            String format
    ) {
        Objects.requireNonNull(status, "status");
        if (status == ExecutionStatus.ERROR && error == null) {
            throw new InvalidReplyException("If status is \"error\", an error value must be provided");
        }
        if (executionCount < 0) {
            throw new InvalidReplyException("execution_count cannot be negative: " + executionCount);
        }
        Header header = replyHeader(request, MessageType.EXECUTE_REPLY);
        Object command = request.contentValue(COMMAND);
        if (command == null) {
            throw new InvalidReplyException("Request " + request.header().msgId() + " has no command to reply to");
        }
        Map<String, Object> content = new LinkedHashMap<>();
        content.put(EXECUTION_COUNT, executionCount);
        content.put(STATUS, status.wireName());
        content.put(COMMAND, command);
        content.putAll(codec.encode(data, format));
        if (error != null) {
            content.put(ContentCodec.ERROR, error instanceof ErrorInfo info ? info.toMap() : String.valueOf(error));
        }
        return Envelope.reply(header, request.header(), content);
    }

    private Header replyHeader(Envelope request, MessageType type) {
        Objects.requireNonNull(request, "request");
        Header requestHeader = Objects.requireNonNull(request.header(), "request.header");
        return header(requestHeader.target(), requestHeader.source(), type, requestHeader.session());
    }

    private static String randomId() {
        return UUID.randomUUID().toString();
    }
}
