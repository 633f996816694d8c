package io.pluginwire.protocol;

import io.pluginwire.codec.ContentCodec;
import io.pluginwire.config.PluginWireConfig;
import io.pluginwire.message.MessageBuilder;
import io.pluginwire.model.Envelope;
import io.pluginwire.model.ExecutionStatus;
import io.pluginwire.model.HubEndpoints;
import io.pluginwire.validation.EnvelopeValidator;

import java.util.Map;
import java.util.Objects;

/**
 * Entry points of the protocol layer for the transport and dispatch code around it.
 */
public final class PluginProtocol {
    private final EnvelopeValidator validator;
    private final ContentCodec codec;
    private final MessageBuilder builder;
    private final WireCodec wire;

    public PluginProtocol(EnvelopeValidator validator, ContentCodec codec, MessageBuilder builder) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.builder = Objects.requireNonNull(builder, "builder");
        this.wire = new WireCodec(validator);
    }

    /**
     * Shared validators and the built-in formats, with settings from {@link PluginWireConfig#load()}.
     */
    public static PluginProtocol create() {
        return create(PluginWireConfig.load());
    }

    public static PluginProtocol create(PluginWireConfig config) {
        ContentCodec codec = ContentCodec.fromConfig(config);
        return new PluginProtocol(EnvelopeValidator.shared(), codec, MessageBuilder.fromConfig(config, codec));
    }

    public EnvelopeValidator validator() {
        return validator;
    }

    public ContentCodec codec() {
        return codec;
    }

    public MessageBuilder builder() {
        return builder;
    }

    public WireCodec wire() {
        return wire;
    }

    public Envelope buildConnectRequest(String source, String target) {
        return builder.connectRequest(source, target);
    }

    public Envelope buildConnectReply(Envelope request, Map<String, Object> content) {
        return builder.connectReply(request, content);
    }

    public Envelope buildConnectReply(Envelope request, HubEndpoints endpoints) {
        return builder.connectReply(request, endpoints);
    }

    public Envelope buildExecuteRequest(String source, String target, String command) {
        return builder.executeRequest(source, target, command);
    }

    public Envelope buildExecuteRequest(String source, String target, String command, Object data) {
        return builder.executeRequest(source, target, command, data);
    }

    public Envelope buildExecuteRequest(
            String source,
            String target,
            String command,
            Object data,
            String format,
            boolean silent,
            boolean stopOnError
    ) {
        return builder.executeRequest(source, target, command, data, format, silent, stopOnError);
    }

    public Envelope buildExecuteReply(Envelope request, int executionCount) {
        return builder.executeReply(request, executionCount);
    }

    public Envelope buildExecuteReply(
            Envelope request,
            int executionCount,
            ExecutionStatus status,
            Object error,
            Object data,
            String format
    ) {
        return builder.executeReply(request, executionCount, status, error, data, format);
    }

    public Envelope validate(Envelope envelope) {
        return validator.validate(envelope);
    }

    public Map<String, Object> encodeContent(Object data, String format) {
        return codec.encode(data, format);
    }

    public Object decodeContent(Map<String, ?> content) {
        return codec.decode(content);
    }

    /**
     * Validates the whole envelope, then decodes its content payload.
     */
    public Object decodeContent(Envelope envelope) {
        return codec.decode(validator.validate(envelope).content());
    }

    public String toWire(Envelope envelope) {
        return wire.toJson(envelope);
    }

    public Envelope fromWire(String json) {
        return wire.fromJson(json);
    }
}
