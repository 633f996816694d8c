package io.pluginwire.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pluginwire.error.ProtocolException;
import io.pluginwire.error.RemoteReportedException;
import io.pluginwire.error.SchemaValidationException;
import io.pluginwire.model.Envelope;
import io.pluginwire.model.ExecutionStatus;
import io.pluginwire.protocol.PluginProtocol;
import io.pluginwire.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "plugin-wire",
        mixinStandardHelpOptions = true,
        description = "Build, validate and decode plugin protocol envelopes",
        subcommands = {
                PluginWireCommand.TypesCommand.class,
                PluginWireCommand.ValidateCommand.class,
                PluginWireCommand.DecodeCommand.class,
                PluginWireCommand.ConnectRequestCommand.class,
                PluginWireCommand.ExecuteRequestCommand.class,
                PluginWireCommand.ExecuteReplyCommand.class
        }
)
public final class PluginWireCommand implements Runnable {
    private static final Logger LOGGER = LoggerFactory.getLogger(PluginWireCommand.class);

    @Spec
    CommandSpec spec;

    private PluginProtocol protocol;

    public PluginWireCommand() {
    }

    PluginWireCommand(PluginProtocol protocol) {
        this.protocol = protocol;
    }

    @Override
    public void run() {
        out().println("Use subcommands: types | validate | decode | connect-request | execute-request | execute-reply");
    }

    PluginProtocol protocol() {
        if (protocol == null) {
            protocol = PluginProtocol.create();
        }
        return protocol;
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    Envelope readEnvelope(String file) throws IOException {
        String text = Files.readString(Path.of(file), StandardCharsets.UTF_8);
        return protocol().fromWire(text);
    }

    int fail(ProtocolException e) {
        LOGGER.warn("{}", e.getMessage());
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("error", e.getMessage());
        if (e instanceof SchemaValidationException invalid) {
            row.put("schema", invalid.schemaName());
            row.put("violations", invalid.violations());
        }
        if (e instanceof RemoteReportedException remote) {
            row.put("remote_error", remote.remoteError());
        }
        out().println(Jsons.toJson(row));
        return 1;
    }

    Object parseJson(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return Jsons.compact().readValue(raw, Object.class);
        } catch (JsonProcessingException e) {
            throw new ParameterException(spec.commandLine(), "--data-json is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    ExecutionStatus parseStatus(String raw) {
        try {
            return ExecutionStatus.fromString(raw);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    @Command(name = "types", description = "List registered message types, versions and content formats")
    static final class TypesCommand implements Callable<Integer> {
        @ParentCommand
        PluginWireCommand parent;

        @Override
        public Integer call() {
            PluginProtocol protocol = parent.protocol();
            ObjectNode row = Jsons.mapper().createObjectNode();
            row.set("message_types", Jsons.mapper().valueToTree(protocol.validator().registry().messageTypes()));
            row.set("versions", Jsons.mapper().valueToTree(protocol.validator().registry().supportedVersions()));
            row.put("default_version", protocol.validator().registry().defaultVersion());
            row.set("formats", Jsons.mapper().valueToTree(protocol.codec().formats()));
            row.put("default_format", protocol.codec().defaultFormat());
            parent.out().println(Jsons.toJson(row));
            return 0;
        }
    }

    @Command(name = "validate", description = "Validate an envelope JSON file")
    static final class ValidateCommand implements Callable<Integer> {
        @ParentCommand
        PluginWireCommand parent;

        @Parameters(index = "0", description = "Envelope JSON file path")
        String file;

        @Override
        public Integer call() throws IOException {
            try {
                Envelope envelope = parent.readEnvelope(file);
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("valid", true);
                row.put("msg_type", envelope.header().msgType());
                row.put("msg_id", envelope.header().msgId());
                row.put("session", envelope.header().session());
                parent.out().println(Jsons.toJson(row));
                return 0;
            } catch (ProtocolException e) {
                return parent.fail(e);
            }
        }
    }

    @Command(name = "decode", description = "Validate an envelope JSON file and print its decoded content data")
    static final class DecodeCommand implements Callable<Integer> {
        @ParentCommand
        PluginWireCommand parent;

        @Parameters(index = "0", description = "Envelope JSON file path")
        String file;

        @Override
        public Integer call() throws IOException {
            try {
                Envelope envelope = parent.readEnvelope(file);
                Object data = parent.protocol().decodeContent(envelope);
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("msg_type", envelope.header().msgType());
                row.put("mime_type", mimeTypeOf(envelope, parent.protocol().codec().defaultFormat()));
                row.put("data", data);
                parent.out().println(Jsons.toJson(row));
                return 0;
            } catch (ProtocolException e) {
                return parent.fail(e);
            }
        }

        private static Object mimeTypeOf(Envelope envelope, String fallback) {
            if (envelope.contentValue("metadata") instanceof Map<?, ?> metadata && metadata.get("mime_type") != null) {
                return metadata.get("mime_type");
            }
            return fallback;
        }
    }

    @Command(name = "connect-request", description = "Print a new connect_request envelope")
    static final class ConnectRequestCommand implements Callable<Integer> {
        @ParentCommand
        PluginWireCommand parent;

        @Option(names = {"--source"}, required = true, description = "Sending endpoint id")
        String source;

        @Option(names = {"--target"}, required = true, description = "Receiving endpoint id")
        String target;

        @Override
        public Integer call() {
            try {
                Envelope envelope = parent.protocol().buildConnectRequest(source, target);
                parent.out().println(Jsons.toJson(parent.protocol().validate(envelope)));
                return 0;
            } catch (ProtocolException e) {
                return parent.fail(e);
            }
        }
    }

    @Command(name = "execute-request", description = "Print a new execute_request envelope")
    static final class ExecuteRequestCommand implements Callable<Integer> {
        @ParentCommand
        PluginWireCommand parent;

        @Option(names = {"--source"}, required = true, description = "Sending endpoint id")
        String source;

        @Option(names = {"--target"}, required = true, description = "Receiving endpoint id")
        String target;

        @Option(names = {"--command"}, required = true, description = "Command name to execute on the target")
        String command;

        @Option(names = {"--data-json"}, description = "Command arguments as JSON")
        String dataJson;

        @Option(names = {"--format"}, description = "Payload format (mime type); defaults to the configured format")
        String format;

        @Option(names = {"--silent"}, defaultValue = "false", description = "Ask the target to execute quietly")
        boolean silent;

        @Option(names = {"--stop-on-error"}, defaultValue = "false", description = "Ask the target to drop queued executions after an error")
        boolean stopOnError;

        @Override
        public Integer call() {
            PluginProtocol protocol = parent.protocol();
            try {
                Envelope envelope = protocol.buildExecuteRequest(
                        source,
                        target,
                        command,
                        parent.parseJson(dataJson),
                        format == null ? protocol.codec().defaultFormat() : format,
                        silent,
                        stopOnError
                );
                parent.out().println(Jsons.toJson(protocol.validate(envelope)));
                return 0;
            } catch (ProtocolException e) {
                return parent.fail(e);
            }
        }
    }

    @Command(name = "execute-reply", description = "Print an execute_reply envelope answering a request file")
    static final class ExecuteReplyCommand implements Callable<Integer> {
        @ParentCommand
        PluginWireCommand parent;

        @Parameters(index = "0", description = "execute_request envelope JSON file path")
        String requestFile;

        @Option(names = {"--count"}, required = true, description = "Execution count, including this request")
        int count;

        @Option(names = {"--status"}, defaultValue = "ok", description = "Status: ok|error|abort")
        String status;

        @Option(names = {"--error"}, description = "Error text reported to the requester")
        String error;

        @Option(names = {"--data-json"}, description = "Result data as JSON")
        String dataJson;

        @Option(names = {"--format"}, description = "Payload format (mime type); defaults to the configured format")
        String format;

        @Override
        public Integer call() throws IOException {
            PluginProtocol protocol = parent.protocol();
            try {
                Envelope request = parent.readEnvelope(requestFile);
                Envelope reply = protocol.buildExecuteReply(
                        request,
                        count,
                        parent.parseStatus(status),
                        error,
                        parent.parseJson(dataJson),
                        format == null ? protocol.codec().defaultFormat() : format
                );
                parent.out().println(Jsons.toJson(protocol.validate(reply)));
                return 0;
            } catch (ProtocolException e) {
                return parent.fail(e);
            }
        }
    }
}
