package io.pluginwire.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pluginwire.error.SchemaValidationException;
import io.pluginwire.error.UnknownMessageTypeException;
import io.pluginwire.message.MessageBuilder;
import io.pluginwire.model.Envelope;
import io.pluginwire.model.ExecutionStatus;
import io.pluginwire.model.Header;
import io.pluginwire.model.HubEndpoints;
import io.pluginwire.schema.SchemaRegistry;
import io.pluginwire.util.Jsons;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvelopeValidatorTest {
    private final EnvelopeValidator validator = EnvelopeValidator.shared();
    private final MessageBuilder builder = new MessageBuilder();

    @Test
    void minimalEnvelopesOfEveryTypeShouldPass() {
        Envelope connectRequest = builder.connectRequest("clientA", "hub");
        Envelope connectReply = builder.connectReply(connectRequest,
                new HubEndpoints("tcp://127.0.0.1", 5555, "hub", "tcp://127.0.0.1", 5556));
        Envelope executeRequest = builder.executeRequest("clientA", "pluginB", "ping");
        Envelope executeReply = builder.executeReply(executeRequest, 1);

        assertSame(connectRequest, validator.validate(connectRequest));
        assertSame(connectReply, validator.validate(connectReply));
        assertSame(executeRequest, validator.validate(executeRequest));
        assertSame(executeReply, validator.validate(executeReply));
    }

    @Test
    void headerOnlyTreeShouldPassAsConnectRequest() throws Exception {
        JsonNode tree = Jsons.compact().readTree("{\"header\":{\"msg_id\":\"m1\",\"session\":\"s1\","
                + "\"date\":\"2026-01-01T00:00:00Z\",\"source\":\"a\",\"target\":\"b\","
                + "\"msg_type\":\"connect_request\",\"version\":\"0.2\"}}");
        assertSame(tree, validator.validate(tree));
    }

    @Test
    void executeRequestShouldRequireCommand() {
        ObjectNode tree = tree(builder.executeRequest("clientA", "pluginB", "add", List.of(1, 2)));
        assertTrue(validator.isValid(tree));

        ((ObjectNode) tree.path("content")).remove("command");
        SchemaValidationException error = assertThrows(SchemaValidationException.class, () -> validator.validate(tree));
        assertEquals("execute_request", error.schemaName());
        assertFalse(error.violations().isEmpty());

        tree.remove("content");
        assertFalse(validator.isValid(tree));
    }

    @Test
    void executeRequestShouldCheckFlagTypes() {
        ObjectNode tree = tree(builder.executeRequest("clientA", "pluginB", "add"));
        ((ObjectNode) tree.path("content")).put("silent", "yes");
        assertThrows(SchemaValidationException.class, () -> validator.validate(tree));
    }

    @Test
    void executeReplyShouldRequireEachContentField() {
        Envelope request = builder.executeRequest("clientA", "pluginB", "add");
        Envelope reply = builder.executeReply(request, 3);
        for (String field : List.of("command", "status", "execution_count")) {
            ObjectNode tree = tree(reply);
            ((ObjectNode) tree.path("content")).remove(field);
            assertThrows(SchemaValidationException.class, () -> validator.validate(tree), field);
        }
        ObjectNode orphan = tree(reply);
        orphan.remove("parent_header");
        assertThrows(SchemaValidationException.class, () -> validator.validate(orphan));
    }

    @Test
    void executeReplyShouldRejectBadStatusAndNegativeCount() {
        Envelope request = builder.executeRequest("clientA", "pluginB", "add");
        ObjectNode badStatus = tree(builder.executeReply(request, 3));
        ((ObjectNode) badStatus.path("content")).put("status", "done");
        assertThrows(SchemaValidationException.class, () -> validator.validate(badStatus));

        ObjectNode negative = tree(builder.executeReply(request, 3));
        ((ObjectNode) negative.path("content")).put("execution_count", -1);
        assertThrows(SchemaValidationException.class, () -> validator.validate(negative));

        ObjectNode fractional = tree(builder.executeReply(request, 3));
        ((ObjectNode) fractional.path("content")).put("execution_count", 1.5);
        assertThrows(SchemaValidationException.class, () -> validator.validate(fractional));
    }

    @Test
    void executeReplyShouldAcceptTextAndStructuredErrors() {
        Envelope request = builder.executeRequest("clientA", "pluginB", "add");
        assertDoesNotThrow(() -> validator.validate(builder.executeReply(request, 1, ExecutionStatus.ERROR, "boom")));

        ObjectNode structured = tree(builder.executeReply(request, 1));
        ((ObjectNode) structured.path("content")).putObject("error").put("evalue", "missing ename");
        assertThrows(SchemaValidationException.class, () -> validator.validate(structured));
    }

    @Test
    void connectReplyShouldRequirePublishAndCommandEndpoints() {
        Envelope request = builder.connectRequest("clientA", "hub");
        Map<String, Object> content = new HubEndpoints("tcp://x", 5555, "hub", "tcp://x", 5556).toContent();
        ObjectNode tree = tree(builder.connectReply(request, content));
        assertTrue(validator.isValid(tree));

        ObjectNode noContent = tree.deepCopy();
        noContent.remove("content");
        assertThrows(SchemaValidationException.class, () -> validator.validate(noContent));

        for (String section : List.of("command", "publish")) {
            ObjectNode missing = tree.deepCopy();
            ((ObjectNode) missing.path("content")).remove(section);
            assertThrows(SchemaValidationException.class, () -> validator.validate(missing), section);
        }
        for (String field : List.of("command.uri", "command.port", "command.name", "publish.uri", "publish.port")) {
            String[] path = field.split("\\.");
            ObjectNode missing = tree.deepCopy();
            ((ObjectNode) missing.path("content").path(path[0])).remove(path[1]);
            assertThrows(SchemaValidationException.class, () -> validator.validate(missing), field);
        }

        ObjectNode textPort = tree.deepCopy();
        ((ObjectNode) textPort.path("content").path("publish")).put("port", "5556");
        assertThrows(SchemaValidationException.class, () -> validator.validate(textPort));
    }

    @Test
    void unknownTypeShouldFailOnBaseSchemaBeforeLookup() {
        ObjectNode tree = tree(builder.connectRequest("clientA", "hub"));
        ((ObjectNode) tree.path("header")).put("msg_type", "shutdown_request");

        SchemaValidationException error = assertThrows(SchemaValidationException.class, () -> validator.validate(tree));
        assertEquals(SchemaRegistry.BASE_MESSAGE, error.schemaName());
        assertFalse(error instanceof UnknownMessageTypeException);
    }

    @Test
    void headerFieldsShouldBeRequiredAndNonEmpty() {
        for (String field : List.of("msg_id", "session", "date", "source", "target", "msg_type", "version")) {
            ObjectNode missing = tree(builder.connectRequest("clientA", "hub"));
            ((ObjectNode) missing.path("header")).remove(field);
            assertThrows(SchemaValidationException.class, () -> validator.validate(missing), field);

            ObjectNode empty = tree(builder.connectRequest("clientA", "hub"));
            ((ObjectNode) empty.path("header")).put(field, "");
            assertThrows(SchemaValidationException.class, () -> validator.validate(empty), field);
        }
    }

    @Test
    void versionShouldBeOneOfTheSupportedTags() {
        ObjectNode old = tree(builder.connectRequest("clientA", "hub"));
        ((ObjectNode) old.path("header")).put("version", "0.2");
        assertTrue(validator.isValid(old));

        ObjectNode future = tree(builder.connectRequest("clientA", "hub"));
        ((ObjectNode) future.path("header")).put("version", "0.4");
        assertFalse(validator.isValid(future));
    }

    @Test
    void envelopeWithoutHeaderShouldFail() {
        Envelope headless = new Envelope(null, null, Map.of(), Map.of("command", "add"));
        assertThrows(SchemaValidationException.class, () -> validator.validate(headless));
    }

    @Test
    void contentWithoutJsonFormShouldFailValidation() {
        Envelope request = builder.executeRequest("clientA", "pluginB", "cmd", new Object(), null, false, false);

        SchemaValidationException error = assertThrows(SchemaValidationException.class, () -> validator.validate(request));
        assertEquals(SchemaRegistry.BASE_MESSAGE, error.schemaName());
        assertFalse(error.violations().isEmpty());
    }

    @Test
    void malformedParentHeaderShouldFail() {
        Envelope request = builder.executeRequest("clientA", "pluginB", "add");
        Envelope reply = builder.executeReply(request, 1);
        Header broken = new Header(null, "s", "d", "a", "b", "execute_request", "0.3");
        Envelope tampered = new Envelope(reply.header(), broken, reply.metadata(), reply.content());
        assertThrows(SchemaValidationException.class, () -> validator.validate(tampered));
    }

    @Test
    void extendedRegistryShouldValidateNewTypeAndKeepOldOnes() throws Exception {
        ObjectNode constraints = (ObjectNode) Jsons.compact().readTree(
                "{\"properties\":{\"content\":{\"type\":\"object\",\"properties\":{\"uptime\":{\"type\":\"integer\"}},"
                        + "\"required\":[\"uptime\"]}},\"required\":[\"content\"]}");
        SchemaRegistry registry = SchemaRegistry.standard().toBuilder()
                .define("status_reply", null, constraints)
                .build();
        EnvelopeValidator extended = new EnvelopeValidator(registry);

        ObjectNode status = tree(builder.connectRequest("hub", "clientA"));
        ((ObjectNode) status.path("header")).put("msg_type", "status_reply");
        status.putObject("content").put("uptime", 42);
        assertSame(status, extended.validate(status));
        assertThrows(SchemaValidationException.class, () -> validator.validate(status));

        ((ObjectNode) status.path("content")).remove("uptime");
        assertThrows(SchemaValidationException.class, () -> extended.validate(status));

        assertTrue(extended.isValid(tree(builder.executeRequest("clientA", "pluginB", "add"))));
    }

    @Test
    void sharedValidatorShouldServeConcurrentCallers() throws Exception {
        Envelope request = builder.executeRequest("clientA", "pluginB", "add", List.of(1, 2));
        ObjectNode invalid = tree(request);
        ((ObjectNode) invalid.path("content")).remove("command");

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> {
                    int rejected = 0;
                    for (int round = 0; round < 100; round++) {
                        EnvelopeValidator shared = EnvelopeValidator.shared();
                        shared.validate(request);
                        if (!shared.isValid(invalid)) {
                            rejected++;
                        }
                    }
                    return rejected;
                }));
            }
            for (Future<Integer> future : futures) {
                assertEquals(100, future.get());
            }
        } finally {
            pool.shutdownNow();
        }
        assertSame(validator, EnvelopeValidator.shared());
    }

    private static ObjectNode tree(Envelope envelope) {
        return Jsons.compact().valueToTree(envelope);
    }
}
