package io.pluginwire.codec;

import io.pluginwire.config.PluginWireConfig;
import io.pluginwire.error.ContentCodecException;
import io.pluginwire.error.RemoteReportedException;
import io.pluginwire.error.UnsupportedFormatException;
import org.junit.jupiter.api.Test;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContentCodecTest {
    private final ContentCodec codec = ContentCodec.standard();

    @Test
    void structuredFormatsShouldRoundTripValues() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("x", 3);
        payload.put("names", List.of("a", "b"));
        payload.put("nested", Map.of("ok", true));

        for (String format : List.of(ContentFormats.NATIVE, ContentFormats.YAML, ContentFormats.JSON)) {
            assertEquals(payload, codec.decode(codec.encode(payload, format)), format);
            assertEquals(List.of(1, 2), codec.decode(codec.encode(List.of(1, 2), format)), format);
            assertEquals("plain", codec.decode(codec.encode("plain", format)), format);
        }
    }

    @Test
    void textFormatsShouldNarrowIntegersToSmallestFittingType() {
        for (String format : List.of(ContentFormats.YAML, ContentFormats.JSON)) {
            Map<String, Object> content = codec.encode(List.of(10L, 10_000_000_000L), format);
            assertEquals(List.of(10, 10_000_000_000L), codec.decode(content), format);
            assertArrayEquals(new long[]{10L, 10_000_000_000L}, codec.decode(content, long[].class), format);
        }
        assertEquals(List.of(10L), codec.decode(codec.encode(List.of(10L), ContentFormats.NATIVE)));
    }

    @Test
    void defaultFormatShouldBeNativeSerialization() {
        Map<String, Object> content = codec.encode(List.of(1, 2));

        assertEquals(ContentFormats.NATIVE, codec.defaultFormat());
        assertInstanceOf(String.class, content.get(ContentCodec.DATA));
        assertEquals(Map.of(ContentCodec.MIME_TYPE, ContentFormats.NATIVE), content.get(ContentCodec.METADATA));
        assertEquals(List.of(1, 2), codec.decode(content));
    }

    @Test
    void passthroughFormatsShouldKeepValuesUnchanged() {
        byte[] raw = {0, 1, 2, (byte) 0xff};
        Map<String, Object> binary = codec.encode(raw, ContentFormats.OCTET_STREAM);
        assertArrayEquals(raw, (byte[]) binary.get(ContentCodec.DATA));
        assertArrayEquals(raw, (byte[]) codec.decode(binary));

        Map<String, Object> text = codec.encode("hello\nworld", ContentFormats.TEXT);
        assertEquals("hello\nworld", text.get(ContentCodec.DATA));
        assertEquals("hello\nworld", codec.decode(text));
    }

    @Test
    void binaryPayloadShouldSurviveTextTransport() {
        byte[] raw = "bytes on the wire".getBytes(StandardCharsets.UTF_8);
        Map<String, Object> content = Map.of(
                ContentCodec.DATA, Base64.getEncoder().encodeToString(raw),
                ContentCodec.METADATA, Map.of(ContentCodec.MIME_TYPE, ContentFormats.OCTET_STREAM)
        );
        assertArrayEquals(raw, (byte[]) codec.decode(content));
    }

    @Test
    void passthroughFormatsShouldRejectWrongValueKinds() {
        assertThrows(ContentCodecException.class, () -> codec.encode("text", ContentFormats.OCTET_STREAM));
        assertThrows(ContentCodecException.class, () -> codec.encode(new byte[]{1}, ContentFormats.TEXT));
    }

    @Test
    void noFormatShouldStoreValueWithoutMimeType() {
        Map<String, Object> value = Map.of("k", "v");
        Map<String, Object> content = codec.encode(value, null);

        assertEquals(value, content.get(ContentCodec.DATA));
        assertFalse(content.containsKey(ContentCodec.METADATA));
    }

    @Test
    void absentDataShouldGiveEmptyFragmentAndNullResult() {
        assertTrue(codec.encode(null, ContentFormats.JSON).isEmpty());
        assertTrue(codec.encode(null).isEmpty());
        assertNull(codec.decode(Map.of("command", "add")));
        assertNull(codec.decode(Map.of(ContentCodec.METADATA, Map.of(ContentCodec.MIME_TYPE, ContentFormats.YAML))));
        assertNull(codec.decode(null));
    }

    @Test
    void remoteErrorShouldWinOverData() {
        Map<String, Object> content = new LinkedHashMap<>(codec.encode(List.of(1), ContentFormats.JSON));
        content.put(ContentCodec.ERROR, "ZeroDivisionError: division by zero");

        RemoteReportedException error = assertThrows(RemoteReportedException.class, () -> codec.decode(content));
        assertEquals("ZeroDivisionError: division by zero", error.remoteError());
    }

    @Test
    void unknownFormatShouldFailOnBothDirections() {
        Map<String, Object> content = Map.of(
                ContentCodec.DATA, "whatever",
                ContentCodec.METADATA, Map.of(ContentCodec.MIME_TYPE, "application/x-unknown")
        );
        UnsupportedFormatException decodeError = assertThrows(UnsupportedFormatException.class, () -> codec.decode(content));
        assertEquals("application/x-unknown", decodeError.format());
        assertThrows(UnsupportedFormatException.class, () -> codec.encode(List.of(1), "application/python-pickle"));
    }

    @Test
    void malformedStructuredPayloadShouldFail() {
        Map<String, Object> json = Map.of(
                ContentCodec.DATA, "{not json",
                ContentCodec.METADATA, Map.of(ContentCodec.MIME_TYPE, ContentFormats.JSON)
        );
        assertThrows(ContentCodecException.class, () -> codec.decode(json));

        Map<String, Object> nativeData = Map.of(ContentCodec.DATA, "%%% not base64 %%%");
        assertThrows(ContentCodecException.class, () -> codec.decode(nativeData));
    }

    @Test
    void nativeFormatShouldRejectClassesOutsideTheFilter() {
        Map<String, Object> content = codec.encode(new Point(1, 2));
        ContentCodecException error = assertThrows(ContentCodecException.class, () -> codec.decode(content));
        assertTrue(error.getMessage().contains("rejected"));

        ContentCodec permissive = ContentCodec.fromConfig(
                new PluginWireConfig(null, null, "io.pluginwire.**;java.base/*;!*"));
        assertEquals(new Point(1, 2), permissive.decode(content));
    }

    @Test
    void nativeFormatShouldRequireSerializableValues() {
        assertThrows(ContentCodecException.class, () -> codec.encode(new Object()));
    }

    @Test
    void decodeShouldConvertToRequestedType() {
        Map<String, Object> content = codec.encode(Map.of("name", "resize", "retries", 2), ContentFormats.JSON);
        assertEquals(new Job("resize", 2), codec.decode(content, Job.class));
        assertEquals(List.of(1, 2), codec.decode(codec.encode(List.of(1, 2)), List.class));
    }

    @Test
    void customFormatShouldBeRegistrable() {
        ContentFormat reversed = new ContentFormat() {
            @Override
            public String mimeType() {
                return "text/x-reversed";
            }

            @Override
            public Object encode(Object data) {
                return new StringBuilder(data.toString()).reverse().toString();
            }

            @Override
            public Object decode(Object data) {
                return new StringBuilder(data.toString()).reverse().toString();
            }
        };
        ContentCodec custom = ContentCodec.builder()
                .withBuiltIns(null)
                .register(reversed)
                .defaultFormat("text/x-reversed")
                .build();

        Map<String, Object> content = custom.encode("abc");
        assertEquals("cba", content.get(ContentCodec.DATA));
        assertEquals("abc", custom.decode(content));
        assertTrue(custom.supports(ContentFormats.YAML));
        assertFalse(codec.supports("text/x-reversed"));
    }

    @Test
    void builderShouldRejectUnregisteredDefault() {
        assertThrows(UnsupportedFormatException.class,
                () -> ContentCodec.builder().withBuiltIns(null).defaultFormat("application/x-none").build());
    }

    record Point(int x, int y) implements Serializable {
    }

    record Job(String name, int retries) {
    }
}
