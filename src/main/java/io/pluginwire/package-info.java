/**
 * plugin-wire source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.pluginwire.protocol.PluginProtocol} is the surface handed to transport and dispatch code.</li>
 *   <li>{@code io.pluginwire.schema.SchemaRegistry} holds the envelope and per-type schema definitions.</li>
 *   <li>{@code io.pluginwire.validation.EnvelopeValidator} rejects malformed envelopes before dispatch.</li>
 *   <li>{@code io.pluginwire.codec.ContentCodec} moves payloads in and out of {@code content.data}.</li>
 *   <li>{@code io.pluginwire.message.MessageBuilder} builds requests and replies with session/parent tracking.</li>
 * </ul>
 */
package io.pluginwire;
