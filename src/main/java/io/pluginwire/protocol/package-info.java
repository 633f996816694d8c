/**
 * Facade and wire text form of the protocol layer.
 *
 * <p>{@link io.pluginwire.protocol.PluginProtocol} wires one validator, codec and builder
 * together; {@link io.pluginwire.protocol.WireCodec} turns envelopes into JSON frames and
 * refuses to bind a frame that does not validate.
 */
package io.pluginwire.protocol;
