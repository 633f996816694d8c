/**
 * Envelope schema definitions.
 *
 * <p>{@link io.pluginwire.schema.SchemaRegistry} reads the bundled draft-4 JSON schema
 * document and composes, per message type, a schema requiring both the base envelope
 * and the type's own content constraints.
 */
package io.pluginwire.schema;
