/**
 * Payload formats for {@code content.data}: native object serialization (default), YAML,
 * JSON, and the binary and plain-text passthrough formats.
 */
package io.pluginwire.codec;
