/** Construction of pooled expressions with interning and cheap identities. */
package io.calx.engine.builder;
