package org.dxworks.trustforge.model;

/**
 * A policy file split into its front matter and its Markdown body.
 */
public record ParsedPolicy(PolicyMeta meta, String body) {
}
