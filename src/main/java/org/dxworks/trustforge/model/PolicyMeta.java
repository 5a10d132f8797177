package org.dxworks.trustforge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Front matter of a policy document. Property names are snake_case in YAML.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PolicyMeta {
    public String title;
    public String version;
    public String owner;
    public String lastReviewed; // ISO date, validated by the parser
    public List<String> appliesTo; // nullable
    public List<String> refs; // nullable
    public String subtitle; // nullable
    public String footer; // nullable
}
