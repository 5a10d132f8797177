package org.dxworks.trustforge.model.risk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * One entry of a risk register file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RiskItem {
    public String id; // e.g. R-001
    public String title;
    public String description = "";
    public Severity severity;
    public Likelihood likelihood;
    public String owner = "CISO";
    public RiskStatus status = RiskStatus.OPEN;
    public Treatment treatment = Treatment.MITIGATE;
    public String targetDate; // nullable, ISO date
    public List<String> controlRefs; // nullable, e.g. ["ID.GV-01", "PR.AC-01"]
}
