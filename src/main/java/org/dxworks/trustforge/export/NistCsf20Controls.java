package org.dxworks.trustforge.export;

import org.dxworks.trustforge.model.CsfControl;

import java.util.List;

/**
 * Seed subset of the NIST Cybersecurity Framework 2.0, one control per function.
 */
public final class NistCsf20Controls {

    public static final String FRAMEWORK = "NIST CSF 2.0";

    private static final List<CsfControl> CONTROLS = List.of(
            new CsfControl("IDENTIFY", "GV", "ID.GV-01", "Governance program established",
                    "Roles, responsibilities, and authorities established and communicated."),
            new CsfControl("PROTECT", "PR", "PR.AC-01", "Identity management",
                    "Identities are issued, managed, verified, revoked for users and services."),
            new CsfControl("DETECT", "DE", "DE.AE-01", "Anomalies detected",
                    "Potential cybersecurity events are detected in a timely manner."),
            new CsfControl("RESPOND", "RS", "RS.MA-01", "Incident response plan",
                    "Documented IR plan with roles, communications, and procedures."),
            new CsfControl("RECOVER", "RC", "RC.CO-01", "Recovery planning",
                    "Documented recovery plans are maintained and tested.")
    );

    private NistCsf20Controls() {}

    public static List<CsfControl> all() {
        return CONTROLS;
    }
}
