/* (C)2026 */
package com.ammann.pse.service;

import com.ammann.pse.dto.BroadcastComplianceDTO;
import com.ammann.pse.enumeration.BroadcastStandard;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.jboss.logging.Logger;

/**
 * Checks the overall verdict against each {@link BroadcastStandard}.
 *
 * <p>A standard is met when the overall score does not exceed its tolerated maximum and
 * none of the rate ceilings it enforces was exceeded.
 */
@ApplicationScoped
public class BroadcastComplianceEvaluator {

    private static final Logger LOG = Logger.getLogger(BroadcastComplianceEvaluator.class);

    /** Date of the threshold set the verdicts are based on. */
    public static final String STANDARDS_LAST_UPDATED = "2024-01-01";

    public BroadcastComplianceDTO evaluate(double overallScore, boolean flashCeilingExceeded, boolean redCeilingExceeded) {
        List<String> notes = new ArrayList<>();
        boolean[] verdicts = new boolean[BroadcastStandard.values().length];

        for (BroadcastStandard standard : BroadcastStandard.values()) {
            verdicts[standard.ordinal()] = isCompliant(standard, overallScore, flashCeilingExceeded, redCeilingExceeded, notes);
        }

        BroadcastComplianceDTO compliance = new BroadcastComplianceDTO(
                verdicts[BroadcastStandard.ITU_R_BT1702.ordinal()],
                verdicts[BroadcastStandard.ITC.ordinal()],
                verdicts[BroadcastStandard.OFCOM.ordinal()],
                verdicts[BroadcastStandard.EBU_TECH_3253.ordinal()],
                verdicts[BroadcastStandard.FCC.ordinal()],
                notes,
                STANDARDS_LAST_UPDATED);

        LOG.debugf("Compliance for score %.1f: %d violation(s)", overallScore, notes.size());
        return compliance;
    }

    boolean isCompliant(
            BroadcastStandard standard,
            double overallScore,
            boolean flashCeilingExceeded,
            boolean redCeilingExceeded,
            List<String> notes) {
        boolean compliant = true;
        if (overallScore > standard.getMaxRiskScore()) {
            compliant = false;
            notes.add(String.format(Locale.ROOT, "%s: overall risk score %.1f exceeds %.1f",
                    standard.getDisplayName(), overallScore, standard.getMaxRiskScore()));
        }
        if (standard.enforcesFlashCeiling() && flashCeilingExceeded) {
            compliant = false;
            notes.add(standard.getDisplayName() + ": general flash rate ceiling exceeded");
        }
        if (standard.enforcesRedFlashCeiling() && redCeilingExceeded) {
            compliant = false;
            notes.add(standard.getDisplayName() + ": red flash ceiling exceeded");
        }
        return compliant;
    }
}
