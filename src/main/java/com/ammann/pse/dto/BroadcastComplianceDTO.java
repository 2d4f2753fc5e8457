/* (C)2026 */
package com.ammann.pse.dto;

import com.ammann.pse.enumeration.BroadcastStandard;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Compliance of the analysed content with each supported broadcast standard.
 *
 * @param ituRBt1702Compliant  ITU-R BT.1702 verdict
 * @param itcCompliant         ITC guidance verdict
 * @param ofcomCompliant       Ofcom guidance verdict
 * @param ebuTech3253Compliant EBU Tech 3253 verdict
 * @param fccCompliant         FCC guidance verdict
 * @param complianceNotes      one note per violated requirement
 * @param lastUpdated          date of the threshold set the verdicts are based on
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BroadcastComplianceDTO(
        @JsonProperty("itu_r_bt1702_compliant") boolean ituRBt1702Compliant,
        boolean itcCompliant,
        boolean ofcomCompliant,
        @JsonProperty("ebu_tech3253_compliant") boolean ebuTech3253Compliant,
        boolean fccCompliant,
        List<String> complianceNotes,
        String lastUpdated)
{
    public BroadcastComplianceDTO {
        complianceNotes = complianceNotes == null ? List.of() : List.copyOf(complianceNotes);
    }

    /**
     * Returns the verdict for the given standard.
     */
    public boolean isCompliant(BroadcastStandard standard) {
        return switch (standard) {
            case ITU_R_BT1702 -> ituRBt1702Compliant;
            case ITC -> itcCompliant;
            case OFCOM -> ofcomCompliant;
            case EBU_TECH_3253 -> ebuTech3253Compliant;
            case FCC -> fccCompliant;
        };
    }
}
