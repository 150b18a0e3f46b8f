package com.logistics.fleetopsbackend.reassignment;

import com.logistics.fleetopsbackend.dto.ImpactReport;
import com.logistics.fleetopsbackend.dto.ReassignmentOption;

import java.util.Comparator;

/**
 * Best option first. Keys, in order:
 * <ol>
 *   <li>valid before invalid, whatever the tier</li>
 *   <li>priority tier, same fleet first</li>
 *   <li>fewer compromised time windows</li>
 *   <li>higher skill match</li>
 *   <li>candidate name, then id, so equal options keep a stable order</li>
 * </ol>
 */
public class ReassignmentOptionComparator implements Comparator<ReassignmentOption> {

    public static final ReassignmentOptionComparator INSTANCE = new ReassignmentOptionComparator();

    private static final Comparator<ReassignmentOption> ORDER = Comparator
            .comparing((ReassignmentOption o) -> !o.getImpact().isValid())
            .thenComparing(o -> o.getReplacementDriver().getPriority())
            .thenComparingInt(ReassignmentOptionComparator::compromisedWindowCount)
            .thenComparing(Comparator.comparingLong(ReassignmentOptionComparator::skillMatch).reversed())
            .thenComparing(o -> o.getReplacementDriver().getName(), Comparator.nullsLast(String.CASE_INSENSITIVE_ORDER))
            .thenComparing(o -> o.getReplacementDriver().getId());

    @Override
    public int compare(ReassignmentOption a, ReassignmentOption b) {
        return ORDER.compare(a, b);
    }

    private static int compromisedWindowCount(ReassignmentOption option) {
        ImpactReport.WindowImpact windows = option.getImpact().getCompromisedWindows();
        return windows != null ? windows.getCount() : 0;
    }

    private static long skillMatch(ReassignmentOption option) {
        ImpactReport.SkillsMatch skills = option.getImpact().getSkillsMatch();
        return skills != null ? skills.getPercentage() : 0;
    }
}
