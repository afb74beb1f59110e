package com.mts.master;

import java.util.List;
import java.util.Objects;

/**
 * 一次副本集替换建议：仅当 tablet 当前副本集仍等于 expectedReplicas 时才会生效。
 */
public final class ReassignmentProposal {
    private final String tabletId;
    private final String tableId;
    private final List<String> expectedReplicas;
    private final List<String> proposedReplicas;

    public ReassignmentProposal(String tabletId, String tableId, List<String> expectedReplicas,
            List<String> proposedReplicas) {
        this.tabletId = tabletId;
        this.tableId = tableId;
        this.expectedReplicas = List.copyOf(expectedReplicas);
        this.proposedReplicas = List.copyOf(proposedReplicas);
    }

    public String getTabletId() {
        return tabletId;
    }

    public String getTableId() {
        return tableId;
    }

    public List<String> getExpectedReplicas() {
        return expectedReplicas;
    }

    public List<String> getProposedReplicas() {
        return proposedReplicas;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReassignmentProposal)) return false;
        ReassignmentProposal that = (ReassignmentProposal) o;
        return tabletId.equals(that.tabletId)
                && Objects.equals(tableId, that.tableId)
                && expectedReplicas.equals(that.expectedReplicas)
                && proposedReplicas.equals(that.proposedReplicas);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tabletId, tableId, expectedReplicas, proposedReplicas);
    }

    @Override
    public String toString() {
        return "ReassignmentProposal{tablet=" + tabletId + ", " + expectedReplicas + " -> " + proposedReplicas + '}';
    }
}
