package com.kmg.receipts.model;

public enum JobPriority {
    LOW(0),
    MEDIUM(1),
    HIGH(2);

    private final int rank;

    JobPriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public static JobPriority fromRank(int rank) {
        for (JobPriority priority : values()) {
            if (priority.rank == rank) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority rank: " + rank);
    }
}
