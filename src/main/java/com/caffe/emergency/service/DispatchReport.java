package com.caffe.emergency.service;

import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Outcome counts of one fan-out.
 */
@Getter
@ToString
public class DispatchReport {

    public enum Outcome { DELIVERED, FAILED, SKIPPED }

    private final int delivered;
    private final int failed;
    private final int skipped;

    public DispatchReport(int delivered, int failed, int skipped) {
        this.delivered = delivered;
        this.failed = failed;
        this.skipped = skipped;
    }

    public static DispatchReport empty() {
        return new DispatchReport(0, 0, 0);
    }

    public static DispatchReport of(List<Outcome> outcomes) {
        int delivered = 0;
        int failed = 0;
        int skipped = 0;
        for (Outcome outcome : outcomes) {
            switch (outcome) {
                case DELIVERED:
                    delivered++;
                    break;
                case FAILED:
                    failed++;
                    break;
                default:
                    skipped++;
            }
        }
        return new DispatchReport(delivered, failed, skipped);
    }

    public int getAttempted() {
        return delivered + failed;
    }
}
