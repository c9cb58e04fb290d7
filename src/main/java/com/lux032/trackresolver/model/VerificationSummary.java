package com.lux032.trackresolver.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * 批量验证汇总
 * 批次结束后不可变,满足 verified + failed + skipped == total
 */
@Value
public class VerificationSummary {

    int total;
    int verified;
    int failed;
    int skipped;
    List<FailedTrack> failures;
    RunOutcome outcome;

    /**
     * 失败曲目及原因
     */
    @Value
    public static class FailedTrack {
        String artist;
        String title;
        String reason;
    }

    public static Accumulator accumulator(int total) {
        return new Accumulator(total);
    }

    /**
     * 批次进行中的计数器,只增不减
     */
    public static final class Accumulator {

        private final int total;
        private int verified;
        private int failed;
        private int skipped;
        private final List<FailedTrack> failures = new ArrayList<>();

        private Accumulator(int total) {
            this.total = total;
        }

        public void recordVerified() {
            verified++;
            checkBounds();
        }

        public void recordFailed(String artist, String title, String reason) {
            failed++;
            failures.add(new FailedTrack(artist, title, reason));
            checkBounds();
        }

        public void recordSkipped() {
            skipped++;
            checkBounds();
        }

        public int getVerified() {
            return verified;
        }

        public int getFailed() {
            return failed;
        }

        public int processed() {
            return verified + failed + skipped;
        }

        public VerificationSummary build(RunOutcome outcome) {
            if (processed() != total) {
                throw new IllegalStateException(
                    "summary incomplete: " + processed() + " of " + total + " tracks recorded");
            }
            return new VerificationSummary(total, verified, failed, skipped, List.copyOf(failures), outcome);
        }

        private void checkBounds() {
            if (processed() > total) {
                throw new IllegalStateException("more tracks recorded than submitted: " + total);
            }
        }
    }
}
