package com.lux032.trackresolver.service;

import com.lux032.trackresolver.config.ResolverConfig;
import com.lux032.trackresolver.model.BatchVerificationResult;
import com.lux032.trackresolver.model.ReplacementProgress;
import com.lux032.trackresolver.model.ReplacementResult;
import com.lux032.trackresolver.model.ReplacementStage;
import com.lux032.trackresolver.model.ResolvedTrack;
import com.lux032.trackresolver.model.RunOutcome;
import com.lux032.trackresolver.model.TrackQuery;
import com.lux032.trackresolver.model.VerificationStatus;
import com.lux032.trackresolver.util.I18nUtil;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 自动替换编排器
 * 对验证失败的曲目请求替换、验证替换、删除原曲目,最多尝试 maxRetries 次,
 * 仍未解决的曲目交给用户处理
 * <p>
 * 每首原失败曲目占一个槽位,第 i 个替换对应第 i 个未解决的槽位;
 * 替换验证失败时,该替换进入槽位参与下一次尝试
 */
@Slf4j
public class AutoReplacementOrchestrator {

    private static final Map<ReplacementStage, Set<ReplacementStage>> TRANSITIONS =
        new EnumMap<>(ReplacementStage.class);

    static {
        TRANSITIONS.put(ReplacementStage.REQUESTING,
            EnumSet.of(ReplacementStage.VERIFYING, ReplacementStage.RETRYING, ReplacementStage.FAILED));
        TRANSITIONS.put(ReplacementStage.VERIFYING,
            EnumSet.of(ReplacementStage.DELETING, ReplacementStage.RETRYING, ReplacementStage.FAILED));
        TRANSITIONS.put(ReplacementStage.DELETING,
            EnumSet.of(ReplacementStage.COMPLETE, ReplacementStage.RETRYING, ReplacementStage.FAILED));
        TRANSITIONS.put(ReplacementStage.RETRYING, EnumSet.of(ReplacementStage.REQUESTING, ReplacementStage.FAILED));
        TRANSITIONS.put(ReplacementStage.COMPLETE, EnumSet.noneOf(ReplacementStage.class));
        TRANSITIONS.put(ReplacementStage.FAILED, EnumSet.noneOf(ReplacementStage.class));
    }

    private static final int DEFAULT_MAX_RETRIES = 3;

    private final VerificationOrchestrator verifier;
    private final int defaultMaxRetries;

    public AutoReplacementOrchestrator(VerificationOrchestrator verifier) {
        this(verifier, DEFAULT_MAX_RETRIES);
    }

    public AutoReplacementOrchestrator(VerificationOrchestrator verifier, ResolverConfig config) {
        this(verifier, config.getReplacementMaxRetries());
    }

    /**
     * @param defaultMaxRetries 请求未指定 maxRetries 时的最大尝试次数
     */
    public AutoReplacementOrchestrator(VerificationOrchestrator verifier, int defaultMaxRetries) {
        this.verifier = verifier;
        this.defaultMaxRetries = defaultMaxRetries;
    }

    /**
     * 执行一轮自动替换,不会因协作方异常而抛出
     */
    public ReplacementResult autoReplaceFailed(ReplacementRequest request) {
        int maxRetries = request.getMaxRetries() != null ? request.getMaxRetries() : defaultMaxRetries;
        if (maxRetries < 1) {
            throw new IllegalArgumentException("maxRetries must be at least 1");
        }
        Attempt state = new Attempt(request, maxRetries);
        log.info("第 {} 轮自动替换开始: {} 首失败曲目, 最多 {} 次尝试",
            request.getRound(), state.slots.size(), maxRetries);

        if (state.openSlots().isEmpty()) {
            state.stage = ReplacementStage.COMPLETE;
            state.emit(I18nUtil.getMessage("replace.nothing.to.do"));
            return state.finish(RunOutcome.COMPLETED);
        }

        while (true) {
            if (request.getRunControl().shouldStop()) {
                RunOutcome outcome = request.getRunControl().stopOutcome();
                log.warn("第 {} 轮自动替换已停止: {}", request.getRound(), outcome);
                state.moveTo(ReplacementStage.FAILED, I18nUtil.getMessage("replace.stopped", outcome));
                return state.finish(outcome);
            }

            state.attempts++;
            if (runAttempt(state)) {
                state.moveTo(ReplacementStage.COMPLETE,
                    I18nUtil.getMessage("replace.complete", state.slots.size()));
                return state.finish(RunOutcome.COMPLETED);
            }

            if (state.attempts >= maxRetries) {
                int remaining = state.openSlots().size();
                log.warn("第 {} 轮自动替换已达最大尝试次数, 仍有 {} 首需要用户处理", request.getRound(), remaining);
                state.moveTo(ReplacementStage.FAILED, I18nUtil.getMessage("replace.exhausted", remaining));
                return state.finish(RunOutcome.COMPLETED);
            }
            state.moveTo(ReplacementStage.RETRYING, I18nUtil.getMessage("replace.retrying",
                state.openSlots().size(), state.attempts + 1, maxRetries));
        }
    }

    /**
     * 依次执行多轮,结果按轮次保存
     */
    public Map<Integer, ReplacementResult> autoReplaceRounds(List<ReplacementRequest> requests) {
        Map<Integer, ReplacementResult> results = new LinkedHashMap<>();
        for (ReplacementRequest request : requests) {
            results.put(request.getRound(), autoReplaceFailed(request));
        }
        return results;
    }

    /**
     * 执行一次尝试
     * @return 所有槽位都已解决时返回 true
     */
    private boolean runAttempt(Attempt state) {
        ReplacementRequest request = state.request;
        List<Slot> open = state.openSlots();
        state.moveTo(ReplacementStage.REQUESTING, I18nUtil.getMessage("replace.requesting", open.size()));

        try {
            List<TrackQuery> replacements = request.getGenerator().requestReplacements(open.size(), request.getContext());
            if (replacements == null || replacements.isEmpty()) {
                log.warn("第 {} 轮第 {} 次尝试: 未获得替换曲目", request.getRound(), state.attempts);
                return false;
            }
            if (replacements.size() > open.size()) {
                replacements = replacements.subList(0, open.size());
            }

            state.moveTo(ReplacementStage.VERIFYING, I18nUtil.getMessage("replace.verifying", replacements.size()));
            BatchVerificationResult verification = verifier.verifyBatch(replacements, null, request.getRunControl());

            List<Slot> verifiedSlots = new ArrayList<>();
            List<ResolvedTrack> verifiedTracks = new ArrayList<>();
            List<TrackQuery> failedReplacements = new ArrayList<>();
            for (int i = 0; i < replacements.size(); i++) {
                ResolvedTrack resolved = verification.getTracks().get(i);
                if (resolved.isVerified()) {
                    verifiedSlots.add(open.get(i));
                    verifiedTracks.add(resolved);
                } else {
                    failedReplacements.add(replacements.get(i));
                }
            }

            List<String> deletedIds = new ArrayList<>();
            if (!verifiedSlots.isEmpty()) {
                enterDeleting(state, verifiedSlots.size());
                for (Slot slot : verifiedSlots) {
                    if (slot.original.getId() != null) {
                        deletedIds.add(slot.original.getId());
                    }
                }
                if (!deletedIds.isEmpty()) {
                    request.getDeleter().deleteTracks(deletedIds);
                }
            }

            // 删除成功后才提交本次结果;批次中途停止时未处理的替换不顶替槽位中的曲目
            boolean stopped = verification.getSummary().getOutcome() != RunOutcome.COMPLETED;
            for (int i = 0; i < replacements.size(); i++) {
                Slot slot = open.get(i);
                ResolvedTrack resolved = verification.getTracks().get(i);
                if (resolved.isVerified()) {
                    slot.resolved = true;
                } else if (!stopped || resolved.getStatus() != VerificationStatus.SKIPPED) {
                    slot.current = replacements.get(i);
                }
            }
            state.verifiedReplacements.addAll(verifiedTracks);
            state.deletedIds.addAll(deletedIds);
            log.info("第 {} 轮第 {} 次尝试: {} 首替换验证通过, {} 首失败",
                request.getRound(), state.attempts, verifiedTracks.size(), failedReplacements.size());

            return state.openSlots().isEmpty();
        } catch (IOException | RuntimeException e) {
            log.warn("第 {} 轮第 {} 次尝试失败: {}", request.getRound(), state.attempts, e.getMessage());
            return false;
        }
    }

    /**
     * 只有存在验证通过的替换时才能进入删除阶段
     */
    private static void enterDeleting(Attempt state, int verifiedCount) {
        if (verifiedCount < 1) {
            throw new IllegalStateException("cannot delete without a verified replacement");
        }
        state.moveTo(ReplacementStage.DELETING, I18nUtil.getMessage("replace.deleting", verifiedCount));
    }

    private static final class Slot {
        private final TrackQuery original;
        private TrackQuery current;
        private boolean resolved;

        private Slot(TrackQuery original) {
            this.original = original;
            this.current = original;
        }
    }

    /**
     * 单次 autoReplaceFailed 调用的可变状态
     */
    private static final class Attempt {
        private final ReplacementRequest request;
        private final int maxRetries;
        private final List<Slot> slots = new ArrayList<>();
        private final List<ResolvedTrack> verifiedReplacements = new ArrayList<>();
        private final List<String> deletedIds = new ArrayList<>();
        private final List<ReplacementProgress> progress = new ArrayList<>();
        private ReplacementStage stage;
        private int attempts;

        private Attempt(ReplacementRequest request, int maxRetries) {
            this.request = request;
            this.maxRetries = maxRetries;
            for (TrackQuery track : request.getFailedTracks()) {
                slots.add(new Slot(track));
            }
        }

        private List<Slot> openSlots() {
            List<Slot> open = new ArrayList<>();
            for (Slot slot : slots) {
                if (!slot.resolved) {
                    open.add(slot);
                }
            }
            return open;
        }

        private void moveTo(ReplacementStage next, String message) {
            if (stage != null && !TRANSITIONS.get(stage).contains(next)) {
                throw new IllegalStateException("illegal replacement transition " + stage + " -> " + next);
            }
            stage = next;
            emit(message);
        }

        private void emit(String message) {
            ReplacementProgress event = new ReplacementProgress(
                request.getRound(), stage, attempts, maxRetries, message);
            progress.add(event);
            if (request.getListener() != null) {
                try {
                    request.getListener().accept(event);
                } catch (RuntimeException e) {
                    log.warn("替换进度回调异常: {}", e.getMessage(), e);
                }
            }
        }

        private ReplacementResult finish(RunOutcome outcome) {
            List<TrackQuery> stillFailed = new ArrayList<>();
            for (Slot slot : slots) {
                if (!slot.resolved) {
                    stillFailed.add(slot.current);
                }
            }
            boolean success = stillFailed.isEmpty();
            return ReplacementResult.builder()
                .success(success)
                .round(request.getRound())
                .attempts(attempts)
                .replacedCount(slots.size() - stillFailed.size())
                .stillFailedTracks(stillFailed)
                .userActionNeeded(!success)
                .verifiedReplacements(verifiedReplacements)
                .deletedTrackIds(deletedIds)
                .outcome(outcome)
                .progress(progress)
                .build();
        }
    }
}
