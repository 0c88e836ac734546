package app.mstudio.render.budget;

import app.mstudio.render.config.BudgetProps;
import app.mstudio.render.domain.entity.RenderLedgerEntryEntity;
import app.mstudio.render.domain.entity.WorkspaceRenderSettingsEntity;
import app.mstudio.render.domain.type.LedgerStatus;
import app.mstudio.render.repository.RenderLedgerRepository;
import app.mstudio.render.repository.WorkspaceRenderSettingsRepository;
import app.mstudio.render.support.RenderEvents;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Optional;
import java.util.UUID;

/**
 * Spend and attempt limits per workspace, backed by the render ledger.
 * <p>
 * The check reads aggregates without locking. Two concurrent submissions may both pass near the limit; the
 * overshoot is bounded by one render.
 */
@Service
public class RenderBudgetService {

    private static final int ERROR_MESSAGE_MAX = 500;

    private final RenderLedgerRepository ledgerRepository;
    private final WorkspaceRenderSettingsRepository settingsRepository;
    private final BudgetProps props;
    private final RenderEvents events;
    private final Clock clock;

    public RenderBudgetService(RenderLedgerRepository ledgerRepository,
                               WorkspaceRenderSettingsRepository settingsRepository,
                               BudgetProps props,
                               RenderEvents events,
                               Clock clock) {
        this.ledgerRepository = ledgerRepository;
        this.settingsRepository = settingsRepository;
        this.props = props;
        this.events = events;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public BudgetCheckResult checkBudget(UUID workspaceId, BigDecimal estimatedCostUsd) {
        BigDecimal estimate = estimatedCostUsd == null ? BigDecimal.ZERO : estimatedCostUsd;
        BudgetSettings settings = settingsFor(workspaceId);
        BudgetWindow window = currentWindow();

        BigDecimal spent = ledgerRepository.sumEstimatedCostSince(workspaceId, window.monthStart(), LedgerStatus.blocked);
        spent = spent == null ? BigDecimal.ZERO : spent;
        long attempts = ledgerRepository.countAttemptsSince(workspaceId, window.dayStart(), LedgerStatus.blocked);

        BigDecimal limit = settings.monthlyLimitUsd();
        int dailyLimit = settings.dailyAttemptsLimit();
        events.info("BUDGET:CHECK", "workspaceId={} monthlySpent={} monthlyLimit={} dailyAttempts={} dailyLimit={} estimate={}",
                workspaceId, money(spent), money(limit), attempts, dailyLimit, money(estimate));

        String reason = null;
        if (spent.add(estimate).compareTo(limit) > 0) {
            reason = "Monthly render budget exceeded: $" + money(spent) + " spent of $" + money(limit) + " limit";
        } else if (attempts >= dailyLimit) {
            reason = "Daily render limit reached: " + attempts + "/" + dailyLimit + " attempts today";
        }
        if (reason != null) {
            events.warn("BUDGET:EXCEEDED", "workspaceId={} reason={}", workspaceId, reason);
        }
        return new BudgetCheckResult(reason == null, reason, spent, limit, attempts, dailyLimit);
    }

    @Transactional
    public Long recordSubmission(LedgerSubmission submission) {
        RenderLedgerEntryEntity entry = newEntry(submission, LedgerStatus.submitted);
        RenderLedgerEntryEntity saved = ledgerRepository.save(entry);
        events.info("LEDGER:RECORD", "id={} workspaceId={} jobId={} provider={} estimate={}",
                saved.getId(), submission.workspaceId(), submission.jobId(), submission.provider(),
                money(submission.estimatedCostUsd()));
        return saved.getId();
    }

    /**
     * Keeps a record of a rejected proposal. Blocked entries never count toward spend or attempts.
     */
    @Transactional
    public Long recordBlocked(LedgerSubmission submission, String reason) {
        RenderLedgerEntryEntity entry = newEntry(submission, LedgerStatus.blocked);
        entry.setErrorMessage(RenderEvents.truncate(reason, ERROR_MESSAGE_MAX));
        entry.setCompletedAt(entry.getSubmittedAt());
        RenderLedgerEntryEntity saved = ledgerRepository.save(entry);
        events.info("LEDGER:RECORD", "id={} workspaceId={} provider={} status=blocked",
                saved.getId(), submission.workspaceId(), submission.provider());
        return saved.getId();
    }

    @Transactional
    public void recordOutcome(Long entryId, LedgerStatus status, BigDecimal actualCostUsd, String errorMessage) {
        if (entryId == null) {
            return;
        }
        if (status != LedgerStatus.completed && status != LedgerStatus.failed) {
            throw new IllegalArgumentException("Outcome must be completed or failed: " + status);
        }
        Optional<RenderLedgerEntryEntity> stored = ledgerRepository.findById(entryId);
        if (stored.isEmpty()) {
            events.warn("BUDGET:OUTCOME", "ledger entry missing id={}", entryId);
            return;
        }
        RenderLedgerEntryEntity entry = stored.get();
        if (entry.getStatus() != LedgerStatus.submitted) {
            return;
        }
        entry.setStatus(status);
        if (actualCostUsd != null) {
            entry.setActualCostUsd(actualCostUsd);
        } else if (status == LedgerStatus.completed) {
            entry.setActualCostUsd(entry.getEstimatedCostUsd());
        }
        entry.setErrorMessage(RenderEvents.truncate(errorMessage, ERROR_MESSAGE_MAX));
        entry.setCompletedAt(Instant.now(clock));
        ledgerRepository.save(entry);
        events.info("BUDGET:OUTCOME", "id={} status={} actualCost={}", entryId, status, entry.getActualCostUsd());
    }

    @Transactional
    public void attachProviderJob(Long entryId, String providerJobId) {
        if (entryId == null) {
            return;
        }
        ledgerRepository.findById(entryId).ifPresent(entry -> {
            entry.setProviderJobId(providerJobId);
            ledgerRepository.save(entry);
        });
    }

    @Transactional(readOnly = true)
    public BudgetSettings settingsFor(UUID workspaceId) {
        Optional<WorkspaceRenderSettingsEntity> stored = settingsRepository.findById(workspaceId);
        BigDecimal monthly = stored.map(WorkspaceRenderSettingsEntity::getMonthlyBudgetUsd)
                .orElse(props.defaultMonthlyUsd());
        Integer daily = stored.map(WorkspaceRenderSettingsEntity::getDailyAttemptsMax)
                .orElse(props.defaultDailyAttempts());
        return new BudgetSettings(monthly, daily);
    }

    private RenderLedgerEntryEntity newEntry(LedgerSubmission submission, LedgerStatus status) {
        RenderLedgerEntryEntity entry = new RenderLedgerEntryEntity();
        entry.setWorkspaceId(submission.workspaceId());
        entry.setJobId(submission.jobId());
        entry.setProvider(submission.provider());
        entry.setProviderJobId(submission.providerJobId());
        entry.setDurationSeconds(submission.durationSeconds());
        entry.setAspectRatio(submission.aspectRatio());
        entry.setPromptLength(submission.promptLength());
        entry.setEstimatedCostUsd(submission.estimatedCostUsd() == null ? BigDecimal.ZERO : submission.estimatedCostUsd());
        entry.setStatus(status);
        entry.setSubmittedAt(Instant.now(clock));
        return entry;
    }

    private BudgetWindow currentWindow() {
        ZoneId zone = props.zoneId();
        LocalDate today = LocalDate.now(clock.withZone(zone));
        Instant monthStart = today.withDayOfMonth(1).atStartOfDay(zone).toInstant();
        Instant dayStart = today.atStartOfDay(zone).toInstant();
        return new BudgetWindow(monthStart, dayStart);
    }

    private static String money(BigDecimal value) {
        return value == null ? "0.00" : value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private record BudgetWindow(Instant monthStart, Instant dayStart) {
    }
}
