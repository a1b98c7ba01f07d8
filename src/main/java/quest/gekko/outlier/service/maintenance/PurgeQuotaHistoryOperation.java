package quest.gekko.outlier.service.maintenance;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import quest.gekko.outlier.service.core.QuotaLedger;

@Component
@RequiredArgsConstructor
public class PurgeQuotaHistoryOperation implements MaintenanceOperation {
    private final QuotaLedger quotaLedger;

    @Override
    public String name() {
        return "purge-quota-history";
    }

    @Override
    public int version() {
        return 1;
    }

    @Override
    public String description() {
        return "Delete quota counters older than the retention window";
    }

    @Override
    public boolean recurring() {
        return true;
    }

    @Override
    public long apply() {
        return quotaLedger.purgeHistory();
    }
}
