package quest.gekko.outlier.service.core;

import quest.gekko.outlier.domain.BaselineSource;

import java.math.BigDecimal;

public record BaselineEstimate(BigDecimal baseline, BaselineSource source, int historyUsed) {

    public boolean fromChannelHistory() {
        return source == BaselineSource.CHANNEL_HISTORY;
    }
}
