package quest.gekko.outlier.service.core;

import java.time.LocalDate;

public record QuotaStatus(LocalDate date, long used, long remaining, long total) {}
