package quest.gekko.outlier.web.dto;

import java.time.LocalDate;

public record RefreshStartedResponse(int candidates, LocalDate snapshotDate) {}
