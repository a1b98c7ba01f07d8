package quest.gekko.outlier.web.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.List;

public record BulkClassifyRequest(@NotEmpty @Size(max = 1000) List<String> videoIds) {}
