package quest.gekko.outlier.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.outlier.config.TrackerProperties;

import java.util.List;

@Repository
@RequiredArgsConstructor
public class OutlierSampleRepository {
    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final StatementTimeouts statementTimeouts;
    private final TrackerProperties.Sampler props;

    @Transactional(readOnly = true)
    public List<SampledVideo> findPass(SampleQuery query) {
        statementTimeouts.bound(props.statementTimeout());
        return jdbcTemplate.query(query.sql(), query.params(),
                (rs, rowNum) -> new SampledVideo(rs.getString("id"), rs.getDouble("random_sort")));
    }
}
