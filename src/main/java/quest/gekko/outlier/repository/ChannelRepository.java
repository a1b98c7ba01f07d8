package quest.gekko.outlier.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.outlier.domain.Channel;

import java.util.List;

public interface ChannelRepository extends JpaRepository<Channel, String> {
    List<Channel> findByInstitutionalTrueOrderByTitleAsc();
}
