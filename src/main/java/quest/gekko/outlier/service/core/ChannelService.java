package quest.gekko.outlier.service.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.outlier.domain.Channel;
import quest.gekko.outlier.repository.ChannelRepository;
import quest.gekko.outlier.repository.VideoRepository;

import java.time.Clock;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ChannelService {
    private final ChannelRepository channelRepository;
    private final VideoRepository videoRepository;
    private final Clock clock;

    public List<Channel> findInstitutional() {
        return channelRepository.findByInstitutionalTrueOrderByTitleAsc();
    }

    /**
     * Sets the institutional flag on the channel and on every one of its videos in the same
     * transaction, so the sampler's per-video column never disagrees with the channel.
     *
     * @return number of video rows updated
     */
    @Transactional
    public int markInstitutional(final String channelId, final boolean institutional) {
        Channel channel = channelRepository.findById(channelId)
                .orElseThrow(() -> new ChannelNotFoundException(channelId));
        channel.setInstitutional(institutional);
        channel.setUpdatedAt(clock.instant());
        channelRepository.save(channel);

        int videos = videoRepository.updateInstitutionalFlag(channelId, institutional);
        log.info("Channel {} institutional={} ({} videos)", channelId, institutional, videos);
        return videos;
    }
}
