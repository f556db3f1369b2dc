package co.fanki.recipegen.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Archive configuration.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class ArchiveConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            ArchiveConfiguration.class);

    /**
     * The clock archive records are stamped with.
     *
     * @param timezone the zone id the archive works in
     * @return a system clock in that zone
     */
    @Bean
    public Clock archiveClock(
            @Value("${recipegen.archive.timezone:UTC}") final String timezone) {
        final ZoneId zone = ZoneId.of(timezone);
        LOG.debug("Archive timezone: {}", zone);
        return Clock.system(zone);
    }

}
