package app.lingvo.core.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class StudyConfig {

    @Bean
    public Clock studyClock(StudyProps props) {
        return Clock.system(ZoneId.of(props.zone()));
    }
}
