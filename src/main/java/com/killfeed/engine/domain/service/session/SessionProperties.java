package com.killfeed.engine.domain.service.session;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "killfeed.session")
public class SessionProperties {

    private long modeDebounceMs = 2000;
    private String lastUserFile = "./data/last-user.txt";
    private int locationHistorySize = 50;
}
