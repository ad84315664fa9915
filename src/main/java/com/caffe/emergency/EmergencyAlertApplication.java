package com.caffe.emergency;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import jakarta.annotation.PostConstruct;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.TimeZone;

@SpringBootApplication
@Slf4j
public class EmergencyAlertApplication {

    @Value("${app.timezone:America/Jamaica}")
    private String timezone;

    /**
     * Ledger timestamps are UTC instants; the default zone only affects log and message formatting.
     */
    @PostConstruct
    public void init() {
        TimeZone.setDefault(TimeZone.getTimeZone(timezone));
        log.info("✅ Application timezone set to: {}", TimeZone.getDefault().getID());
        log.info("✅ Current local time: {}", ZonedDateTime.now(ZoneId.of(timezone))
                .format(DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")));
    }

    public static void main(String[] args) {
        SpringApplication.run(EmergencyAlertApplication.class, args);
    }
}
