package com.phillippitts.alarmblock;

import com.phillippitts.alarmblock.config.properties.AlarmProperties;
import com.phillippitts.alarmblock.config.properties.AudioProperties;
import com.phillippitts.alarmblock.config.properties.SettingsProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        AlarmProperties.class,
        SettingsProperties.class,
        AudioProperties.class
})
public class AlarmBlockApplication {

    public static void main(String[] args) {
        SpringApplication.run(AlarmBlockApplication.class, args);
    }

}
