package by.greenmobile.flatslabcalc;

import by.greenmobile.flatslabcalc.config.DesignProperties;
import by.greenmobile.flatslabcalc.config.UnitsConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@EnableConfigurationProperties(value = {UnitsConfig.class, DesignProperties.class})
@SpringBootApplication
public class FlatSlabCalcApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlatSlabCalcApplication.class, args);
    }

}
