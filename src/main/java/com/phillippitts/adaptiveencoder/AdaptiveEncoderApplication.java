package com.phillippitts.adaptiveencoder;

import com.phillippitts.adaptiveencoder.config.properties.AnalysisProperties;
import com.phillippitts.adaptiveencoder.config.properties.CropProperties;
import com.phillippitts.adaptiveencoder.config.properties.EncodeProperties;
import com.phillippitts.adaptiveencoder.config.properties.EncoderBinariesProperties;
import com.phillippitts.adaptiveencoder.config.properties.OracleProperties;
import com.phillippitts.adaptiveencoder.config.properties.ProgressProperties;
import com.phillippitts.adaptiveencoder.config.properties.WorkspaceProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({
        EncoderBinariesProperties.class,
        WorkspaceProperties.class,
        AnalysisProperties.class,
        CropProperties.class,
        OracleProperties.class,
        ProgressProperties.class,
        EncodeProperties.class
})
public class AdaptiveEncoderApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdaptiveEncoderApplication.class, args);
    }

}
